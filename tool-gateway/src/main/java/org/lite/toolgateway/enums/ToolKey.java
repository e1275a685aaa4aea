package org.lite.toolgateway.enums;

import java.util.Arrays;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Closed catalog of invokable tools. Every key belongs to exactly one provider
 * family and is read-only.
 */
public enum ToolKey {
    QUERY_TABLE(ProviderFamily.SERVICENOW),
    GET_RECORD(ProviderFamily.SERVICENOW),
    QUERY_INCIDENTS(ProviderFamily.SERVICENOW),
    QUERY_CHANGES(ProviderFamily.SERVICENOW);

    private final ProviderFamily family;

    ToolKey(ProviderFamily family) {
        this.family = family;
    }

    public ProviderFamily getFamily() {
        return family;
    }

    /**
     * Exact, case-sensitive lookup.
     */
    public static Optional<ToolKey> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(key -> key.name().equals(value))
                .findFirst();
    }

    /**
     * Entries of {@code values} that are not catalog members, in input order.
     */
    public static List<String> unknownValues(Collection<String> values) {
        return values.stream()
                .filter(value -> fromValue(value).isEmpty())
                .distinct()
                .collect(Collectors.toList());
    }

    /**
     * Parse recognized entries, dropping anything outside the catalog.
     */
    public static Set<ToolKey> parseKnown(Collection<String> values) {
        Set<ToolKey> keys = EnumSet.noneOf(ToolKey.class);
        if (values != null) {
            values.forEach(value -> fromValue(value).ifPresent(keys::add));
        }
        return keys;
    }

    public static Set<ProviderFamily> familiesOf(Collection<ToolKey> keys) {
        Set<ProviderFamily> families = EnumSet.noneOf(ProviderFamily.class);
        keys.forEach(key -> families.add(key.getFamily()));
        return families;
    }

    public static Set<String> names() {
        return Arrays.stream(values())
                .map(Enum::name)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
