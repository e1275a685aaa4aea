package org.lite.toolgateway.connector;

import lombok.extern.slf4j.Slf4j;
import org.lite.toolgateway.enums.ProviderFamily;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Connector per provider family, collected from the application context.
 * Written during construction only, read-only afterwards.
 */
@Component
@Slf4j
public class ToolConnectorRegistry {

    private final Map<ProviderFamily, ToolConnector> connectors = new EnumMap<>(ProviderFamily.class);

    public ToolConnectorRegistry(List<ToolConnector> connectorBeans) {
        for (ToolConnector connector : connectorBeans) {
            ProviderFamily family = Objects.requireNonNull(connector.family(),
                    () -> "family() is null for connector " + connector.getClass().getName());
            ToolConnector previous = connectors.putIfAbsent(family, connector);
            if (previous != null) {
                throw new IllegalStateException("Duplicate connector for family " + family + ": "
                        + previous.getClass().getSimpleName() + " and " + connector.getClass().getSimpleName());
            }
            log.debug("Registered connector {} for family {}", connector.getClass().getSimpleName(), family);
        }
        log.info("Tool connectors registered for families {}", connectors.keySet());
    }

    public Optional<ToolConnector> forFamily(ProviderFamily family) {
        return Optional.ofNullable(connectors.get(family));
    }
}
