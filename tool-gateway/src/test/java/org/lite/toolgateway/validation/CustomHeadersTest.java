package org.lite.toolgateway.validation;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CustomHeadersTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void testParsesStringHeaders() {
        Map<String, String> headers = CustomHeaders.parse(objectMapper, "{\"X-Instance\":\"eu-1\",\"X-Trace\":\"on\"}");

        assertEquals(Map.of("X-Instance", "eu-1", "X-Trace", "on"), headers);
    }

    @Test
    void testBlankMeansNoHeaders() {
        assertTrue(CustomHeaders.parse(objectMapper, "  ").isEmpty());
        assertTrue(CustomHeaders.parse(objectMapper, null).isEmpty());
    }

    @Test
    void testGatewayOwnedHeadersAreRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> CustomHeaders.parse(objectMapper, "{\"authorization\":\"Basic abc\"}"));
        assertThrows(IllegalArgumentException.class,
                () -> CustomHeaders.parse(objectMapper, "{\"Host\":\"internal.local\"}"));
        assertThrows(IllegalArgumentException.class,
                () -> CustomHeaders.parse(objectMapper, "{\"Content-Length\":\"0\"}"));
    }

    @Test
    void testMalformedInputIsRejectedWithoutEchoingValues() {
        IllegalArgumentException notObject = assertThrows(IllegalArgumentException.class,
                () -> CustomHeaders.parse(objectMapper, "[\"secret-value\"]"));
        assertFalse(notObject.getMessage().contains("secret-value"));

        IllegalArgumentException injected = assertThrows(IllegalArgumentException.class,
                () -> CustomHeaders.parse(objectMapper, "{\"X-Api-Key\":\"secret-value\\r\\nX-Evil: 1\"}"));
        assertFalse(injected.getMessage().contains("secret-value"));

        assertThrows(IllegalArgumentException.class, () -> CustomHeaders.parse(objectMapper, "{\"X-Count\":5}"));
        assertThrows(IllegalArgumentException.class, () -> CustomHeaders.parse(objectMapper, "{\"bad header\":\"v\"}"));
        assertThrows(IllegalArgumentException.class, () -> CustomHeaders.parse(objectMapper, "{not json"));
    }
}
