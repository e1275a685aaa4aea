package org.lite.toolgateway.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "tool-gateway")
@Data
public class ToolGatewayProperties {

    private Vault vault = new Vault();
    private Ssrf ssrf = new Ssrf();
    private Connector connector = new Connector();
    private RateLimit rateLimit = new RateLimit();
    private Policy policy = new Policy();
    private Audit audit = new Audit();

    // Bound on every Mongo read or write made while deciding or auditing a tool run
    private Duration persistenceTimeout = Duration.ofSeconds(3);

    @Data
    public static class Vault {
        private String masterKey; // base64, 32 bytes; injected from TOOL_GATEWAY_VAULT_MASTER_KEY
        private String keyContext = "integration-credentials";
    }

    @Data
    public static class Ssrf {
        private Duration dnsTimeout = Duration.ofSeconds(2);
    }

    @Data
    public static class Connector {
        private Duration timeout = Duration.ofSeconds(15);
        private Duration connectTimeout = Duration.ofSeconds(5);
        private int maxResponseBytes = 4 * 1024 * 1024;
    }

    @Data
    public static class RateLimit {
        private String store = "memory"; // memory or redis
        private Duration runCounterTtl = Duration.ofHours(24);
        private Duration redisTimeout = Duration.ofMillis(500);
    }

    @Data
    public static class Policy {
        private int defaultRateLimitPerMinute = 60;
        private int defaultMaxToolCallsPerRun = 10;
    }

    @Data
    public static class Audit {
        private int defaultPageSize = 50;
        private int maxPageSize = 200;

        /**
         * Clamp a requested page size into [1, maxPageSize]
         */
        public int resolvePageSize(Integer requested) {
            if (requested == null || requested < 1) {
                return defaultPageSize;
            }
            return Math.min(requested, maxPageSize);
        }
    }
}
