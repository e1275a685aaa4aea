package org.lite.toolgateway.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.lite.toolgateway.config.ToolGatewayProperties;
import org.lite.toolgateway.enums.RateLimitDecision;
import org.lite.toolgateway.service.ToolRateLimiter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single-instance limiter: a sliding 60 second window per tenant plus per-run
 * counters that expire after the configured TTL.
 */
@Service
@Slf4j
@ConditionalOnProperty(prefix = "tool-gateway.rate-limit", name = "store", havingValue = "memory", matchIfMissing = true)
public class InMemoryToolRateLimiter implements ToolRateLimiter {

    private static final Duration WINDOW = Duration.ofMinutes(1);

    private final Map<String, TenantWindow> tenants = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration runCounterTtl;

    public InMemoryToolRateLimiter(ToolGatewayProperties properties, Clock clock) {
        this.clock = clock;
        this.runCounterTtl = properties.getRateLimit().getRunCounterTtl();
        log.info("Using in-memory tool rate limiter (run counter TTL {})", runCounterTtl);
    }

    @Override
    public Mono<RateLimitDecision> tryAcquire(String tenantId, String runId,
                                              int rateLimitPerMinute, int maxToolCallsPerRun) {
        return Mono.fromSupplier(() -> tenants
                .computeIfAbsent(tenantId, key -> new TenantWindow())
                .tryAcquire(clock.instant(), runId, rateLimitPerMinute, maxToolCallsPerRun, runCounterTtl));
    }

    private record RunCounter(int count, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }

    /**
     * All state of one tenant, guarded by its own monitor; tenants never contend.
     */
    private static final class TenantWindow {

        private final Deque<Instant> admitted = new ArrayDeque<>();
        private final Map<String, RunCounter> runs = new HashMap<>();

        synchronized RateLimitDecision tryAcquire(Instant now, String runId,
                                                  int perMinute, int perRun, Duration ttl) {
            Instant windowStart = now.minus(WINDOW);
            while (!admitted.isEmpty() && !admitted.peekFirst().isAfter(windowStart)) {
                admitted.pollFirst();
            }
            runs.values().removeIf(counter -> counter.isExpired(now));

            if (admitted.size() >= perMinute) {
                return RateLimitDecision.MINUTE_LIMIT_EXCEEDED;
            }

            RunCounter counter = runId != null ? runs.get(runId) : null;
            if (runId != null && counter != null && counter.count() >= perRun) {
                return RateLimitDecision.RUN_LIMIT_EXCEEDED;
            }

            admitted.addLast(now);
            if (runId != null) {
                runs.put(runId, counter == null
                        ? new RunCounter(1, now.plus(ttl))
                        : new RunCounter(counter.count() + 1, counter.expiresAt()));
            }
            return RateLimitDecision.ACQUIRED;
        }
    }
}
