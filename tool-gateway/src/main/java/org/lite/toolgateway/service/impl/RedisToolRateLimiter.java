package org.lite.toolgateway.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.lite.toolgateway.config.ToolGatewayProperties;
import org.lite.toolgateway.enums.RateLimitDecision;
import org.lite.toolgateway.service.ToolRateLimiter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Shared-store limiter for multi-instance deployments: a fixed minute window
 * per tenant and a per-run counter, checked and incremented in one Lua script.
 * Keys share the tenant hash tag so the script stays single-slot on a cluster.
 */
@Service
@Slf4j
@ConditionalOnProperty(prefix = "tool-gateway.rate-limit", name = "store", havingValue = "redis")
public class RedisToolRateLimiter implements ToolRateLimiter {

    static final long ACQUIRED = 0L;
    static final long MINUTE_LIMIT_EXCEEDED = 1L;
    static final long RUN_LIMIT_EXCEEDED = 2L;

    private static final String LUA_SCRIPT = """
        local minuteCount = tonumber(redis.call('GET', KEYS[1]) or '0')
        if minuteCount >= tonumber(ARGV[1]) then
            return 1
        end
        if #KEYS > 1 then
            local runCount = tonumber(redis.call('GET', KEYS[2]) or '0')
            if runCount >= tonumber(ARGV[2]) then
                return 2
            end
            if redis.call('INCR', KEYS[2]) == 1 then
                redis.call('EXPIRE', KEYS[2], tonumber(ARGV[4]))
            end
        end
        if redis.call('INCR', KEYS[1]) == 1 then
            redis.call('EXPIRE', KEYS[1], tonumber(ARGV[3]))
        end
        return 0
        """;

    private static final RedisScript<Long> SCRIPT = RedisScript.of(LUA_SCRIPT, Long.class);

    private final ReactiveStringRedisTemplate redisTemplate;
    private final Clock clock;
    private final Duration runCounterTtl;
    private final Duration redisTimeout;

    public RedisToolRateLimiter(ReactiveStringRedisTemplate redisTemplate,
                                ToolGatewayProperties properties,
                                Clock clock) {
        this.redisTemplate = redisTemplate;
        this.clock = clock;
        this.runCounterTtl = properties.getRateLimit().getRunCounterTtl();
        this.redisTimeout = properties.getRateLimit().getRedisTimeout();
        log.info("Using Redis tool rate limiter (run counter TTL {})", runCounterTtl);
    }

    @Override
    public Mono<RateLimitDecision> tryAcquire(String tenantId, String runId,
                                              int rateLimitPerMinute, int maxToolCallsPerRun) {
        long epochMinute = clock.millis() / 60_000L;
        List<String> keys = new ArrayList<>();
        keys.add(minuteKey(tenantId, epochMinute));
        if (runId != null) {
            keys.add(runKey(tenantId, runId));
        }
        List<String> args = List.of(
                String.valueOf(rateLimitPerMinute),
                String.valueOf(maxToolCallsPerRun),
                "120", // outlives the minute it counts
                String.valueOf(runCounterTtl.getSeconds()));

        // Errors propagate: an unreachable store must not admit calls
        return redisTemplate.execute(SCRIPT, keys, args)
                .next()
                .switchIfEmpty(Mono.error(() -> new IllegalStateException("Rate limit script returned no result")))
                .timeout(redisTimeout)
                .map(RedisToolRateLimiter::toDecision)
                .doOnError(e -> log.error("Redis rate limit check failed for tenant {}: {}", tenantId, e.getMessage()));
    }

    static String minuteKey(String tenantId, long epochMinute) {
        return "tool-gateway:{" + tenantId + "}:minute:" + epochMinute;
    }

    static String runKey(String tenantId, String runId) {
        return "tool-gateway:{" + tenantId + "}:run:" + runId;
    }

    private static RateLimitDecision toDecision(Long code) {
        if (code == MINUTE_LIMIT_EXCEEDED) {
            return RateLimitDecision.MINUTE_LIMIT_EXCEEDED;
        }
        if (code == RUN_LIMIT_EXCEEDED) {
            return RateLimitDecision.RUN_LIMIT_EXCEEDED;
        }
        if (code == ACQUIRED) {
            return RateLimitDecision.ACQUIRED;
        }
        throw new IllegalStateException("Unexpected rate limit script result " + code);
    }
}
