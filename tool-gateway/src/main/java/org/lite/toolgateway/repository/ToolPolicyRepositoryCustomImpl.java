package org.lite.toolgateway.repository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.toolgateway.entity.ToolPolicy;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@RequiredArgsConstructor
public class ToolPolicyRepositoryCustomImpl implements ToolPolicyRepositoryCustom {

    private final ReactiveMongoTemplate reactiveMongoTemplate;

    @Override
    public Mono<ToolPolicy> upsertForTenant(String tenantId,
                                            boolean toolsEnabled,
                                            List<String> allowedTools,
                                            Integer rateLimitPerMinute,
                                            Integer maxToolCallsPerRun,
                                            int defaultRateLimitPerMinute,
                                            int defaultMaxToolCallsPerRun,
                                            String actorUserId) {
        LocalDateTime now = LocalDateTime.now();
        Query query = new Query(Criteria.where(ToolPolicy.FIELD_TENANT_ID).is(tenantId));

        Update update = new Update()
                .set(ToolPolicy.FIELD_TOOLS_ENABLED, toolsEnabled)
                .set(ToolPolicy.FIELD_UPDATED_AT, now)
                .set(ToolPolicy.FIELD_UPDATED_BY, actorUserId)
                .setOnInsert(ToolPolicy.FIELD_CREATED_AT, now);

        if (allowedTools != null) {
            update.set(ToolPolicy.FIELD_ALLOWED_TOOLS, new ArrayList<>(allowedTools));
        } else {
            update.setOnInsert(ToolPolicy.FIELD_ALLOWED_TOOLS, new ArrayList<String>());
        }
        if (rateLimitPerMinute != null) {
            update.set(ToolPolicy.FIELD_RATE_LIMIT_PER_MINUTE, rateLimitPerMinute);
        } else {
            update.setOnInsert(ToolPolicy.FIELD_RATE_LIMIT_PER_MINUTE, defaultRateLimitPerMinute);
        }
        if (maxToolCallsPerRun != null) {
            update.set(ToolPolicy.FIELD_MAX_TOOL_CALLS_PER_RUN, maxToolCallsPerRun);
        } else {
            update.setOnInsert(ToolPolicy.FIELD_MAX_TOOL_CALLS_PER_RUN, defaultMaxToolCallsPerRun);
        }

        return reactiveMongoTemplate.findAndModify(query, update,
                        FindAndModifyOptions.options().upsert(true).returnNew(true), ToolPolicy.class)
                // Two first-time upserts can race to insert; the loser retries as an update
                .retryWhen(Retry.max(1)
                        .filter(DuplicateKeyException.class::isInstance)
                        .doBeforeRetry(signal -> log.info("Concurrent policy insert for tenant {}, retrying as update",
                                tenantId)));
    }
}
