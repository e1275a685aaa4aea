package org.lite.toolgateway.repository;

import lombok.RequiredArgsConstructor;
import org.lite.toolgateway.entity.ProviderConfig;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@RequiredArgsConstructor
public class ProviderConfigRepositoryCustomImpl implements ProviderConfigRepositoryCustom {

    private final ReactiveMongoTemplate reactiveMongoTemplate;

    @Override
    public Mono<ProviderConfig> softDelete(String id, String tenantId) {
        Query query = new Query(Criteria.where("_id").is(id)
                .and("tenantId").is(tenantId)
                .and("deleted").is(false));

        // Both flags in one document update; version bump invalidates in-flight saves
        Update update = new Update()
                .set("deleted", true)
                .set("enabled", false)
                .set("updatedAt", LocalDateTime.now())
                .inc("version", 1);

        return reactiveMongoTemplate.findAndModify(query, update,
                FindAndModifyOptions.options().returnNew(true), ProviderConfig.class);
    }
}
