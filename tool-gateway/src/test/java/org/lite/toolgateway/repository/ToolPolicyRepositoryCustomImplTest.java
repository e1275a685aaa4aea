package org.lite.toolgateway.repository;

import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.lite.toolgateway.entity.ToolPolicy;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.UpdateDefinition;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ToolPolicyRepositoryCustomImplTest {

    private static final String TENANT = "tenant-a";

    @Mock
    private ReactiveMongoTemplate reactiveMongoTemplate;

    private ToolPolicyRepositoryCustomImpl repository;

    @BeforeEach
    void setUp() {
        repository = new ToolPolicyRepositoryCustomImpl(reactiveMongoTemplate);
    }

    @Test
    void testSuppliedValuesAreSetAndDefaultsOnlyApplyOnInsert() {
        // Given
        ToolPolicy stored = ToolPolicy.builder().tenantId(TENANT).build();
        when(reactiveMongoTemplate.findAndModify(any(Query.class), any(UpdateDefinition.class),
                any(FindAndModifyOptions.class), eq(ToolPolicy.class))).thenReturn(Mono.just(stored));

        // When
        StepVerifier.create(repository.upsertForTenant(TENANT, true, List.of("QUERY_INCIDENTS"),
                        30, null, 60, 10, "user-1"))
                .expectNext(stored)
                .verifyComplete();

        // Then
        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        ArgumentCaptor<UpdateDefinition> update = ArgumentCaptor.forClass(UpdateDefinition.class);
        ArgumentCaptor<FindAndModifyOptions> options = ArgumentCaptor.forClass(FindAndModifyOptions.class);
        verify(reactiveMongoTemplate).findAndModify(query.capture(), update.capture(), options.capture(),
                eq(ToolPolicy.class));

        assertEquals(new Document("tenantId", TENANT), query.getValue().getQueryObject());
        assertTrue(options.getValue().isUpsert());
        assertTrue(options.getValue().isReturnNew());

        Document set = (Document) update.getValue().getUpdateObject().get("$set");
        Document setOnInsert = (Document) update.getValue().getUpdateObject().get("$setOnInsert");
        assertEquals(true, set.get("toolsEnabled"));
        assertEquals(List.of("QUERY_INCIDENTS"), set.get("allowedTools"));
        assertEquals(30, set.get("rateLimitPerMinute"));
        assertEquals("user-1", set.get("updatedBy"));
        assertNotNull(set.get("updatedAt"));
        assertFalse(set.containsKey("maxToolCallsPerRun"));

        assertEquals(10, setOnInsert.get("maxToolCallsPerRun"));
        assertNotNull(setOnInsert.get("createdAt"));
        assertFalse(setOnInsert.containsKey("rateLimitPerMinute"));
        assertFalse(setOnInsert.containsKey("allowedTools"));
    }

    @Test
    void testOmittedAllowlistKeepsStoredValue() {
        when(reactiveMongoTemplate.findAndModify(any(Query.class), any(UpdateDefinition.class),
                any(FindAndModifyOptions.class), eq(ToolPolicy.class))).thenReturn(Mono.just(new ToolPolicy()));

        StepVerifier.create(repository.upsertForTenant(TENANT, false, null, null, null, 60, 10, "user-1"))
                .expectNextCount(1)
                .verifyComplete();

        ArgumentCaptor<UpdateDefinition> update = ArgumentCaptor.forClass(UpdateDefinition.class);
        verify(reactiveMongoTemplate).findAndModify(any(Query.class), update.capture(),
                any(FindAndModifyOptions.class), eq(ToolPolicy.class));
        Document set = (Document) update.getValue().getUpdateObject().get("$set");
        Document setOnInsert = (Document) update.getValue().getUpdateObject().get("$setOnInsert");
        assertFalse(set.containsKey("allowedTools"));
        assertEquals(List.of(), setOnInsert.get("allowedTools"));
        assertEquals(60, setOnInsert.get("rateLimitPerMinute"));
        assertEquals(10, setOnInsert.get("maxToolCallsPerRun"));
    }

    @Test
    void testConcurrentFirstInsertIsRetriedAsUpdate() {
        // Given - the first attempt loses the unique-index race, the retry finds the winner's row
        AtomicInteger attempts = new AtomicInteger();
        ToolPolicy stored = ToolPolicy.builder().tenantId(TENANT).build();
        when(reactiveMongoTemplate.findAndModify(any(Query.class), any(UpdateDefinition.class),
                any(FindAndModifyOptions.class), eq(ToolPolicy.class)))
                .thenReturn(Mono.defer(() -> attempts.getAndIncrement() == 0
                        ? Mono.error(new DuplicateKeyException("E11000 duplicate key error"))
                        : Mono.just(stored)));

        // When & Then
        StepVerifier.create(repository.upsertForTenant(TENANT, true, List.of("GET_RECORD"), null, null, 60, 10, "user-1"))
                .expectNext(stored)
                .verifyComplete();

        assertEquals(2, attempts.get());
    }

    @Test
    void testRepeatedDuplicateKeyIsNotRetriedForever() {
        AtomicInteger attempts = new AtomicInteger();
        when(reactiveMongoTemplate.findAndModify(any(Query.class), any(UpdateDefinition.class),
                any(FindAndModifyOptions.class), eq(ToolPolicy.class)))
                .thenReturn(Mono.defer(() -> {
                    attempts.incrementAndGet();
                    return Mono.error(new DuplicateKeyException("E11000 duplicate key error"));
                }));

        StepVerifier.create(repository.upsertForTenant(TENANT, true, List.of(), null, null, 60, 10, "user-1"))
                .expectErrorSatisfies(e -> assertInstanceOf(DuplicateKeyException.class, e.getCause() != null ? e.getCause() : e))
                .verify();

        assertEquals(2, attempts.get());
    }

    @Test
    void testOtherFailuresAreNotRetried() {
        AtomicInteger attempts = new AtomicInteger();
        when(reactiveMongoTemplate.findAndModify(any(Query.class), any(UpdateDefinition.class),
                any(FindAndModifyOptions.class), eq(ToolPolicy.class)))
                .thenReturn(Mono.defer(() -> {
                    attempts.incrementAndGet();
                    return Mono.error(new DataAccessResourceFailureException("mongo down"));
                }));

        StepVerifier.create(repository.upsertForTenant(TENANT, true, List.of(), null, null, 60, 10, "user-1"))
                .expectError(DataAccessResourceFailureException.class)
                .verify();

        assertEquals(1, attempts.get());
    }
}
