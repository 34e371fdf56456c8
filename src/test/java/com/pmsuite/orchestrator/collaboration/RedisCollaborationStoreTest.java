package com.pmsuite.orchestrator.collaboration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.ReactiveSetOperations;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.when;

class RedisCollaborationStoreTest {

    private ReactiveSetOperations<String, String> setOperations;
    private RedisCollaborationStore store;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        ReactiveRedisTemplate<String, String> redisTemplate = Mockito.mock(ReactiveRedisTemplate.class);
        setOperations = Mockito.mock(ReactiveSetOperations.class);
        when(redisTemplate.opsForSet()).thenReturn(setOperations);
        store = new RedisCollaborationStore(redisTemplate);
    }

    @Test
    void markAccepted_shouldStoreNormalizedKey() {
        when(setOperations.add(RedisCollaborationStore.ACCEPTED_KEY, "lab-a|lab-b")).thenReturn(Mono.just(1L));

        assertTrue(store.markAccepted(LabPair.of("lab-b", "lab-a")).block());
    }

    @Test
    void markAccepted_shouldReportExistingPair() {
        when(setOperations.add(RedisCollaborationStore.ACCEPTED_KEY, "lab-a|lab-b")).thenReturn(Mono.just(0L));

        assertFalse(store.markAccepted(LabPair.of("lab-a", "lab-b")).block());
    }

    @Test
    void markAccepted_shouldKeepSeparatorInLabIdsUnambiguous() {
        when(setOperations.add(RedisCollaborationStore.ACCEPTED_KEY, "a%7Cb|c")).thenReturn(Mono.just(1L));
        when(setOperations.members(RedisCollaborationStore.ACCEPTED_KEY)).thenReturn(Flux.just("a%7Cb|c"));

        assertTrue(store.markAccepted(LabPair.of("c", "a|b")).block());
        assertEquals(Set.of(new LabPair("a|b", "c")), store.findAccepted().block());
    }

    @Test
    void findAccepted_shouldSkipMalformedEntries() {
        when(setOperations.members(RedisCollaborationStore.ACCEPTED_KEY))
                .thenReturn(Flux.just("lab-c|lab-d", "garbage", "lab-a|lab-b", "lab-e|lab-e", "a|b|c"));

        Set<LabPair> accepted = store.findAccepted().block();

        assertEquals(List.of(new LabPair("lab-a", "lab-b"), new LabPair("lab-c", "lab-d")), List.copyOf(accepted));
    }
}
