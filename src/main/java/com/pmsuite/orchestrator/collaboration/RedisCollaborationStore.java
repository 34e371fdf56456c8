package com.pmsuite.orchestrator.collaboration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Set;
import java.util.TreeSet;

/**
 * Accepted pairs as members of one Redis set, "collaboration:accepted",
 * each encoded as "labAId|labBId". SADD makes acceptance idempotent.
 */
@Slf4j
@Component
public class RedisCollaborationStore implements CollaborationStore {

    static final String ACCEPTED_KEY = "collaboration:accepted";

    private final ReactiveRedisTemplate<String, String> redisTemplate;

    public RedisCollaborationStore(ReactiveRedisTemplate<String, String> redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public Mono<Boolean> markAccepted(LabPair pair) {
        return redisTemplate.opsForSet()
                .add(ACCEPTED_KEY, pair.key())
                .map(added -> added > 0)
                .doOnError(e -> log.error("Failed to persist accepted collaboration {}: {}", pair.key(), e.getMessage()));
    }

    @Override
    public Mono<Set<LabPair>> findAccepted() {
        return redisTemplate.opsForSet()
                .members(ACCEPTED_KEY)
                .flatMap(member -> {
                    try {
                        return Mono.just(LabPair.fromKey(member));
                    } catch (IllegalArgumentException e) {
                        log.warn("Skipping malformed collaboration entry '{}'", member);
                        return Mono.empty();
                    }
                })
                .<Set<LabPair>>collect(TreeSet::new, Set::add);
    }
}
