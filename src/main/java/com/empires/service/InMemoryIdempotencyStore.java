package com.empires.service;

import com.empires.engine.ActionResult;
import com.empires.engine.IdempotencyStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link IdempotencyStore}. Entries expire after a fixed time to live.
 */
@Component
@Slf4j
public class InMemoryIdempotencyStore implements IdempotencyStore {

    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();

    @Value("${game.idempotency.ttl:PT1H}")
    private Duration ttl = Duration.ofHours(1);

    private Clock clock = Clock.systemUTC();

    @Override
    public Optional<ActionResult> tryGet(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.result());
    }

    @Override
    public ActionResult putIfAbsent(String key, ActionResult result) {
        Instant now = clock.instant();
        Entry stored = entries.compute(key, (k, existing) ->
                existing != null && !existing.isExpired(now) ? existing : new Entry(result, now.plus(ttl)));
        return stored.result();
    }

    @Scheduled(fixedDelayString = "${game.idempotency.eviction-interval-ms:60000}")
    public void evictExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.values().removeIf(e -> e.isExpired(now));
        int evicted = before - entries.size();
        if (evicted > 0) {
            log.debug("Evicted {} expired idempotency entries", evicted);
        }
    }

    int size() {
        return entries.size();
    }

    private record Entry(ActionResult result, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
