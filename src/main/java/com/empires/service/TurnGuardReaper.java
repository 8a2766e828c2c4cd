package com.empires.service;

import com.empires.repository.GameRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Clears {@code turnInProgress} guards left behind by requests that died before releasing them.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TurnGuardReaper {

    private final GameRepository gameRepository;

    @Value("${game.turn-guard.stale-after:PT30S}")
    private Duration staleAfter = Duration.ofSeconds(30);

    @Scheduled(fixedDelayString = "${game.turn-guard.reap-interval-ms:10000}")
    @Transactional
    public int releaseStaleGuards() {
        int released = gameRepository.releaseStaleGuards(LocalDateTime.now().minus(staleAfter));
        if (released > 0) {
            log.warn("Released {} stale turn guard(s) older than {}", released, staleAfter);
        }
        return released;
    }
}
