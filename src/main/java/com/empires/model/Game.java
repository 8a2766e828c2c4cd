package com.empires.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.time.LocalDateTime;

/**
 * A game session and its turn state: turn number, active participant and the
 * {@code turnInProgress} guard that serializes actions within this game.
 */
@Entity
@Table(name = "games")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Game {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false)
    private String mapCode;

    @Column(nullable = false)
    private int mapSchemaVersion;

    @Column(nullable = false)
    @Builder.Default
    private int turnNo = 1;

    @Column
    private String activeParticipantId;

    @Column(nullable = false)
    private boolean turnInProgress;

    /** When the guard was last acquired; used to recover guards left behind by a crashed request. */
    @Column
    private LocalDateTime turnInProgressSince;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private GameStatus status = GameStatus.ACTIVE;

    @Column(nullable = false)
    private long rngSeed;

    @Column(nullable = false)
    private LocalDateTime startedAt;

    @Column
    private LocalDateTime finishedAt;

    @Column
    private LocalDateTime lastTurnAt;

    @PrePersist
    public void prePersist() {
        if (startedAt == null) {
            startedAt = LocalDateTime.now();
        }
        if (status == null) {
            status = GameStatus.ACTIVE;
        }
    }

    public boolean isActive() {
        return status == GameStatus.ACTIVE;
    }

    public void finish() {
        status = GameStatus.FINISHED;
        activeParticipantId = null;
        finishedAt = LocalDateTime.now();
    }
}
