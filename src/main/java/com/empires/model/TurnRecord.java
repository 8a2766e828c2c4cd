package com.empires.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.time.LocalDateTime;

/**
 * History entry written each time a participant ends their turn.
 */
@Entity
@Table(name = "turn_records")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TurnRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false)
    private String gameId;

    @Column(nullable = false)
    private int turnNo;

    @Column(nullable = false)
    private String participantId;

    @Column(nullable = false)
    private LocalDateTime committedAt;

    @Column
    private Long durationMs;

    @Column(nullable = false)
    private int unitsActed;

    @Column(nullable = false)
    private int cityHpRegenerated;

    @Column(nullable = false)
    private int resourcesHarvested;
}
