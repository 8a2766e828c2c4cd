package com.empires.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A side in a game, human or AI.
 */
@Entity
@Table(name = "participants")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Participant {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false)
    private String gameId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ParticipantKind kind;

    @Column(nullable = false)
    private String displayName;

    @Column(nullable = false)
    private int turnOrder;

    @Column(nullable = false)
    @Builder.Default
    private boolean eliminated = false;

    public boolean isAi() {
        return kind == ParticipantKind.AI;
    }

    public void eliminate() {
        this.eliminated = true;
    }
}
