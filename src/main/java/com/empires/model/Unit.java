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

/**
 * A unit on the board. Refers to its owner, type and tile by id only; tile occupancy is
 * derived from these rows rather than stored on the tile.
 */
@Entity
@Table(name = "units")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Unit {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false)
    private String gameId;

    @Column(nullable = false)
    private String participantId;

    @Column(nullable = false)
    private String typeCode;

    @Column(nullable = false)
    private int tileId;

    @Column(nullable = false)
    private int hp;

    /** Whether the unit has used its one action this turn. */
    @Column(name = "has_acted", nullable = false)
    private boolean acted;

    public boolean isOwnedBy(String participantId) {
        return this.participantId.equals(participantId);
    }

    public boolean isDestroyed() {
        return hp <= 0;
    }
}
