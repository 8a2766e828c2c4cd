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
 * A city. Never moves; loses hit points to attacks and changes hands when captured.
 */
@Entity
@Table(name = "cities")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class City {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false)
    private String gameId;

    @Column(nullable = false)
    private String participantId;

    @Column(nullable = false)
    private int tileId;

    @Column(nullable = false)
    private int hp;

    @Column(nullable = false)
    private int maxHp;

    public boolean isOwnedBy(String participantId) {
        return this.participantId.equals(participantId);
    }

    public boolean isDefeated() {
        return hp <= 0;
    }
}
