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
 * What is left of a map deposit in one game. Only written once the deposit is first harvested;
 * until then the amount on the map {@link Tile} applies.
 */
@Entity
@Table(name = "tile_resources")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TileResource {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false)
    private String gameId;

    @Column(nullable = false)
    private int tileId;

    @Column(nullable = false)
    private int remaining;
}
