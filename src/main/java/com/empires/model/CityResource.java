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
 * A city's stock of one resource type. Stays with the city when it changes hands.
 */
@Entity
@Table(name = "city_resources")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CityResource {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false)
    private String gameId;

    @Column(nullable = false)
    private String cityId;

    @Column(nullable = false)
    private String resourceType;

    @Column(nullable = false)
    private int amount;
}
