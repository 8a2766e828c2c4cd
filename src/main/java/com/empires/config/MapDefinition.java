package com.empires.config;

import com.empires.grid.GridPosition;

import java.util.List;

/**
 * Definition of a playable map, loaded from a JSON file.
 *
 * @param code           unique slug, e.g. "standard-15x20"
 * @param name           human-readable name
 * @param description    short description
 * @param schemaVersion  version of the map format; games only accept the configured version
 * @param width          number of columns
 * @param height         number of rows
 * @param terrain        one string per row, one terrain symbol per tile
 * @param resources      optional resource deposits
 * @param startPositions city position of each seat, in seat order
 */
public record MapDefinition(
        String code,
        String name,
        String description,
        int schemaVersion,
        int width,
        int height,
        List<String> terrain,
        List<ResourceDefinition> resources,
        List<GridPosition> startPositions
) {

    public record ResourceDefinition(int row, int col, String type, int amount) {}
}
