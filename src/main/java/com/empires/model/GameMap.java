package com.empires.model;

import com.empires.config.MapDefinition;
import com.empires.exception.GameStateCorruptedException;
import com.empires.grid.GridPosition;
import com.empires.grid.HexGrid;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A playable map: fixed dimensions and an immutable list of tiles.
 */
public final class GameMap {

    private final String code;
    private final String name;
    private final int schemaVersion;
    private final int width;
    private final int height;
    private final List<Tile> tiles;
    private final List<GridPosition> startPositions;

    private GameMap(String code, String name, int schemaVersion, int width, int height,
                    List<Tile> tiles, List<GridPosition> startPositions) {
        this.code = code;
        this.name = name;
        this.schemaVersion = schemaVersion;
        this.width = width;
        this.height = height;
        this.tiles = Collections.unmodifiableList(tiles);
        this.startPositions = List.copyOf(startPositions);
    }

    /**
     * Builds the tile list from a definition's terrain rows.
     *
     * @throws IllegalArgumentException if the terrain rows do not match the declared size, or a
     *                                  resource deposit or start position lies off the map
     */
    public static GameMap fromDefinition(MapDefinition definition) {
        int width = definition.width();
        int height = definition.height();
        List<String> rows = definition.terrain();
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Map " + definition.code() + " has invalid size " + width + "x" + height);
        }
        if (rows == null || rows.size() != height) {
            throw new IllegalArgumentException("Map " + definition.code() + " must have " + height + " terrain rows");
        }

        Map<GridPosition, MapDefinition.ResourceDefinition> resources = new HashMap<>();
        if (definition.resources() != null) {
            for (MapDefinition.ResourceDefinition resource : definition.resources()) {
                GridPosition position = GridPosition.of(resource.row(), resource.col());
                if (!HexGrid.isInBounds(position, width, height)) {
                    throw new IllegalArgumentException("Map " + definition.code() + " " + resource.type()
                            + " deposit at " + position + " is off the map");
                }
                resources.put(position, resource);
            }
        }

        List<Tile> tiles = new ArrayList<>(width * height);
        for (int row = 0; row < height; row++) {
            String line = rows.get(row);
            if (line.length() != width) {
                throw new IllegalArgumentException("Map " + definition.code() + " row " + row
                        + " has " + line.length() + " tiles, expected " + width);
            }
            for (int col = 0; col < width; col++) {
                GridPosition position = GridPosition.of(row, col);
                MapDefinition.ResourceDefinition resource = resources.get(position);
                tiles.add(new Tile(row * width + col, position, Terrain.fromSymbol(line.charAt(col)),
                        resource != null ? resource.type() : null,
                        resource != null ? resource.amount() : 0));
            }
        }

        List<GridPosition> starts = definition.startPositions() != null ? definition.startPositions() : List.of();
        for (GridPosition start : starts) {
            if (!HexGrid.isInBounds(start, width, height)) {
                throw new IllegalArgumentException("Map " + definition.code() + " start position " + start + " is off the map");
            }
        }
        return new GameMap(definition.code(), definition.name(), definition.schemaVersion(), width, height, tiles, starts);
    }

    public String getCode() {
        return code;
    }

    public String getName() {
        return name;
    }

    public int getSchemaVersion() {
        return schemaVersion;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public List<Tile> getTiles() {
        return tiles;
    }

    public List<GridPosition> getStartPositions() {
        return startPositions;
    }

    public boolean contains(GridPosition position) {
        return HexGrid.isInBounds(position, width, height);
    }

    public Optional<Tile> tileAt(GridPosition position) {
        if (!contains(position)) {
            return Optional.empty();
        }
        return Optional.of(tiles.get(position.row() * width + position.col()));
    }

    /**
     * @throws GameStateCorruptedException if the id does not belong to this map
     */
    public Tile tile(int tileId) {
        if (tileId < 0 || tileId >= tiles.size()) {
            throw new GameStateCorruptedException("Tile " + tileId + " does not exist on map " + code);
        }
        return tiles.get(tileId);
    }
}
