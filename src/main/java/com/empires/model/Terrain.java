package com.empires.model;

import java.util.Arrays;

/**
 * Terrain of a map tile, with the single character used for it in map files.
 */
public enum Terrain {
    GRASSLAND('g'),
    WATER('w'),
    OCEAN('o'),
    TUNDRA('t'),
    TROPICAL('p');

    private final char symbol;

    Terrain(char symbol) {
        this.symbol = symbol;
    }

    public char symbol() {
        return symbol;
    }

    public boolean isWater() {
        return this == WATER || this == OCEAN;
    }

    public static Terrain fromSymbol(char symbol) {
        return Arrays.stream(values())
                .filter(t -> t.symbol == symbol)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown terrain symbol: '" + symbol + "'"));
    }
}
