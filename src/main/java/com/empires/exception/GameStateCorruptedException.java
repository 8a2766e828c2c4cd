package com.empires.exception;

/**
 * Thrown when stored game data contradicts itself or the loaded map and unit catalogue,
 * for example a unit standing on a tile id the map does not have.
 */
public class GameStateCorruptedException extends RuntimeException {

    public GameStateCorruptedException(String message) {
        super(message);
    }
}
