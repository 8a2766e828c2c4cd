package com.empires.exception;

/**
 * Thrown when a game id does not refer to an existing game.
 */
public class GameNotFoundException extends RuntimeException {

    public GameNotFoundException(String gameId) {
        super("Game not found: " + gameId);
    }
}
