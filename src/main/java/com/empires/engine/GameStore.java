package com.empires.engine;

import com.empires.model.Game;

import java.util.Optional;
import java.util.function.Function;

/**
 * Persistence boundary of the turn engine.
 */
public interface GameStore {

    Optional<Game> findGame(String gameId);

    /**
     * Atomically sets the game's {@code turnInProgress} flag if it is currently clear.
     *
     * @return {@code true} if this caller now holds the guard
     */
    boolean tryBeginAction(String gameId);

    /**
     * Clears the {@code turnInProgress} flag. Safe to call when it is already clear.
     */
    void endAction(String gameId);

    /**
     * Loads the game board, applies {@code work} and saves the board in one transaction.
     * Any exception thrown by {@code work} rolls the transaction back and is rethrown.
     */
    <T> T inTransaction(String gameId, Function<GameBoard, T> work);
}
