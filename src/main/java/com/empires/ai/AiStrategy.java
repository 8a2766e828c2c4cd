package com.empires.ai;

import com.empires.engine.GameBoard;
import com.empires.model.Unit;

/**
 * Strategy interface for AI participants.
 */
public interface AiStrategy {

    /**
     * Decide what a unit of the active AI participant should do.
     * Must not modify the board.
     */
    AiDecision decide(GameBoard board, Unit unit);
}
