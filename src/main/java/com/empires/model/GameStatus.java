package com.empires.model;

/**
 * Lifecycle status of a game. Orthogonal to the per-action turn guard.
 */
public enum GameStatus {
    ACTIVE,
    FINISHED
}
