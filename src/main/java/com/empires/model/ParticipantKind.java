package com.empires.model;

/**
 * Who controls a participant.
 */
public enum ParticipantKind {
    HUMAN,
    AI
}
