package com.empires.engine;

import com.empires.exception.GameStateCorruptedException;
import com.empires.grid.GridPosition;
import com.empires.model.Unit;
import org.junit.jupiter.api.Test;

import static com.empires.engine.BoardFixture.WARRIOR;
import static com.empires.engine.BoardFixture.tile;
import static org.junit.jupiter.api.Assertions.*;

class GameBoardTest {

    @Test
    void shouldRejectTwoUnitsOnOneTile() {
        BoardFixture fixture = BoardFixture.twoPlayers();
        fixture.unit("w1", "p1", WARRIOR, 2, 2);
        fixture.unit("w2", "p2", WARRIOR, 2, 2);

        assertThrows(GameStateCorruptedException.class, fixture::board);
    }

    @Test
    void shouldAllowUnitOnCityTile() {
        BoardFixture fixture = BoardFixture.twoPlayers();
        fixture.unit("w1", "p1", WARRIOR, 1, 1);
        fixture.city("c1", "p1", 1, 1, 100);

        GameBoard board = fixture.board();

        assertTrue(board.unitAt(tile(1, 1)).isPresent());
        assertTrue(board.cityAt(tile(1, 1)).isPresent());
    }

    @Test
    void moveUnitShouldUpdateOccupancy() {
        BoardFixture fixture = BoardFixture.twoPlayers();
        Unit unit = fixture.unit("w1", "p1", WARRIOR, 2, 2);
        GameBoard board = fixture.board();

        board.moveUnit(unit, tile(2, 3));

        assertFalse(board.isOccupied(tile(2, 2)));
        assertTrue(board.isOccupied(tile(2, 3)));
        assertEquals(GridPosition.of(2, 3), board.positionOf(unit));
    }

    @Test
    void moveUnitShouldRefuseOccupiedTile() {
        BoardFixture fixture = BoardFixture.twoPlayers();
        Unit unit = fixture.unit("w1", "p1", WARRIOR, 2, 2);
        fixture.unit("w2", "p1", WARRIOR, 2, 3);
        GameBoard board = fixture.board();

        assertThrows(GameStateCorruptedException.class, () -> board.moveUnit(unit, tile(2, 3)));
    }

    @Test
    void removeUnitShouldFreeTileAndRecordRemoval() {
        BoardFixture fixture = BoardFixture.twoPlayers();
        Unit unit = fixture.unit("w1", "p1", WARRIOR, 2, 2);
        GameBoard board = fixture.board();

        board.removeUnit(unit);
        board.removeUnit(unit);

        assertFalse(board.isOccupied(tile(2, 2)));
        assertEquals(1, board.getRemovedUnitIds().size());
        assertTrue(board.unitsOf("p1").isEmpty());
    }

    @Test
    void participantsShouldBeInTurnOrder() {
        BoardFixture fixture = BoardFixture.twoPlayers();
        fixture.participants().get(0).setTurnOrder(5);

        GameBoard board = fixture.board();

        assertEquals("p2", board.getParticipants().get(0).getId());
        assertEquals("p1", board.getParticipants().get(1).getId());
    }

    @Test
    void tileIdOfShouldRejectOffMapPosition() {
        GameBoard board = BoardFixture.twoPlayers().board();

        assertThrows(IllegalArgumentException.class, () -> board.tileIdOf(GridPosition.of(0, BoardFixture.WIDTH)));
    }
}
