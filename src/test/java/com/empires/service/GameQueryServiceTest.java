package com.empires.service;

import com.empires.config.MapLoader;
import com.empires.dto.GameStateDTO;
import com.empires.dto.TurnRecordDTO;
import com.empires.engine.BoardFixture;
import com.empires.exception.GameNotFoundException;
import com.empires.model.TurnRecord;
import com.empires.repository.CityRepository;
import com.empires.repository.CityResourceRepository;
import com.empires.repository.GameRepository;
import com.empires.repository.ParticipantRepository;
import com.empires.repository.TileResourceRepository;
import com.empires.repository.TurnRecordRepository;
import com.empires.repository.UnitRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static com.empires.engine.BoardFixture.SLINGER;
import static com.empires.engine.BoardFixture.WARRIOR;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class GameQueryServiceTest {

    @Mock private GameRepository gameRepository;
    @Mock private ParticipantRepository participantRepository;
    @Mock private UnitRepository unitRepository;
    @Mock private CityRepository cityRepository;
    @Mock private CityResourceRepository cityResourceRepository;
    @Mock private TileResourceRepository tileResourceRepository;
    @Mock private TurnRecordRepository turnRecordRepository;
    @Mock private MapLoader mapLoader;

    private GameQueryService service;
    private BoardFixture fixture;

    @BeforeEach
    void setUp() {
        service = new GameQueryService(gameRepository, participantRepository, unitRepository, cityRepository,
                cityResourceRepository, tileResourceRepository, turnRecordRepository, mapLoader, new GameStateProjector(BoardFixture.catalog()));
        fixture = BoardFixture.twoPlayers();
    }

    @Test
    @DisplayName("getGame() should throw GameNotFoundException for an unknown id")
    void unknownGame() {
        when(gameRepository.findById("nope")).thenReturn(Optional.empty());

        assertThrows(GameNotFoundException.class, () -> service.getGame("nope"));
    }

    @Test
    @DisplayName("getGameState() should project units and cities with their grid positions")
    void projectsState() {
        fixture.unit("w1", "p1", WARRIOR, 2, 3).setActed(true);
        fixture.unit("s2", "p2", SLINGER, 5, 6);
        fixture.city("c1", "p1", 1, 1, 70);
        when(gameRepository.findById(BoardFixture.GAME_ID)).thenReturn(Optional.of(fixture.game()));
        when(mapLoader.getMap("test-10x8")).thenReturn(BoardFixture.map());
        when(participantRepository.findByGameIdOrderByTurnOrder(BoardFixture.GAME_ID)).thenReturn(fixture.participants());
        when(unitRepository.findByGameId(BoardFixture.GAME_ID)).thenReturn(fixture.units());
        when(cityRepository.findByGameId(BoardFixture.GAME_ID)).thenReturn(fixture.cities());

        GameStateDTO state = service.getGameState(BoardFixture.GAME_ID);

        assertEquals("p1", state.getActiveParticipantId());
        assertEquals(1, state.getTurnNo());
        assertNull(state.getWinnerParticipantId());
        assertEquals(2, state.getParticipants().size());

        var warrior = state.getUnits().get(0);
        assertEquals(2, warrior.getRow());
        assertEquals(3, warrior.getCol());
        assertTrue(warrior.isHasActed());
        assertEquals(60, state.getUnits().get(1).getMaxHp());
        assertEquals(70, state.getCities().get(0).getHp());
    }

    @Test
    @DisplayName("getTurnHistory() should return records in commit order")
    void turnHistory() {
        TurnRecord record = TurnRecord.builder()
                .id("r1").gameId(BoardFixture.GAME_ID).turnNo(1).participantId("p1")
                .committedAt(LocalDateTime.now()).durationMs(1500L).unitsActed(1).cityHpRegenerated(4)
                .build();
        when(gameRepository.findById(BoardFixture.GAME_ID)).thenReturn(Optional.of(fixture.game()));
        when(turnRecordRepository.findByGameIdOrderByCommittedAtAsc(BoardFixture.GAME_ID)).thenReturn(List.of(record));

        List<TurnRecordDTO> history = service.getTurnHistory(BoardFixture.GAME_ID);

        assertEquals(1, history.size());
        assertEquals("p1", history.get(0).getParticipantId());
        assertEquals(1500L, history.get(0).getDurationMs());
    }
}
