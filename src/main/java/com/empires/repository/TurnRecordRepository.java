package com.empires.repository;

import com.empires.model.TurnRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for the per-turn history of a game.
 */
@Repository
public interface TurnRecordRepository extends JpaRepository<TurnRecord, String> {

    List<TurnRecord> findByGameIdOrderByCommittedAtAsc(String gameId);
}
