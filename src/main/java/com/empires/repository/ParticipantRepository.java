package com.empires.repository;

import com.empires.model.Participant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for Participant entities.
 */
@Repository
public interface ParticipantRepository extends JpaRepository<Participant, String> {

    List<Participant> findByGameIdOrderByTurnOrder(String gameId);
}
