package com.empires.repository;

import com.empires.model.Game;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;

/**
 * Repository for Game entities.
 */
@Repository
public interface GameRepository extends JpaRepository<Game, String> {

    /**
     * Sets the action guard only if it is clear. Returns the number of rows updated (0 or 1).
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Game g SET g.turnInProgress = true, g.turnInProgressSince = :now "
            + "WHERE g.id = :gameId AND g.turnInProgress = false")
    int tryBeginAction(String gameId, LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Game g SET g.turnInProgress = false, g.turnInProgressSince = null WHERE g.id = :gameId")
    int endAction(String gameId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Game g SET g.turnInProgress = false, g.turnInProgressSince = null "
            + "WHERE g.turnInProgress = true AND g.turnInProgressSince < :cutoff")
    int releaseStaleGuards(LocalDateTime cutoff);
}
