package com.empires.repository;

import com.empires.model.TileResource;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TileResourceRepository extends JpaRepository<TileResource, String> {

    List<TileResource> findByGameId(String gameId);
}
