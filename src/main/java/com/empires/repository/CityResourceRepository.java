package com.empires.repository;

import com.empires.model.CityResource;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CityResourceRepository extends JpaRepository<CityResource, String> {

    List<CityResource> findByGameId(String gameId);
}
