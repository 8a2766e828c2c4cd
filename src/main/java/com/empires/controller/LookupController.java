package com.empires.controller;

import com.empires.config.MapLoader;
import com.empires.config.UnitCatalog;
import com.empires.config.UnitDefinition;
import com.empires.dto.MapInfoDTO;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read-only lookups: available maps and unit types.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class LookupController {

    private final MapLoader mapLoader;
    private final UnitCatalog unitCatalog;

    @GetMapping("/maps")
    public ResponseEntity<List<MapInfoDTO>> getAvailableMaps() {
        return ResponseEntity.ok(mapLoader.getAvailableMaps().stream()
                .map(map -> MapInfoDTO.fromMap(map, false))
                .toList());
    }

    /**
     * Map details including every tile.
     */
    @GetMapping("/maps/{code}")
    public ResponseEntity<MapInfoDTO> getMap(@PathVariable String code) {
        return ResponseEntity.ok(MapInfoDTO.fromMap(mapLoader.getMap(code), true));
    }

    @GetMapping("/unit-definitions")
    public ResponseEntity<List<UnitDefinition>> getUnitDefinitions() {
        return ResponseEntity.ok(unitCatalog.getAll());
    }
}
