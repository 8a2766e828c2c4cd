package com.empires.config;

import com.empires.exception.GameStateCorruptedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import tools.jackson.databind.ObjectMapper;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only registry of unit types, loaded once from the classpath.
 */
@Component
@Slf4j
public class UnitCatalog {

    private final ObjectMapper objectMapper;

    private final Map<String, UnitDefinition> definitions = new LinkedHashMap<>();

    @Value("${game.units.definitions:units/unit-definitions.json}")
    private String definitionsLocation = "units/unit-definitions.json";

    public UnitCatalog(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void loadDefinitions() {
        try (InputStream is = new ClassPathResource(definitionsLocation).getInputStream()) {
            UnitDefinition[] loaded = objectMapper.readValue(is, UnitDefinition[].class);
            for (UnitDefinition definition : loaded) {
                register(definition);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read unit definitions from " + definitionsLocation, e);
        }
        log.info("Loaded {} unit type(s): {}", definitions.size(), definitions.keySet());
    }

    /**
     * @throws IllegalArgumentException if the definition's stats are inconsistent
     */
    public void register(UnitDefinition definition) {
        if (definition.health() <= 0 || definition.movePoints() < 0) {
            throw new IllegalArgumentException("Unit type " + definition.code() + " has invalid stats");
        }
        if (definition.ranged() && (definition.rangeMin() < 1 || definition.rangeMax() < definition.rangeMin())) {
            throw new IllegalArgumentException("Ranged unit type " + definition.code() + " has an invalid range");
        }
        definitions.put(definition.code(), definition);
    }

    /**
     * @throws GameStateCorruptedException if the type code is unknown
     */
    public UnitDefinition get(String code) {
        UnitDefinition definition = definitions.get(code);
        if (definition == null) {
            throw new GameStateCorruptedException("Unknown unit type: " + code);
        }
        return definition;
    }

    public List<UnitDefinition> getAll() {
        return List.copyOf(definitions.values());
    }
}
