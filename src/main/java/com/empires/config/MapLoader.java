package com.empires.config;

import com.empires.model.GameMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;
import tools.jackson.databind.ObjectMapper;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Loads all available maps at startup.
 * <p>
 * Maps are loaded from two locations (in order):
 * <ol>
 *   <li>Classpath: {@code classpath:maps/*.json} – built-in maps shipped with the app</li>
 *   <li>External folder: {@code ./maps/} by default – custom maps</li>
 * </ol>
 * A custom map with the same {@code code} as a built-in one replaces it.
 * Definitions that fail validation are logged and skipped.
 */
@Component
@Slf4j
public class MapLoader {

    private final ObjectMapper objectMapper;

    private final Map<String, GameMap> maps = new LinkedHashMap<>();

    @Value("${game.maps.external-dir:maps}")
    private String externalDir = "maps";

    public MapLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void loadMaps() {
        loadClasspathMaps();
        loadExternalMaps();

        if (maps.isEmpty()) {
            log.warn("No map definitions found; games cannot be created without at least one map.");
        } else {
            log.info("Loaded {} map(s): {}", maps.size(), maps.keySet());
        }
    }

    public List<GameMap> getAvailableMaps() {
        return List.copyOf(maps.values());
    }

    /**
     * @throws IllegalArgumentException if the map code is unknown
     */
    public GameMap getMap(String code) {
        GameMap map = maps.get(code);
        if (map == null) {
            throw new IllegalArgumentException("Unknown map: " + code + ". Available maps: " + maps.keySet());
        }
        return map;
    }

    /**
     * Validates and registers a definition. Exposed for maps supplied programmatically.
     */
    public GameMap register(MapDefinition definition) {
        if (definition.code() == null || definition.code().isBlank()) {
            throw new IllegalArgumentException("Map definition has no code");
        }
        GameMap map = GameMap.fromDefinition(definition);
        maps.put(map.getCode(), map);
        return map;
    }

    private void loadClasspathMaps() {
        try {
            var resolver = new PathMatchingResourcePatternResolver();
            Resource[] resources = resolver.getResources("classpath:maps/*.json");

            for (Resource resource : resources) {
                try (InputStream is = resource.getInputStream()) {
                    GameMap map = register(objectMapper.readValue(is, MapDefinition.class));
                    log.info("Loaded built-in map '{}' ({}x{}) from classpath",
                            map.getCode(), map.getWidth(), map.getHeight());
                } catch (IOException | RuntimeException e) {
                    log.error("Failed to load classpath map: {}", resource.getFilename(), e);
                }
            }
        } catch (IOException e) {
            log.warn("Could not scan classpath for maps: {}", e.getMessage());
        }
    }

    private void loadExternalMaps() {
        Path dir = Paths.get(externalDir);
        if (!Files.isDirectory(dir)) {
            log.debug("No external maps directory found at '{}'", dir.toAbsolutePath());
            return;
        }

        try (Stream<Path> files = Files.list(dir)) {
            files.filter(p -> p.toString().endsWith(".json"))
                 .sorted()
                 .forEach(this::loadExternalMapFile);
        } catch (IOException e) {
            log.error("Error reading external maps directory", e);
        }
    }

    private void loadExternalMapFile(Path path) {
        try (InputStream is = Files.newInputStream(path)) {
            GameMap map = register(objectMapper.readValue(is, MapDefinition.class));
            log.info("Loaded custom map '{}' from {}", map.getCode(), path);
        } catch (IOException | RuntimeException e) {
            log.error("Failed to load custom map: {}", path, e);
        }
    }
}
