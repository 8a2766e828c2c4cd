package com.empires.exception;

import lombok.Getter;

/**
 * Thrown when a map's schema version is not the one this server accepts.
 */
@Getter
public class MapSchemaMismatchException extends RuntimeException {

    private final String mapCode;
    private final int actualVersion;
    private final int expectedVersion;

    public MapSchemaMismatchException(String mapCode, int actualVersion, int expectedVersion) {
        super("Map " + mapCode + " has schema version " + actualVersion + ", expected " + expectedVersion);
        this.mapCode = mapCode;
        this.actualVersion = actualVersion;
        this.expectedVersion = expectedVersion;
    }
}
