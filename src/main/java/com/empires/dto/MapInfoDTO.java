package com.empires.dto;

import com.empires.model.GameMap;
import com.empires.model.Tile;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * DTO for exposing available map information to clients. Tiles are only included on request.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MapInfoDTO {

    private String code;
    private String name;
    private int schemaVersion;
    private int width;
    private int height;
    private int maxParticipants;
    private List<TileDTO> tiles;

    public static MapInfoDTO fromMap(GameMap map, boolean includeTiles) {
        return MapInfoDTO.builder()
                .code(map.getCode())
                .name(map.getName())
                .schemaVersion(map.getSchemaVersion())
                .width(map.getWidth())
                .height(map.getHeight())
                .maxParticipants(map.getStartPositions().size())
                .tiles(includeTiles ? map.getTiles().stream().map(TileDTO::fromTile).toList() : null)
                .build();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TileDTO {
        private int id;
        private int row;
        private int col;
        private String terrain;
        private String resourceType;
        private int resourceAmount;

        public static TileDTO fromTile(Tile tile) {
            return new TileDTO(tile.id(), tile.row(), tile.col(), tile.terrain().name().toLowerCase(),
                    tile.resourceType(), tile.resourceAmount());
        }
    }
}
