package com.empires.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for creating a new game.
 * Uses Integer wrappers so Jackson 3 leaves absent fields as null.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CreateGameRequest {

    private String mapCode;

    @Size(max = 30, message = "Player name must be at most 30 characters")
    private String playerName;

    @Min(value = 1, message = "At least one AI opponent is required")
    @Max(value = 5, message = "At most five AI opponents are supported")
    private Integer aiCount;

    private Long seed;

    public String getMapCode() {
        return mapCode != null && !mapCode.isBlank() ? mapCode : "standard-15x20";
    }

    public String getPlayerName() {
        return playerName != null && !playerName.isBlank() ? playerName : "Player";
    }

    public int getAiCount() {
        return aiCount != null ? aiCount : 1;
    }
}
