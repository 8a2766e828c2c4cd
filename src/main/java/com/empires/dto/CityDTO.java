package com.empires.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CityDTO {

    private String id;
    private String participantId;
    private int tileId;
    private int row;
    private int col;
    private int hp;
    private int maxHp;
    private Map<String, Integer> resources;
}
