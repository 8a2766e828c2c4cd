package com.empires.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UnitDTO {

    private String id;
    private String participantId;
    private String typeCode;
    private int tileId;
    private int row;
    private int col;
    private int hp;
    private int maxHp;
    private boolean hasActed;
}
