package com.empires.dto;

import com.empires.model.TurnRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TurnRecordDTO {

    private int turnNo;
    private String participantId;
    private LocalDateTime committedAt;
    private Long durationMs;
    private int unitsActed;
    private int cityHpRegenerated;
    private int resourcesHarvested;

    public static TurnRecordDTO fromRecord(TurnRecord record) {
        return TurnRecordDTO.builder()
                .turnNo(record.getTurnNo())
                .participantId(record.getParticipantId())
                .committedAt(record.getCommittedAt())
                .durationMs(record.getDurationMs())
                .unitsActed(record.getUnitsActed())
                .cityHpRegenerated(record.getCityHpRegenerated())
                .resourcesHarvested(record.getResourcesHarvested())
                .build();
    }
}
