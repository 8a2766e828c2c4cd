package com.empires.dto;

import com.empires.model.Participant;
import com.empires.model.ParticipantKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ParticipantDTO {

    private String id;
    private ParticipantKind kind;
    private String displayName;
    private int turnOrder;
    private boolean eliminated;

    public static ParticipantDTO fromParticipant(Participant participant) {
        return ParticipantDTO.builder()
                .id(participant.getId())
                .kind(participant.getKind())
                .displayName(participant.getDisplayName())
                .turnOrder(participant.getTurnOrder())
                .eliminated(participant.isEliminated())
                .build();
    }
}
