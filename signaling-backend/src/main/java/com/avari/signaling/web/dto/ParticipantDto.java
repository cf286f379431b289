package com.avari.signaling.web.dto;

import com.avari.signaling.match.MatchSnapshot;

public record ParticipantDto(String userId, boolean connected) {
    public static ParticipantDto from(MatchSnapshot.Participant participant) {
        return new ParticipantDto(participant.userId(), participant.connected());
    }
}
