package com.avari.signaling.web.dto;

import com.avari.signaling.match.MatchSnapshot;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * DTO describing one live match for diagnostics.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MatchSummaryDto {

    private String matchId;
    private int participantCount;
    private List<ParticipantDto> participants;
    private Instant createdAt;
    private Instant lastActivity;

    public static MatchSummaryDto from(MatchSnapshot snapshot) {
        return new MatchSummaryDto(
                snapshot.matchId(),
                snapshot.participantCount(),
                snapshot.participants().stream().map(ParticipantDto::from).toList(),
                snapshot.createdAt(),
                snapshot.lastActivityAt());
    }
}
