package com.chessmatch.dto;

import com.chessmatch.chess.PlayerColor;
import com.chessmatch.model.DrawDetails;
import com.chessmatch.model.GameEndReason;
import com.chessmatch.model.GameResult;
import com.chessmatch.model.Match;
import com.chessmatch.model.MatchStatus;
import com.chessmatch.model.TimeControl;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;

// ========== Match View ==========
// JSON shape of a game returned by the REST API and the tools.
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MatchView {
    String gameId;
    MatchStatus status;
    String whitePlayerId;
    String blackPlayerId;
    PlayerColor currentTurn;
    String fen;
    List<String> moveHistory;
    GameResult result;
    GameEndReason endReason;
    DrawDetails drawDetails;
    String drawOfferFrom;
    String pauseRequestedBy;
    TimeControl timeControl;
    Long whiteTimeRemaining;
    Long blackTimeRemaining;
    LocalDateTime createdAt;
    LocalDateTime updatedAt;
    LocalDateTime lastMoveAt;

    public static MatchView from(Match match) {
        return MatchView.builder()
            .gameId(match.getId())
            .status(match.getStatus())
            .whitePlayerId(match.getWhitePlayerId())
            .blackPlayerId(match.getBlackPlayerId())
            .currentTurn(match.getCurrentTurn())
            .fen(match.getFen())
            .moveHistory(match.getMoveHistory())
            .result(match.getResult().orElse(null))
            .endReason(match.getEndReason().orElse(null))
            .drawDetails(match.getDrawDetails().orElse(null))
            .drawOfferFrom(match.getDrawOfferFrom().orElse(null))
            .pauseRequestedBy(match.getPauseRequestedBy().orElse(null))
            .timeControl(match.getTimeControl().orElse(null))
            .whiteTimeRemaining(match.getTimeRemaining(PlayerColor.WHITE).orElse(null))
            .blackTimeRemaining(match.getTimeRemaining(PlayerColor.BLACK).orElse(null))
            .createdAt(match.getCreatedAt())
            .updatedAt(match.getUpdatedAt())
            .lastMoveAt(match.getLastMoveAt().orElse(null))
            .build();
    }
}
