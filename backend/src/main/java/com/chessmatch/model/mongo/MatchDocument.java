package com.chessmatch.model.mongo;

import com.chessmatch.model.DrawDetails;
import com.chessmatch.model.GameEndReason;
import com.chessmatch.model.GameResult;
import com.chessmatch.model.MatchStatus;
import com.chessmatch.model.TimeControl;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

// ========== Match Snapshot ==========
// Persisted form of a match. Every store keeps and hands back this shape; Match.restore
// rebuilds the live object and checks it against the move list.
@Document(collection = "matches")
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MatchDocument {
    @Id
    private String id;

    @Indexed
    private String whitePlayerId;

    @Indexed
    private String blackPlayerId;

    private String fen;
    private String pgn;

    @Indexed
    private MatchStatus status;

    private GameResult result;
    private GameEndReason endReason;
    private DrawDetails drawDetails;

    private TimeControl timeControl;
    private Long whiteTimeRemaining;
    private Long blackTimeRemaining;

    private String drawOfferFrom;
    private String pauseRequestedBy;

    private List<String> moveHistory;

    // position fingerprint -> number of times it has occurred
    private Map<String, Integer> positionHistory;

    private LocalDateTime createdAt;

    @Indexed
    private LocalDateTime updatedAt;

    private LocalDateTime lastMoveAt;
}
