package com.chessmatch.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class GameExport {
    String gameId;
    ExportFormat format;
    String content;
    Metadata metadata;

    @Value
    @Builder
    public static class Metadata {
        String whitePlayer;
        String blackPlayer;
        // PGN result token, "*" while the game is unfinished
        String result;
        MatchStatus gameStatus;
        String date;
    }
}
