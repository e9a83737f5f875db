package com.chessmatch.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ImportMatchRequest {
    @NotBlank
    private String pgn;

    // Both default to the PGN's White / Black tags.
    private String whitePlayerId;
    private String blackPlayerId;
}
