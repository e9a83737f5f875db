package com.chessmatch.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MoveRequest {
    @NotBlank
    private String playerId;

    // SAN (Nf3, e8=Q) or coordinates (g1f3, e7e8q)
    @NotBlank
    private String move;
}
