package com.chessmatch.dto;

import com.chessmatch.model.GameResult;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CompleteMatchRequest {
    // "1-0", "0-1", "1/2-1/2" or white_wins / black_wins / draw
    @NotNull
    private GameResult result;
}
