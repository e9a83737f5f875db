package com.chessmatch.dto;

import com.chessmatch.model.TimeControl;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateMatchRequest {
    @NotBlank
    private String whitePlayerId;

    @NotBlank
    private String blackPlayerId;

    @Valid
    private TimeControl timeControl;
}
