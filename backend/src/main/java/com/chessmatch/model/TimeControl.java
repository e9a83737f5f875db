package com.chessmatch.model;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Clock settings chosen at creation. Times are in seconds; {@code initialTime} and
 * {@code increment} are null when the control does not use them.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TimeControl {

    @NotNull
    private TimeControlType type;

    @PositiveOrZero
    private Long initialTime;

    @PositiveOrZero
    private Long increment;
}
