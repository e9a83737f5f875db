package com.chessmatch.chess;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Value;

@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MoveValidation {
    boolean valid;
    String reason;
    String suggestion;

    public static MoveValidation accepted() {
        return new MoveValidation(true, null, null);
    }

    public static MoveValidation rejected(String reason, String suggestion) {
        return new MoveValidation(false, reason, suggestion);
    }
}
