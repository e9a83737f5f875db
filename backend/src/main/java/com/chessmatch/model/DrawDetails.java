package com.chessmatch.model;

import lombok.Value;

@Value
public class DrawDetails {
    DrawType type;
    String description;

    public static DrawDetails of(DrawType type) {
        return new DrawDetails(type, type.getDescription());
    }
}
