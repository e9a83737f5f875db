package com.chessmatch.model;

public enum MatchStatus {
    ACTIVE,
    PAUSED,
    COMPLETED
}
