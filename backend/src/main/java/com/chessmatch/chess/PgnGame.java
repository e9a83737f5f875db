package com.chessmatch.chess;

import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * A parsed PGN game: header tags in file order, the moves re-encoded as SAN and the result
 * token ({@code *} when the game is unfinished).
 */
@Value
public class PgnGame {
    Map<String, String> headers;
    List<String> moves;
    String result;
}
