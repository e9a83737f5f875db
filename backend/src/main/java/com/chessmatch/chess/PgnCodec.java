package com.chessmatch.chess;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Plain PGN text handling: header tags and movetext. Moves come out as raw tokens; checking
 * them against the board is up to {@link StandardRulesEngine}.
 */
final class PgnCodec {

    static final String UNFINISHED = "*";

    private static final Pattern HEADER = Pattern.compile("^\\[(\\w+)\\s+\"((?:[^\"\\\\]|\\\\.)*)\"\\]$");
    private static final Pattern MOVE_NUMBER = Pattern.compile("^\\d+\\.+");
    private static final Pattern NAG = Pattern.compile("\\$\\d+");
    private static final Set<String> RESULTS = Set.of("1-0", "0-1", "1/2-1/2", UNFINISHED);

    private PgnCodec() {
    }

    static String write(Map<String, String> headers, List<String> moves, String result) {
        StringBuilder pgn = new StringBuilder();
        headers.forEach((key, value) -> pgn.append('[').append(key).append(" \"")
            .append(value.replace("\\", "\\\\").replace("\"", "\\\"")).append("\"]\n"));
        if (!headers.isEmpty()) {
            pgn.append('\n');
        }

        StringBuilder movetext = new StringBuilder();
        for (int ply = 0; ply < moves.size(); ply++) {
            if (ply > 0) {
                movetext.append(' ');
            }
            if (ply % 2 == 0) {
                movetext.append(ply / 2 + 1).append(". ");
            }
            movetext.append(moves.get(ply));
        }
        if (result != null) {
            if (movetext.length() > 0) {
                movetext.append(' ');
            }
            movetext.append(result);
        }
        return pgn.append(movetext).toString();
    }

    static PgnGame read(String text) {
        if (text == null || text.isBlank()) {
            throw new PgnParseException("PGN is empty");
        }

        Map<String, String> headers = new LinkedHashMap<>();
        StringBuilder movetext = new StringBuilder();
        for (String rawLine : text.split("\\R")) {
            String line = rawLine.trim();
            if (line.isEmpty() || line.startsWith("%")) {
                continue;
            }
            if (line.startsWith("[")) {
                Matcher header = HEADER.matcher(line);
                if (!header.matches()) {
                    throw new PgnParseException("Malformed PGN header: " + line);
                }
                headers.put(header.group(1), header.group(2).replace("\\\"", "\"").replace("\\\\", "\\"));
                continue;
            }
            int comment = line.indexOf(';');
            movetext.append(comment >= 0 ? line.substring(0, comment) : line).append(' ');
        }

        String body = NAG.matcher(stripNested(stripBraces(movetext.toString()))).replaceAll(" ");
        List<String> moves = new ArrayList<>();
        String result = null;
        for (String token : body.trim().split("\\s+")) {
            String move = MOVE_NUMBER.matcher(token).replaceFirst("");
            if (move.isEmpty()) {
                continue;
            }
            if (RESULTS.contains(move)) {
                result = move;
                continue;
            }
            if (result != null) {
                throw new PgnParseException("Moves found after the game result: " + move);
            }
            moves.add(move);
        }

        if (result == null) {
            result = headers.getOrDefault("Result", UNFINISHED);
        }
        return new PgnGame(headers, moves, result);
    }

    private static String stripBraces(String text) {
        StringBuilder out = new StringBuilder();
        boolean inComment = false;
        for (char c : text.toCharArray()) {
            if (c == '{') {
                inComment = true;
            } else if (c == '}') {
                if (!inComment) {
                    throw new PgnParseException("Unbalanced '}' in PGN movetext");
                }
                inComment = false;
                out.append(' ');
            } else if (!inComment) {
                out.append(c);
            }
        }
        if (inComment) {
            throw new PgnParseException("Unterminated comment in PGN movetext");
        }
        return out.toString();
    }

    // Variations nest, so track depth rather than matching pairs.
    private static String stripNested(String text) {
        StringBuilder out = new StringBuilder();
        int depth = 0;
        for (char c : text.toCharArray()) {
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                if (depth == 0) {
                    throw new PgnParseException("Unbalanced ')' in PGN movetext");
                }
                depth--;
                out.append(' ');
            } else if (depth == 0) {
                out.append(c);
            }
        }
        if (depth != 0) {
            throw new PgnParseException("Unterminated variation in PGN movetext");
        }
        return out.toString();
    }
}
