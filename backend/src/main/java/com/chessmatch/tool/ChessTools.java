package com.chessmatch.tool;

import com.chessmatch.chess.MoveValidation;
import com.chessmatch.dto.MatchView;
import com.chessmatch.exception.InvalidMoveException;
import com.chessmatch.exception.MatchNotFoundException;
import com.chessmatch.model.BoardState;
import com.chessmatch.model.ExportFormat;
import com.chessmatch.model.GameResult;
import com.chessmatch.model.Match;
import com.chessmatch.model.MatchStatus;
import com.chessmatch.model.MoveHistory;
import com.chessmatch.model.MoveHistoryFormat;
import com.chessmatch.model.TimeControl;
import com.chessmatch.service.MatchService;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

// ========== Chess Tools ==========
// The tool set offered to agent clients. Each handler delegates to MatchService and shapes
// its answer as a JSON object.
@Component
@RequiredArgsConstructor
public class ChessTools {

    private static final String GAME_ID = "gameId";
    private static final String PLAYER_ID = "playerId";

    private final MatchService matchService;
    private final ObjectMapper objectMapper;

    public List<Tool> tools() {
        return List.of(
            new Tool(ToolDefinition.builder()
                .name("create_game")
                .description("Create a new chess game between two players")
                .parameter(ToolParameter.required("whitePlayerId", "ID of the white player"))
                .parameter(ToolParameter.required("blackPlayerId", "ID of the black player"))
                .parameter(ToolParameter.object("timeControl",
                    "Optional clock settings: {type: unlimited|fixed|fischer, initialTime, increment} in seconds"))
                .build(), this::createGame),
            new Tool(ToolDefinition.builder()
                .name("get_game_status")
                .description("Get the current status of a chess game")
                .parameter(ToolParameter.required(GAME_ID, "ID of the chess game"))
                .build(), this::getGameStatus),
            new Tool(ToolDefinition.builder()
                .name("make_move")
                .description("Make a move in a chess game")
                .parameter(ToolParameter.required(GAME_ID, "ID of the chess game"))
                .parameter(ToolParameter.required("move", "Move in algebraic (e.g. Nf3) or coordinate (e.g. g1f3) notation"))
                .parameter(ToolParameter.required(PLAYER_ID, "ID of the player making the move"))
                .build(), this::makeMove),
            new Tool(ToolDefinition.builder()
                .name("list_games")
                .description("List games with optional filtering")
                .parameter(ToolParameter.optional("status", "Filter by game status",
                    List.of("active", "paused", "completed")))
                .parameter(ToolParameter.optional(PLAYER_ID, "Filter by player ID"))
                .build(), this::listGames),
            new Tool(ToolDefinition.builder()
                .name("resign_game")
                .description("Resign from a chess game")
                .parameter(ToolParameter.required(GAME_ID, "ID of the chess game"))
                .parameter(ToolParameter.required(PLAYER_ID, "ID of the resigning player"))
                .build(), this::resignGame),
            new Tool(ToolDefinition.builder()
                .name("offer_draw")
                .description("Offer a draw to the opponent")
                .parameter(ToolParameter.required(GAME_ID, "ID of the chess game"))
                .parameter(ToolParameter.required(PLAYER_ID, "ID of the player offering the draw"))
                .build(), this::offerDraw),
            new Tool(ToolDefinition.builder()
                .name("accept_draw")
                .description("Accept the opponent's draw offer")
                .parameter(ToolParameter.required(GAME_ID, "ID of the chess game"))
                .parameter(ToolParameter.required(PLAYER_ID, "ID of the player accepting the draw"))
                .build(), this::acceptDraw),
            new Tool(ToolDefinition.builder()
                .name("decline_draw")
                .description("Decline the opponent's draw offer")
                .parameter(ToolParameter.required(GAME_ID, "ID of the chess game"))
                .parameter(ToolParameter.required(PLAYER_ID, "ID of the player declining the draw"))
                .build(), this::declineDraw),
            new Tool(ToolDefinition.builder()
                .name("get_legal_moves")
                .description("Get legal moves for the current position in a chess game")
                .parameter(ToolParameter.required(GAME_ID, "ID of the chess game"))
                .parameter(ToolParameter.optional("square", "Optional: specific square to get moves from (e.g., \"e2\")"))
                .build(), this::getLegalMoves),
            new Tool(ToolDefinition.builder()
                .name("get_board_state")
                .description("Get the current board state in various formats")
                .parameter(ToolParameter.required(GAME_ID, "ID of the chess game"))
                .parameter(ToolParameter.optional("format", "Format for board representation",
                    List.of("visual", "FEN", "PGN")))
                .build(), this::getBoardState),
            new Tool(ToolDefinition.builder()
                .name("validate_move")
                .description("Validate a chess move without executing it")
                .parameter(ToolParameter.required(GAME_ID, "ID of the chess game"))
                .parameter(ToolParameter.required("move", "Move to validate"))
                .build(), this::validateMove),
            new Tool(ToolDefinition.builder()
                .name("get_move_history")
                .description("Get the move history of a chess game")
                .parameter(ToolParameter.required(GAME_ID, "ID of the chess game"))
                .parameter(ToolParameter.optional("format", "Format of the history",
                    List.of("algebraic", "UCI", "verbose", "with_fen", "detailed")))
                .build(), this::getMoveHistory),
            new Tool(ToolDefinition.builder()
                .name("export_game")
                .description("Export a chess game as PGN or FEN")
                .parameter(ToolParameter.required(GAME_ID, "ID of the chess game"))
                .parameter(ToolParameter.optional("format", "Export format", List.of("PGN", "FEN")))
                .build(), this::exportGame),
            new Tool(ToolDefinition.builder()
                .name("import_game")
                .description("Import a chess game from PGN format")
                .parameter(ToolParameter.required("pgn", "PGN string to import"))
                .parameter(ToolParameter.object("metadata", "Optional metadata: {whitePlayerId, blackPlayerId}"))
                .build(), this::importGame),
            new Tool(ToolDefinition.builder()
                .name("pause_game")
                .description("Pause an active chess game")
                .parameter(ToolParameter.required(GAME_ID, "ID of the game to pause"))
                .parameter(ToolParameter.required(PLAYER_ID, "ID of the player requesting the pause"))
                .build(), this::pauseGame),
            new Tool(ToolDefinition.builder()
                .name("resume_game")
                .description("Resume a paused chess game")
                .parameter(ToolParameter.required(GAME_ID, "ID of the game to resume"))
                .build(), this::resumeGame),
            new Tool(ToolDefinition.builder()
                .name("get_draw_status")
                .description("Get fifty-move and repetition counters of an active game")
                .parameter(ToolParameter.required(GAME_ID, "ID of the chess game"))
                .build(), this::getDrawStatus),
            new Tool(ToolDefinition.builder()
                .name("delete_game")
                .description("Delete a chess game")
                .parameter(ToolParameter.required(GAME_ID, "ID of the game to delete"))
                .build(), this::deleteGame));
    }

    // ========== Handlers ==========

    private Object createGame(ToolArguments arguments) {
        TimeControl timeControl = arguments.object("timeControl")
            .map(value -> objectMapper.convertValue(value, TimeControl.class))
            .orElse(null);
        Match match = matchService.createMatch(arguments.string("whitePlayerId"),
            arguments.string("blackPlayerId"), timeControl);
        return MatchView.from(match);
    }

    private Object getGameStatus(ToolArguments arguments) {
        return MatchView.from(matchService.requireMatch(arguments.string(GAME_ID)));
    }

    private Object makeMove(ToolArguments arguments) {
        String gameId = arguments.string(GAME_ID);
        String move = arguments.string("move");
        Match match;
        try {
            match = matchService.applyMove(gameId, arguments.string(PLAYER_ID), move);
        } catch (InvalidMoveException e) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("suggestion", e.getSuggestion().orElse(null));
            details.put("move", move);
            details.put(GAME_ID, gameId);
            return ToolResult.failure(e.getMessage(), details);
        }

        List<String> history = match.getMoveHistory();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(GAME_ID, match.getId());
        data.put("move", history.get(history.size() - 1));
        data.put("fen", match.getFen());
        data.put("currentTurn", match.getCurrentTurn());
        data.put("status", match.getStatus());
        match.getResult().ifPresent(result -> data.put("result", result));
        match.getEndReason().ifPresent(reason -> data.put("endReason", reason));
        data.put("moveHistory", history);
        return data;
    }

    private Object listGames(ToolArguments arguments) {
        Optional<MatchStatus> status = arguments.optionalString("status").map(ChessTools::parseStatus);
        Optional<String> playerId = arguments.optionalString(PLAYER_ID);

        List<Match> games;
        if (playerId.isPresent()) {
            games = matchService.listByParticipant(playerId.get());
            if (status.isPresent()) {
                games = games.stream()
                    .filter(game -> game.getStatus() == status.get())
                    .collect(Collectors.toList());
            }
        } else if (status.isPresent()) {
            games = matchService.listByStatus(status.get());
        } else {
            games = matchService.listAll();
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("games", games.stream().map(MatchView::from).collect(Collectors.toList()));
        data.put("count", games.size());
        return data;
    }

    private Object resignGame(ToolArguments arguments) {
        String playerId = arguments.string(PLAYER_ID);
        Match match = matchService.resign(arguments.string(GAME_ID), playerId);
        Map<String, Object> data = outcome(match);
        data.put("resignedBy", playerId);
        return data;
    }

    private Object offerDraw(ToolArguments arguments) {
        Match match = matchService.offerDraw(arguments.string(GAME_ID), arguments.string(PLAYER_ID));
        Map<String, Object> data = outcome(match);
        data.put("drawOfferFrom", match.getDrawOfferFrom().orElse(null));
        return data;
    }

    private Object acceptDraw(ToolArguments arguments) {
        String playerId = arguments.string(PLAYER_ID);
        Match match = matchService.acceptDraw(arguments.string(GAME_ID), playerId);
        Map<String, Object> data = outcome(match);
        data.put("acceptedBy", playerId);
        return data;
    }

    private Object declineDraw(ToolArguments arguments) {
        String playerId = arguments.string(PLAYER_ID);
        Match match = matchService.declineDraw(arguments.string(GAME_ID), playerId);
        Map<String, Object> data = outcome(match);
        data.put("declinedBy", playerId);
        return data;
    }

    private Object getLegalMoves(ToolArguments arguments) {
        String gameId = arguments.string(GAME_ID);
        Optional<String> square = arguments.optionalString("square");
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(GAME_ID, gameId);
        square.ifPresent(value -> data.put("square", value));
        data.put("legalMoves", matchService.getLegalMoves(gameId, square.orElse(null)));
        return data;
    }

    private Object getBoardState(ToolArguments arguments) {
        String gameId = arguments.string(GAME_ID);
        String format = arguments.optionalString("format").orElse("visual");
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(GAME_ID, gameId);
        switch (format.toLowerCase(Locale.ROOT)) {
            case "visual": {
                BoardState state = matchService.getBoardState(gameId);
                data.put("board", state.getBoard());
                data.put("turn", state.getCurrentTurn());
                data.put("moveNumber", state.getMoveNumber());
                data.put("check", state.isCheck());
                data.put("status", state.getStatus());
                return data;
            }
            case "fen":
                data.put("fen", matchService.requireMatch(gameId).getFen());
                return data;
            case "pgn":
                data.put("pgn", matchService.exportMatch(gameId, ExportFormat.PGN).getContent());
                return data;
            default:
                throw new IllegalArgumentException("Unsupported format: " + format);
        }
    }

    private Object validateMove(ToolArguments arguments) {
        String gameId = arguments.string(GAME_ID);
        String move = arguments.string("move");
        MoveValidation validation = matchService.validateMove(gameId, move);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(GAME_ID, gameId);
        data.put("move", move);
        data.put("valid", validation.isValid());
        if (validation.getReason() != null) {
            data.put("reason", validation.getReason());
        }
        if (validation.getSuggestion() != null) {
            data.put("suggestion", validation.getSuggestion());
        }
        return data;
    }

    private Object getMoveHistory(ToolArguments arguments) {
        String gameId = arguments.string(GAME_ID);
        String format = arguments.optionalString("format").orElse("algebraic");
        MoveHistory history = matchService.getMoveHistory(gameId, MoveHistoryFormat.parse(format));
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(GAME_ID, gameId);
        data.put("moveHistory", history);
        data.put("format", format);
        return data;
    }

    private Object exportGame(ToolArguments arguments) {
        String format = arguments.optionalString("format").orElse("PGN");
        return matchService.exportMatch(arguments.string(GAME_ID), ExportFormat.parse(format));
    }

    private Object importGame(ToolArguments arguments) {
        String pgn = arguments.optionalString("pgn")
            .orElseThrow(() -> new IllegalArgumentException("PGN cannot be empty"));
        Map<String, Object> metadata = arguments.object("metadata").orElse(Map.of());
        return matchService.importMatch(pgn, metadataString(metadata, "whitePlayerId"),
            metadataString(metadata, "blackPlayerId"));
    }

    private Object pauseGame(ToolArguments arguments) {
        String playerId = arguments.string(PLAYER_ID);
        Match match = matchService.pause(arguments.string(GAME_ID), playerId);
        Map<String, Object> data = outcome(match);
        data.put("pausedBy", playerId);
        return data;
    }

    private Object resumeGame(ToolArguments arguments) {
        Match match = matchService.resume(arguments.string(GAME_ID));
        Map<String, Object> data = outcome(match);
        data.put("resumedAt", LocalDateTime.now());
        return data;
    }

    private Object getDrawStatus(ToolArguments arguments) {
        String gameId = arguments.string(GAME_ID);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(GAME_ID, gameId);
        matchService.getDrawStatus(gameId).ifPresentOrElse(
            status -> data.put("drawStatus", status),
            () -> data.put("message", "Draw status is only tracked for active games"));
        return data;
    }

    private Object deleteGame(ToolArguments arguments) {
        String gameId = arguments.string(GAME_ID);
        if (!matchService.deleteMatch(gameId)) {
            throw new MatchNotFoundException(gameId);
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(GAME_ID, gameId);
        data.put("deleted", true);
        return data;
    }

    // ========== Helpers ==========

    private static Map<String, Object> outcome(Match match) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(GAME_ID, match.getId());
        data.put("status", match.getStatus());
        match.getResult().map(GameResult::getNotation).ifPresent(result -> data.put("result", result));
        return data;
    }

    private static MatchStatus parseStatus(String status) {
        try {
            return MatchStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid status: " + status + ". Must be 'active', 'paused' or 'completed'", e);
        }
    }

    private static String metadataString(Map<String, Object> metadata, String key) {
        Object value = metadata.get(key);
        return value instanceof String ? (String) value : null;
    }
}
