package com.chessmatch.tool;

import com.chessmatch.chess.StandardRulesEngine;
import com.chessmatch.config.MatchProperties;
import com.chessmatch.dto.MatchView;
import com.chessmatch.model.MatchStatus;
import com.chessmatch.repository.InMemoryMatchStore;
import com.chessmatch.service.MatchService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ToolDispatcherTest {

    private ToolDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        StandardRulesEngine engine = new StandardRulesEngine();
        MatchService matchService = new MatchService(new InMemoryMatchStore(engine), engine, new MatchProperties());
        dispatcher = new ToolDispatcher(new ChessTools(matchService, new ObjectMapper()));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> data(ToolResult result) {
        assertThat(result.isSuccess()).as("tool error: %s", result.getError()).isTrue();
        return (Map<String, Object>) result.getData();
    }

    private String createGame() {
        ToolResult created = dispatcher.execute("create_game", Map.of("whitePlayerId", "alice", "blackPlayerId", "bob"));
        assertThat(created.isSuccess()).isTrue();
        return ((MatchView) created.getData()).getGameId();
    }

    @Test
    void listsEveryTool() {
        assertThat(dispatcher.listTools())
            .extracting(ToolDefinition::getName)
            .contains("create_game", "make_move", "import_game", "pause_game", "get_draw_status", "delete_game")
            .hasSize(18);
    }

    @Test
    void schemaDeclaresRequiredParameters() {
        ToolDefinition makeMove = dispatcher.listTools().stream()
            .filter(tool -> tool.getName().equals("make_move"))
            .findFirst()
            .orElseThrow();

        assertThat(makeMove.getInputSchema()).containsEntry("required", List.of("gameId", "move", "playerId"));
    }

    @Test
    void unknownToolFails() {
        ToolResult result = dispatcher.execute("castle_now", Map.of());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).isEqualTo("Unknown tool: castle_now");
    }

    @Test
    void missingRequiredParameterFails() {
        ToolResult result = dispatcher.execute("create_game", Map.of("whitePlayerId", "alice"));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).isEqualTo("Missing required parameter: blackPlayerId");
    }

    @Test
    void wrongParameterTypeFails() {
        ToolResult result = dispatcher.execute("get_game_status", Map.of("gameId", 42));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).isEqualTo("Invalid parameter type for gameId: expected string, got number");
    }

    @Test
    @SuppressWarnings("unchecked")
    void makeMoveChecksTurnAndReportsSuggestion() {
        String gameId = createGame();

        ToolResult wrongTurn = dispatcher.execute("make_move", Map.of("gameId", gameId, "move", "e5", "playerId", "bob"));
        assertThat(wrongTurn.isSuccess()).isFalse();
        assertThat(wrongTurn.getError()).isEqualTo("It is not your turn");

        ToolResult illegal = dispatcher.execute("make_move", Map.of("gameId", gameId, "move", "e5", "playerId", "alice"));
        assertThat(illegal.isSuccess()).isFalse();
        assertThat(illegal.getError()).contains("not legal");
        assertThat((Map<String, Object>) illegal.getData()).containsKey("suggestion");

        Map<String, Object> moved = data(dispatcher.execute("make_move",
            Map.of("gameId", gameId, "move", "e2e4", "playerId", "alice")));
        assertThat(moved).containsEntry("move", "e4").containsEntry("status", MatchStatus.ACTIVE);
    }

    @Test
    void drawOfferFlow() {
        String gameId = createGame();

        data(dispatcher.execute("offer_draw", Map.of("gameId", gameId, "playerId", "alice")));
        ToolResult own = dispatcher.execute("accept_draw", Map.of("gameId", gameId, "playerId", "alice"));
        assertThat(own.isSuccess()).isFalse();

        Map<String, Object> accepted = data(dispatcher.execute("accept_draw", Map.of("gameId", gameId, "playerId", "bob")));
        assertThat(accepted).containsEntry("result", "1/2-1/2").containsEntry("acceptedBy", "bob");
    }

    @Test
    void listGamesFiltersByStatus() {
        String gameId = createGame();
        createGame();
        data(dispatcher.execute("pause_game", Map.of("gameId", gameId, "playerId", "alice")));

        Map<String, Object> paused = data(dispatcher.execute("list_games", Map.of("status", "paused")));
        assertThat(paused).containsEntry("count", 1);

        ToolResult invalid = dispatcher.execute("list_games", Map.of("status", "sleeping"));
        assertThat(invalid.isSuccess()).isFalse();
        assertThat(invalid.getError()).startsWith("Invalid status");
    }

    @Test
    void boardStateFormats() {
        String gameId = createGame();

        assertThat(data(dispatcher.execute("get_board_state", Map.of("gameId", gameId))))
            .containsEntry("moveNumber", 1)
            .containsKey("board");
        assertThat(data(dispatcher.execute("get_board_state", Map.of("gameId", gameId, "format", "FEN"))))
            .containsKey("fen");
        dispatcher.execute("make_move", Map.of("gameId", gameId, "move", "e4", "playerId", "alice"));
        dispatcher.execute("make_move", Map.of("gameId", gameId, "move", "e5", "playerId", "bob"));
        assertThat(data(dispatcher.execute("get_board_state", Map.of("gameId", gameId))))
            .containsEntry("moveNumber", 2);
        assertThat(dispatcher.execute("get_board_state", Map.of("gameId", gameId, "format", "svg")).getError())
            .isEqualTo("Unsupported format: svg");
    }

    @Test
    void historyFormatValidation() {
        String gameId = createGame();

        ToolResult bad = dispatcher.execute("get_move_history", Map.of("gameId", gameId, "format", "binary"));

        assertThat(bad.isSuccess()).isFalse();
        assertThat(bad.getError()).startsWith("Invalid format: binary");
    }

    @Test
    void importUsesMetadataPlayers() {
        Map<String, Object> parameters = new HashMap<>();
        parameters.put("pgn", "1. e4 e5 2. Nf3 *");
        parameters.put("metadata", Map.of("whitePlayerId", "carol", "blackPlayerId", "dave"));

        ToolResult result = dispatcher.execute("import_game", parameters);

        assertThat(result.isSuccess()).isTrue();
        ToolResult listed = dispatcher.execute("list_games", Map.of("playerId", "carol"));
        assertThat(data(listed)).containsEntry("count", 1);
    }

    @Test
    void importReportsBadPgn() {
        ToolResult result = dispatcher.execute("import_game", Map.of("pgn", "1. e4 e5 2. Ke3 *"));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).contains("Invalid move in PGN");
    }

    @Test
    void missingGameReportsNotFound() {
        ToolResult result = dispatcher.execute("get_game_status", Map.of("gameId", "nope"));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).isEqualTo("Game not found: nope");
    }

    @Test
    void createGameAcceptsTimeControl() {
        ToolResult created = dispatcher.execute("create_game", Map.of(
            "whitePlayerId", "alice",
            "blackPlayerId", "bob",
            "timeControl", Map.of("type", "fischer", "initialTime", 180, "increment", 2)));

        assertThat(created.isSuccess()).isTrue();
        assertThat(((MatchView) created.getData()).getWhiteTimeRemaining()).isEqualTo(180L);
    }
}
