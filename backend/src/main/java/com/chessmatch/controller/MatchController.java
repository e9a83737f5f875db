package com.chessmatch.controller;

import com.chessmatch.chess.MoveValidation;
import com.chessmatch.dto.CompleteMatchRequest;
import com.chessmatch.dto.CreateMatchRequest;
import com.chessmatch.dto.ImportMatchRequest;
import com.chessmatch.dto.MatchView;
import com.chessmatch.dto.MoveRequest;
import com.chessmatch.dto.ParticipantRequest;
import com.chessmatch.model.BoardState;
import com.chessmatch.model.DrawStatus;
import com.chessmatch.model.ExportFormat;
import com.chessmatch.model.GameExport;
import com.chessmatch.model.ImportResult;
import com.chessmatch.model.Match;
import com.chessmatch.model.MatchStatus;
import com.chessmatch.model.MoveHistory;
import com.chessmatch.model.MoveHistoryFormat;
import com.chessmatch.service.MatchService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import jakarta.validation.Valid;
import java.util.List;
import java.util.stream.Collectors;

// ========== Match Controller ==========
@RestController
@RequestMapping("/api/matches")
@RequiredArgsConstructor
@Tag(name = "Matches", description = "Chess game lifecycle")
public class MatchController {

    private final MatchService matchService;

    @PostMapping
    @Operation(summary = "Create game")
    public ResponseEntity<MatchView> createMatch(@Valid @RequestBody CreateMatchRequest request) {
        Match match = matchService.createMatch(request.getWhitePlayerId(), request.getBlackPlayerId(),
            request.getTimeControl());
        return ResponseEntity.status(HttpStatus.CREATED).body(MatchView.from(match));
    }

    @GetMapping
    @Operation(summary = "List games, optionally by status and/or player")
    public ResponseEntity<List<MatchView>> listMatches(
            @RequestParam(required = false) MatchStatus status,
            @RequestParam(required = false) String playerId) {
        List<Match> matches;
        if (playerId != null) {
            matches = matchService.listByParticipant(playerId).stream()
                .filter(match -> status == null || match.getStatus() == status)
                .collect(Collectors.toList());
        } else if (status != null) {
            matches = matchService.listByStatus(status);
        } else {
            matches = matchService.listAll();
        }
        return ResponseEntity.ok(matches.stream().map(MatchView::from).collect(Collectors.toList()));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get game by ID")
    public ResponseEntity<MatchView> getMatchById(@PathVariable String id) {
        return matchService.getMatch(id)
            .map(MatchView::from)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete game")
    public ResponseEntity<Void> deleteMatch(@PathVariable String id) {
        return matchService.deleteMatch(id)
            ? ResponseEntity.noContent().build()
            : ResponseEntity.notFound().build();
    }

    // ========== Moves ==========

    @PostMapping("/{id}/moves")
    @Operation(summary = "Make a move")
    public ResponseEntity<MatchView> makeMove(@PathVariable String id, @Valid @RequestBody MoveRequest request) {
        return ResponseEntity.ok(MatchView.from(matchService.applyMove(id, request.getPlayerId(), request.getMove())));
    }

    @GetMapping("/{id}/validate")
    @Operation(summary = "Validate a move without playing it")
    public ResponseEntity<MoveValidation> validateMove(@PathVariable String id, @RequestParam String move) {
        return ResponseEntity.ok(matchService.validateMove(id, move));
    }

    @GetMapping("/{id}/legal-moves")
    @Operation(summary = "Get legal moves, optionally from one square")
    public ResponseEntity<List<String>> getLegalMoves(
            @PathVariable String id,
            @RequestParam(required = false) String square) {
        return ResponseEntity.ok(matchService.getLegalMoves(id, square));
    }

    @GetMapping("/{id}/history")
    @Operation(summary = "Get move history")
    public ResponseEntity<MoveHistory> getMoveHistory(
            @PathVariable String id,
            @RequestParam(defaultValue = "algebraic") String format) {
        return ResponseEntity.ok(matchService.getMoveHistory(id, MoveHistoryFormat.parse(format)));
    }

    @GetMapping("/{id}/board")
    @Operation(summary = "Get board state")
    public ResponseEntity<BoardState> getBoardState(@PathVariable String id) {
        return ResponseEntity.ok(matchService.getBoardState(id));
    }

    @GetMapping("/{id}/draw-status")
    @Operation(summary = "Get fifty-move and repetition counters")
    public ResponseEntity<DrawStatus> getDrawStatus(@PathVariable String id) {
        return matchService.getDrawStatus(id)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.noContent().build());
    }

    // ========== Lifecycle ==========

    @PostMapping("/{id}/resign")
    @Operation(summary = "Resign")
    public ResponseEntity<MatchView> resign(@PathVariable String id, @Valid @RequestBody ParticipantRequest request) {
        return ResponseEntity.ok(MatchView.from(matchService.resign(id, request.getPlayerId())));
    }

    @PostMapping("/{id}/draw/offer")
    @Operation(summary = "Offer a draw")
    public ResponseEntity<MatchView> offerDraw(@PathVariable String id, @Valid @RequestBody ParticipantRequest request) {
        return ResponseEntity.ok(MatchView.from(matchService.offerDraw(id, request.getPlayerId())));
    }

    @PostMapping("/{id}/draw/accept")
    @Operation(summary = "Accept the outstanding draw offer")
    public ResponseEntity<MatchView> acceptDraw(@PathVariable String id, @Valid @RequestBody ParticipantRequest request) {
        return ResponseEntity.ok(MatchView.from(matchService.acceptDraw(id, request.getPlayerId())));
    }

    @PostMapping("/{id}/draw/decline")
    @Operation(summary = "Decline the outstanding draw offer")
    public ResponseEntity<MatchView> declineDraw(@PathVariable String id, @Valid @RequestBody ParticipantRequest request) {
        return ResponseEntity.ok(MatchView.from(matchService.declineDraw(id, request.getPlayerId())));
    }

    @PostMapping("/{id}/pause")
    @Operation(summary = "Pause game")
    public ResponseEntity<MatchView> pause(@PathVariable String id, @Valid @RequestBody ParticipantRequest request) {
        return ResponseEntity.ok(MatchView.from(matchService.pause(id, request.getPlayerId())));
    }

    @PostMapping("/{id}/resume")
    @Operation(summary = "Resume game")
    public ResponseEntity<MatchView> resume(@PathVariable String id) {
        return ResponseEntity.ok(MatchView.from(matchService.resume(id)));
    }

    @PostMapping("/{id}/complete")
    @Operation(summary = "Record a final result")
    public ResponseEntity<MatchView> complete(@PathVariable String id, @Valid @RequestBody CompleteMatchRequest request) {
        return ResponseEntity.ok(MatchView.from(matchService.completeMatch(id, request.getResult())));
    }

    // ========== Transcripts ==========

    @GetMapping("/{id}/export")
    @Operation(summary = "Export game as PGN or FEN")
    public ResponseEntity<GameExport> export(
            @PathVariable String id,
            @RequestParam(defaultValue = "PGN") String format) {
        return ResponseEntity.ok(matchService.exportMatch(id, ExportFormat.parse(format)));
    }

    @PostMapping("/import")
    @Operation(summary = "Import game from PGN")
    public ResponseEntity<ImportResult> importMatch(@Valid @RequestBody ImportMatchRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(matchService.importMatch(request.getPgn(), request.getWhitePlayerId(), request.getBlackPlayerId()));
    }
}
