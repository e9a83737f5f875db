package com.chessmatch.controller;

import com.chessmatch.chess.PgnParseException;
import com.chessmatch.dto.ErrorResponse;
import com.chessmatch.exception.CapacityExceededException;
import com.chessmatch.exception.CorruptStateException;
import com.chessmatch.exception.IllegalMatchStateException;
import com.chessmatch.exception.InvalidMoveException;
import com.chessmatch.exception.MatchNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.stream.Collectors;

// ========== API Error Mapping ==========
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(MatchNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(MatchNotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, e.getMessage(), null);
    }

    @ExceptionHandler(IllegalMatchStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(IllegalMatchStateException e) {
        return respond(HttpStatus.CONFLICT, e.getMessage(), null);
    }

    @ExceptionHandler(InvalidMoveException.class)
    public ResponseEntity<ErrorResponse> handleInvalidMove(InvalidMoveException e) {
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, e.getMessage(), e.getSuggestion().orElse(null));
    }

    @ExceptionHandler(CapacityExceededException.class)
    public ResponseEntity<ErrorResponse> handleCapacity(CapacityExceededException e) {
        return respond(HttpStatus.TOO_MANY_REQUESTS, e.getMessage(), "Finish, pause or delete an active game first");
    }

    @ExceptionHandler(CorruptStateException.class)
    public ResponseEntity<ErrorResponse> handleCorrupt(CorruptStateException e) {
        log.error("Corrupt game record {}", e.getMatchId(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage(), null);
    }

    @ExceptionHandler({PgnParseException.class, IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> handleBadInput(RuntimeException e) {
        return respond(HttpStatus.BAD_REQUEST, e.getMessage(), null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .collect(Collectors.joining(", "));
        return respond(HttpStatus.BAD_REQUEST, message, null);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String message, String suggestion) {
        return ResponseEntity.status(status).body(ErrorResponse.builder()
            .status(status.value())
            .error(status.getReasonPhrase())
            .message(message)
            .suggestion(suggestion)
            .timestamp(LocalDateTime.now())
            .build());
    }
}
