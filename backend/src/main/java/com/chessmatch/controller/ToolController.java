package com.chessmatch.controller;

import com.chessmatch.tool.ToolDefinition;
import com.chessmatch.tool.ToolDispatcher;
import com.chessmatch.tool.ToolResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

// ========== Tool Controller ==========
// Tool failures are part of the result body, so execution always answers 200.
@RestController
@RequestMapping("/api/tools")
@RequiredArgsConstructor
@Tag(name = "Tools", description = "Tool-calling interface for agent clients")
public class ToolController {

    private final ToolDispatcher toolDispatcher;

    @GetMapping
    @Operation(summary = "List available tools and their parameter schemas")
    public ResponseEntity<List<ToolDefinition>> listTools() {
        return ResponseEntity.ok(toolDispatcher.listTools());
    }

    @PostMapping("/{name}")
    @Operation(summary = "Execute a tool")
    public ResponseEntity<ToolResult> execute(
            @PathVariable String name,
            @RequestBody(required = false) Map<String, Object> parameters) {
        return ResponseEntity.ok(toolDispatcher.execute(name, parameters));
    }
}
