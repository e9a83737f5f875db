package com.chessmatch.controller;

import com.chessmatch.tool.ToolDispatcher;
import com.chessmatch.tool.ToolResult;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ToolController.class)
class ToolControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ToolDispatcher toolDispatcher;

    @Test
    void toolFailureStillAnswersOk() throws Exception {
        when(toolDispatcher.execute(eq("castle_now"), any())).thenReturn(ToolResult.failure("Unknown tool: castle_now"));

        mockMvc.perform(post("/api/tools/castle_now")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(false))
            .andExpect(jsonPath("$.error").value("Unknown tool: castle_now"))
            .andExpect(jsonPath("$.data").doesNotExist());
    }

    @Test
    void successfulToolReturnsData() throws Exception {
        when(toolDispatcher.execute(eq("get_draw_status"), any()))
            .thenReturn(ToolResult.ok(Map.of("gameId", "g1")));

        mockMvc.perform(post("/api/tools/get_draw_status")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"gameId\":\"g1\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.data.gameId").value("g1"));
    }
}
