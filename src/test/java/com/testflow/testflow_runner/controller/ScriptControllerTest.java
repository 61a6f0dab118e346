package com.testflow.testflow_runner.controller;

import com.testflow.testflow_runner.parser.StructuralParseException;
import com.testflow.testflow_runner.service.ScriptAnalysis;
import com.testflow.testflow_runner.service.ScriptAnalyzer;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ScriptController.class)
class ScriptControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ScriptAnalyzer analyzer;

    @Test
    void returnsAnalysis() throws Exception {
        when(analyzer.analyze("bench.atoms")).thenReturn(new ScriptAnalysis("bench.atoms", 1, 9,
                List.of(new ScriptAnalysis.NodeSummary(1, "STANDARD", 3, 7, "Measure", "DMM")),
                List.of(new ScriptAnalysis.LoopSummary(1, 2, 2, 8)),
                Map.of(), List.of(), List.of(), 2, 1500, "00:00:01",
                List.of("N", "Loop(1)", "Date", "Time")));

        mockMvc.perform(post("/api/scripts/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"scriptPath\":\"bench.atoms\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.nodes[0].instrument").value("DMM"))
                .andExpect(jsonPath("$.expectedSteps").value(2))
                .andExpect(jsonPath("$.estimatedDelay").value("00:00:01"));
    }

    @Test
    void structuralErrorIsBadRequest() throws Exception {
        when(analyzer.analyze("broken.atoms")).thenThrow(new StructuralParseException(4, "Loop_end(1) without an open Loop_start(1)"));

        mockMvc.perform(post("/api/scripts/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"scriptPath\":\"broken.atoms\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Line 4: Loop_end(1) without an open Loop_start(1)"));
    }
}
