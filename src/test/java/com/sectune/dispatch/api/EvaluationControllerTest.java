package com.sectune.dispatch.api;

import com.sectune.core.evaluation.PerformanceEvaluator;
import com.sectune.core.model.PerformanceRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(EvaluationController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class EvaluationControllerTest {

    private static final String MODEL = "ft-sec-1";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private PerformanceEvaluator evaluator;

    private static PerformanceRecord record(double score) {
        return new PerformanceRecord(MODEL, "accuracy", score, 20, Instant.parse("2026-05-01T12:00:00Z"));
    }

    @Test
    @DisplayName("POST /models/{id}/evaluations returns 201 with the record")
    void evaluate() throws Exception {
        when(evaluator.evaluate(MODEL)).thenReturn(Optional.of(record(0.85)));

        mockMvc.perform(post("/api/v1/models/" + MODEL + "/evaluations"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.score").value(0.85))
                .andExpect(jsonPath("$.evaluationType").value("accuracy"));
    }

    @Test
    @DisplayName("POST /models/{id}/evaluations returns 204 when nothing was evaluated")
    void evaluateEmpty() throws Exception {
        when(evaluator.evaluate(MODEL)).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/v1/models/" + MODEL + "/evaluations"))
                .andExpect(status().isNoContent());
    }

    @Test
    @DisplayName("GET /models/{id}/evaluations lists history")
    void history() throws Exception {
        when(evaluator.history(MODEL)).thenReturn(List.of(record(0.7), record(0.8)));

        mockMvc.perform(get("/api/v1/models/" + MODEL + "/evaluations"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)));
    }
}
