package com.bank.p2pfraud.controller;

import com.bank.p2pfraud.engine.model.FraudScorer;
import com.bank.p2pfraud.model.ModelStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Collections;
import java.util.Map;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ModelController.class)
class ModelControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private FraudScorer fraudScorer;

    @Test
    void getStatus_untrained() throws Exception {
        when(fraudScorer.getStatus()).thenReturn(ModelStatus.builder()
                .trained(false)
                .numTrees(100)
                .featureImportance(Collections.emptyMap())
                .build());

        mockMvc.perform(get("/api/v1/model"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.trained").value(false))
                .andExpect(jsonPath("$.numTrees").value(100));
    }

    @Test
    void getStatus_trained() throws Exception {
        when(fraudScorer.getStatus()).thenReturn(ModelStatus.builder()
                .trained(true)
                .numTrees(100)
                .trainingSamples(2500)
                .trainingAccuracy(0.998)
                .trainedAt(1700000000000L)
                .featureImportance(Map.of("amount", 0.31, "failed_attempts", 0.12))
                .build());

        mockMvc.perform(get("/api/v1/model"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.trained").value(true))
                .andExpect(jsonPath("$.trainingSamples").value(2500))
                .andExpect(jsonPath("$.featureImportance.amount").value(0.31));
    }
}
