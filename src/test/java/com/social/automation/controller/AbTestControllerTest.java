package com.social.automation.controller;

import com.social.automation.engine.abtest.TestAnalysis;
import com.social.automation.model.PagedResponse;
import com.social.automation.model.VariantWeightChange;
import com.social.automation.repository.VariantWeightHistoryRepository;
import com.social.automation.service.OptimizationResult;
import com.social.automation.service.VariantOptimizationService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AbTestController.class)
class AbTestControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private VariantOptimizationService optimizationService;

    @MockBean
    private VariantWeightHistoryRepository weightHistoryRepo;

    @Test
    void getWinner_returnsPerTestAnalysis() throws Exception {
        when(optimizationService.analyze("R-1", 100)).thenReturn(Map.of("t1",
                new TestAnalysis("t1", "A", "B", 0.001, "ctr", null, Map.of(), List.of())));

        mockMvc.perform(get("/api/v1/abtests/R-1/winner").param("minSamples", "100"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.t1.winner").value("A"))
                .andExpect(jsonPath("$.t1.metric").value("ctr"));
    }

    @Test
    void optimize_unknownRule_returns404() throws Exception {
        when(optimizationService.autoOptimize("MISSING"))
                .thenReturn(new OptimizationResult("MISSING", false, "rule_not_found", Map.of(), Map.of()));

        mockMvc.perform(post("/api/v1/abtests/MISSING/optimize"))
                .andExpect(status().isNotFound());
    }

    @Test
    void optimize_noTests_returnsReason() throws Exception {
        when(optimizationService.autoOptimize("R-1"))
                .thenReturn(new OptimizationResult("R-1", false, "no_tests", Map.of(), Map.of()));

        mockMvc.perform(post("/api/v1/abtests/R-1/optimize"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.updated").value(false))
                .andExpect(jsonPath("$.reason").value("no_tests"));
    }

    @Test
    void getHistory_paginates() throws Exception {
        VariantWeightChange change = VariantWeightChange.builder()
                .ruleId("R-1").testId("t1").variantId("A").oldWeight(0.5).newWeight(0.7)
                .reason("winner").pValue(0.01).adjustedAt(5_000L).build();
        when(weightHistoryRepo.findByRuleId("R-1", 1, null))
                .thenReturn(new PagedResponse<>(List.of(change), true, "5000"));

        mockMvc.perform(get("/api/v1/abtests/R-1/history").param("limit", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].newWeight").value(0.7))
                .andExpect(jsonPath("$.hasMore").value(true))
                .andExpect(jsonPath("$.nextCursor").value("5000"));
    }
}
