package com.bank.p2pfraud.controller;

import com.bank.p2pfraud.exception.AlreadyResolvedException;
import com.bank.p2pfraud.exception.CaseNotAssignableException;
import com.bank.p2pfraud.exception.ValidationException;
import com.bank.p2pfraud.model.*;
import com.bank.p2pfraud.service.CaseManagementService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static com.bank.p2pfraud.testutil.TestDataFactory.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(CaseController.class)
class CaseControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private CaseManagementService caseManagementService;

    @Test
    void listForInvestigator_filtersByStatus() throws Exception {
        when(caseManagementService.listCasesForInvestigator(investigator(), INVESTIGATOR_ID, CaseStatus.ASSIGNED))
                .thenReturn(List.of(createCase("CASE-1", "TXN-1", CasePriority.HIGH)));

        mockMvc.perform(get("/api/v1/cases/investigator/" + INVESTIGATOR_ID)
                        .header("X-Caller-Id", INVESTIGATOR_ID)
                        .header("X-Caller-Role", "INVESTIGATOR")
                        .param("status", "ASSIGNED"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].caseId").value("CASE-1"))
                .andExpect(jsonPath("$[0].priority").value("HIGH"));
    }

    @Test
    void assignCase_success() throws Exception {
        InvestigationCase assigned = createCase("CASE-1", "TXN-1", CasePriority.MEDIUM);
        assigned.setAssignedTo(INVESTIGATOR_ID);
        when(caseManagementService.assignCase(admin(), "CASE-1", INVESTIGATOR_ID)).thenReturn(assigned);

        mockMvc.perform(post("/api/v1/cases/CASE-1/assign")
                        .header("X-Caller-Id", ADMIN_ID)
                        .header("X-Caller-Role", "ADMIN")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new AssignCaseRequest(INVESTIGATOR_ID))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.assignedTo").value(INVESTIGATOR_ID))
                .andExpect(jsonPath("$.status").value("ASSIGNED"));
    }

    @Test
    void assignCase_resolvedCase_returns409() throws Exception {
        when(caseManagementService.assignCase(any(), eq("CASE-1"), anyString()))
                .thenThrow(new CaseNotAssignableException("Case CASE-1 is RESOLVED"));

        mockMvc.perform(post("/api/v1/cases/CASE-1/assign")
                        .header("X-Caller-Id", ADMIN_ID)
                        .header("X-Caller-Role", "ADMIN")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new AssignCaseRequest(INVESTIGATOR_ID))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.message").value("Case CASE-1 is RESOLVED"));
    }

    @Test
    void resolveCase_safe() throws Exception {
        InvestigationCase resolved = createCase("CASE-1", "TXN-1", CasePriority.HIGH);
        resolved.setStatus(CaseStatus.RESOLVED);
        resolved.setFinding(CaseFinding.SAFE);
        resolved.setConfidence(90);
        when(caseManagementService.resolveCase(investigator(), "CASE-1", CaseFinding.SAFE, report(), 90))
                .thenReturn(new CaseResolution(resolved, TransactionStatus.SETTLED, true));

        mockMvc.perform(post("/api/v1/cases/CASE-1/resolve")
                        .header("X-Caller-Id", INVESTIGATOR_ID)
                        .header("X-Caller-Role", "INVESTIGATOR")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                new ResolveCaseRequest(CaseFinding.SAFE, report(), 90))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.investigationCase.finding").value("SAFE"))
                .andExpect(jsonPath("$.transactionStatus").value("SETTLED"))
                .andExpect(jsonPath("$.balancesChanged").value(true));
    }

    @Test
    void resolveCase_shortReport_returns400() throws Exception {
        when(caseManagementService.resolveCase(any(), anyString(), any(), anyString(), any()))
                .thenThrow(new ValidationException("Report must be at least 100 characters"));

        mockMvc.perform(post("/api/v1/cases/CASE-1/resolve")
                        .header("X-Caller-Id", INVESTIGATOR_ID)
                        .header("X-Caller-Role", "INVESTIGATOR")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                new ResolveCaseRequest(CaseFinding.FRAUDULENT, "too short", null))))
                .andExpect(status().isBadRequest());
    }

    @Test
    void resolveCase_alreadyResolved_returns409() throws Exception {
        when(caseManagementService.resolveCase(any(), anyString(), any(), anyString(), any()))
                .thenThrow(new AlreadyResolvedException("Case CASE-1 is already resolved"));

        mockMvc.perform(post("/api/v1/cases/CASE-1/resolve")
                        .header("X-Caller-Id", INVESTIGATOR_ID)
                        .header("X-Caller-Role", "INVESTIGATOR")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                new ResolveCaseRequest(CaseFinding.SAFE, report(), 80))))
                .andExpect(status().isConflict());
    }

    @Test
    void resolveCase_malformedBody_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/cases/CASE-1/resolve")
                        .header("X-Caller-Id", INVESTIGATOR_ID)
                        .header("X-Caller-Role", "INVESTIGATOR")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"finding\": \"MAYBE\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(caseManagementService);
    }

    @Test
    void getStats_success() throws Exception {
        when(caseManagementService.getStats(admin())).thenReturn(new CaseStats(
                Map.of(CaseStatus.IN_REVIEW, 2L, CaseStatus.RESOLVED, 5L),
                Map.of(CaseFinding.SAFE, 3L, CaseFinding.FRAUDULENT, 2L)));

        mockMvc.perform(get("/api/v1/cases/stats")
                        .header("X-Caller-Id", ADMIN_ID)
                        .header("X-Caller-Role", "ADMIN"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.byStatus.IN_REVIEW").value(2))
                .andExpect(jsonPath("$.byFinding.FRAUDULENT").value(2));
    }
}
