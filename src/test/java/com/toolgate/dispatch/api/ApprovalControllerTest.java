package com.toolgate.dispatch.api;

import com.toolgate.core.approval.ApprovalGateway;
import com.toolgate.core.approval.ApprovalPrompt;
import com.toolgate.core.approval.ApprovalResponse;
import com.toolgate.core.approval.PendingApprovalRegistry;
import com.toolgate.core.approval.PendingApprovalRegistry.PendingApproval;
import com.toolgate.core.model.ToolCallRequest;
import com.toolgate.core.model.ToolPermission;
import com.toolgate.core.permission.ExpirationReason;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ApprovalController.class)
@TestPropertySource(properties = {
        "spring.main.web-application-type=servlet",
        "toolgate.approval.channel=http"
})
class ApprovalControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private PendingApprovalRegistry registry;

    @MockitoBean
    private ApprovalGateway gateway;

    private PendingApproval pending;

    @BeforeEach
    void setUp() {
        ApprovalPrompt prompt = new ApprovalPrompt(
                new ToolCallRequest("bash", Map.of("command", "git push"), "call-1"),
                ToolPermission.ASK_ITERATIONS, ExpirationReason.ITERATIONS_EXHAUSTED, Duration.ofMinutes(5), 10);
        pending = new PendingApproval(prompt, Instant.parse("2026-01-01T00:00:00Z"), new CompletableFuture<>());
        when(registry.get("call-1")).thenReturn(Optional.of(pending));
        when(registry.get("missing")).thenReturn(Optional.empty());
        when(registry.resolve(eq("call-1"), any())).thenReturn(true);
    }

    @Test
    @DisplayName("GET /approvals lists waiting prompts")
    void list() throws Exception {
        when(registry.list()).thenReturn(List.of(pending));

        mockMvc.perform(get("/api/v1/approvals"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].call_id").value("call-1"))
                .andExpect(jsonPath("$[0].tool_name").value("bash"))
                .andExpect(jsonPath("$[0].permission").value("ask-iterations"))
                .andExpect(jsonPath("$[0].expiration_reason").value("iterations_exhausted"))
                .andExpect(jsonPath("$[0].offers_temporary_grant").value(true));
    }

    @Test
    @DisplayName("POST /approvals/{callId} with iterations resolves the prompt")
    void answerIterations() throws Exception {
        mockMvc.perform(post("/api/v1/approvals/call-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"response\":\"iterations\",\"iterations\":3}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.response").value("iterations"));

        verify(registry).resolve("call-1", new ApprovalResponse.YesIterations(3));
    }

    @Test
    @DisplayName("POST /approvals/{callId} with time and no duration uses the default")
    void answerTimeDefault() throws Exception {
        mockMvc.perform(post("/api/v1/approvals/call-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"response\":\"time\"}"))
                .andExpect(status().isOk());

        verify(registry).resolve("call-1", new ApprovalResponse.YesTime(Duration.ofMinutes(5)));
    }

    @Test
    @DisplayName("POST /approvals/{callId} with an unknown response returns 400")
    void badResponse() throws Exception {
        mockMvc.perform(post("/api/v1/approvals/call-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"response\":\"perhaps\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").exists());

        verify(registry, never()).resolve(anyString(), any());
    }

    @Test
    @DisplayName("POST /approvals/{callId} for an unknown call returns 404")
    void unknownCall() throws Exception {
        mockMvc.perform(post("/api/v1/approvals/missing")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"response\":\"yes\"}"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("DELETE /approvals/{callId} cancels through the gateway")
    void cancel() throws Exception {
        when(gateway.cancel("call-1")).thenReturn(true);

        mockMvc.perform(delete("/api/v1/approvals/call-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("cancelled"));
    }

    @Test
    @DisplayName("DELETE /approvals/{callId} for an unknown call returns 404")
    void cancelUnknown() throws Exception {
        mockMvc.perform(delete("/api/v1/approvals/missing"))
                .andExpect(status().isNotFound());
    }
}
