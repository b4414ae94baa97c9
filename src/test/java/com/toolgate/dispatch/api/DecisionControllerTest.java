package com.toolgate.dispatch.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.toolgate.core.approval.ApprovalGateway;
import com.toolgate.core.model.ApprovalDecision;
import com.toolgate.core.model.DenialKind;
import com.toolgate.core.model.ToolCallRequest;
import jakarta.servlet.AsyncEvent;
import jakarta.servlet.AsyncListener;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockAsyncContext;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(DecisionController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class DecisionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private ApprovalGateway gateway;

    // ── POST /api/v1/decisions ───────────────────────────────────────

    @Test
    @DisplayName("POST /decisions returns the execute decision")
    void execute() throws Exception {
        when(gateway.evaluate(any())).thenReturn(
                CompletableFuture.completedFuture(ApprovalDecision.execute("always")));

        String body = objectMapper.writeValueAsString(
                new DecisionRequest("bash", Map.of("command", "git status"), "call-7"));

        MvcResult pending = mockMvc.perform(post("/api/v1/decisions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(pending))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.call_id").value("call-7"))
                .andExpect(jsonPath("$.tool_name").value("bash"))
                .andExpect(jsonPath("$.verdict").value("EXECUTE"))
                .andExpect(jsonPath("$.reason").value("always"));

        ArgumentCaptor<ToolCallRequest> captor = ArgumentCaptor.forClass(ToolCallRequest.class);
        verify(gateway).evaluate(captor.capture());
        assertEquals("git status", captor.getValue().args().get("command"));
    }

    @Test
    @DisplayName("POST /decisions returns skip with denial kind")
    void skip() throws Exception {
        when(gateway.evaluate(any())).thenReturn(
                CompletableFuture.completedFuture(ApprovalDecision.skip(DenialKind.MODE_VETO, "blocked in PLAN mode")));

        MvcResult pending = mockMvc.perform(post("/api/v1/decisions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tool_name\":\"write_file\",\"args\":{\"path\":\"a.txt\"}}"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(pending))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.verdict").value("SKIP"))
                .andExpect(jsonPath("$.denial").value("MODE_VETO"))
                .andExpect(jsonPath("$.call_id").isNotEmpty());
    }

    @Test
    @DisplayName("POST /decisions that outlives the servlet timeout answers approval_timeout and cancels the prompt")
    void servletTimeout() throws Exception {
        when(gateway.evaluate(any())).thenReturn(new CompletableFuture<>());

        MvcResult pending = mockMvc.perform(post("/api/v1/decisions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tool_name\":\"bash\",\"args\":{\"command\":\"git push\"},\"call_id\":\"c1\"}"))
                .andExpect(request().asyncStarted())
                .andReturn();

        MockAsyncContext asyncContext = (MockAsyncContext) pending.getRequest().getAsyncContext();
        for (AsyncListener listener : asyncContext.getListeners()) {
            listener.onTimeout(new AsyncEvent(asyncContext));
        }

        mockMvc.perform(asyncDispatch(pending))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.call_id").value("c1"))
                .andExpect(jsonPath("$.verdict").value("SKIP"))
                .andExpect(jsonPath("$.reason").value("approval_timeout"))
                .andExpect(jsonPath("$.denial").value("APPROVAL_TIMEOUT"));

        verify(gateway).cancel("c1");
    }

    // ── POST /api/v1/decisions/{callId}/outcome ──────────────────────

    @Test
    @DisplayName("POST /decisions/{callId}/outcome reports the outcome to the gateway")
    void outcome() throws Exception {
        mockMvc.perform(post("/api/v1/decisions/call-7/outcome")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tool_name\":\"bash\",\"succeeded\":false}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.succeeded").value(false));

        ArgumentCaptor<ToolCallRequest> captor = ArgumentCaptor.forClass(ToolCallRequest.class);
        verify(gateway).reportOutcome(captor.capture(), eq(false));
        assertEquals("call-7", captor.getValue().callId());
        assertEquals("bash", captor.getValue().toolName());
    }

    @Test
    @DisplayName("POST /decisions/{callId}/outcome without tool_name returns 400")
    void outcomeWithoutTool() throws Exception {
        mockMvc.perform(post("/api/v1/decisions/call-7/outcome")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"succeeded\":true}"))
                .andExpect(status().isBadRequest());
    }
}
