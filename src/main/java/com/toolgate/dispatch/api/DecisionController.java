package com.toolgate.dispatch.api;

import com.toolgate.core.approval.ApprovalGateway;
import com.toolgate.core.model.ApprovalDecision;
import com.toolgate.core.model.ToolCallRequest;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.context.request.async.AsyncRequestTimeoutException;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Decision endpoint for agents. A request that needs user approval stays open until
 * the approval is answered, cancelled or times out. Serve mode disables the servlet
 * async timeout so the approval timeout decides; if the container still cuts the request
 * off, the pending approval is cancelled and the agent gets {@code approval_timeout}.
 */
@RestController
@RequestMapping("/api/v1/decisions")
public class DecisionController {

    private static final Logger log = LoggerFactory.getLogger(DecisionController.class);

    static final String REQUEST_ATTRIBUTE = DecisionController.class.getName() + ".request";

    private final ApprovalGateway gateway;

    public DecisionController(ApprovalGateway gateway) {
        this.gateway = gateway;
    }

    /**
     * POST /api/v1/decisions — Decide whether a tool call may run.
     */
    @PostMapping
    public CompletableFuture<ResponseEntity<DecisionResponse>> decide(@RequestBody DecisionRequest body,
                                                                      HttpServletRequest servletRequest) {
        ToolCallRequest request = new ToolCallRequest(body.toolName(), body.args(), body.callId());
        servletRequest.setAttribute(REQUEST_ATTRIBUTE, request);
        log.debug("Decision requested for {} ({})", request.toolName(), request.callId());
        return gateway.evaluate(request)
                .thenApply(decision -> ResponseEntity.ok(DecisionResponse.of(request, decision)));
    }

    /**
     * POST /api/v1/decisions/{callId}/outcome — Report how an executed call ended.
     */
    @PostMapping("/{callId}/outcome")
    public ResponseEntity<Map<String, Object>> reportOutcome(@PathVariable String callId,
                                                             @RequestBody OutcomeRequest body) {
        if (body.toolName() == null || body.toolName().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "tool_name is required"));
        }
        gateway.reportOutcome(new ToolCallRequest(body.toolName(), Map.of(), callId), body.succeeded());
        return ResponseEntity.ok(Map.of("call_id", callId, "succeeded", body.succeeded()));
    }

    @ExceptionHandler(AsyncRequestTimeoutException.class)
    public ResponseEntity<DecisionResponse> asyncTimeout(HttpServletRequest servletRequest) {
        Object attribute = servletRequest.getAttribute(REQUEST_ATTRIBUTE);
        if (!(attribute instanceof ToolCallRequest request)) {
            return ResponseEntity.status(503).build();
        }
        log.warn("Decision request for {} ({}) outlived the servlet timeout; cancelling its approval",
                request.toolName(), request.callId());
        gateway.cancel(request.callId());
        return ResponseEntity.ok(DecisionResponse.of(request, ApprovalDecision.timedOut()));
    }
}
