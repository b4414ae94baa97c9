package com.toolgate.dispatch.api;

import com.toolgate.core.permission.GrantStatus;
import com.toolgate.core.permission.PermissionTracker;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/grants")
public class GrantController {

    private final PermissionTracker tracker;

    public GrantController(PermissionTracker tracker) {
        this.tracker = tracker;
    }

    @GetMapping
    public List<GrantStatus> list() {
        return tracker.activeGrantStatuses();
    }

    /**
     * DELETE /api/v1/grants/{tool} — Revoke the tool's temporary grant.
     */
    @DeleteMapping("/{tool}")
    public ResponseEntity<Map<String, Object>> revoke(@PathVariable String tool) {
        boolean existed = tracker.remaining(tool).isPresent();
        tracker.revoke(tool);
        return ResponseEntity.ok(Map.of("tool_name", tool, "revoked", existed));
    }
}
