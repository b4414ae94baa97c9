package com.toolgate.dispatch.api;

import com.toolgate.core.mode.ModeChange;
import com.toolgate.core.mode.ModeManager;
import com.toolgate.core.mode.OperatingMode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/mode")
public class ModeController {

    private final ModeManager modeManager;

    public ModeController(ModeManager modeManager) {
        this.modeManager = modeManager;
    }

    @GetMapping
    public Map<String, Object> current() {
        return describe(modeManager.currentMode());
    }

    /**
     * GET /api/v1/mode/prompt — System prompt block for the current mode.
     */
    @GetMapping("/prompt")
    public Map<String, Object> prompt() {
        return Map.of("mode", modeManager.currentMode().name(),
                "system_prompt_modifier", modeManager.systemPromptModifier());
    }

    @PostMapping("/cycle")
    public Map<String, Object> cycle() {
        return changed(modeManager.cycleMode());
    }

    @PutMapping("/{mode}")
    public ResponseEntity<Map<String, Object>> set(@PathVariable String mode) {
        OperatingMode target;
        try {
            target = OperatingMode.fromName(mode);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "Unknown mode: " + mode));
        }
        return ResponseEntity.ok(changed(modeManager.setMode(target)));
    }

    private Map<String, Object> changed(ModeChange change) {
        Map<String, Object> json = describe(change.current());
        json.put("previous", change.previous().name());
        return json;
    }

    private Map<String, Object> describe(OperatingMode mode) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("mode", mode.name());
        json.put("read_only", mode.readOnly());
        json.put("auto_approve", mode.autoApprove());
        json.put("description", mode.description());
        return json;
    }
}
