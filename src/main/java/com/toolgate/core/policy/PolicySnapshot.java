package com.toolgate.core.policy;

import com.toolgate.core.model.ToolPermission;

import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable view of all configured tool rules. A change produces a new snapshot.
 *
 * @param rules             rules keyed by tool name
 * @param defaultPermission permission for tools with no rule
 */
public record PolicySnapshot(Map<String, ToolRule> rules, ToolPermission defaultPermission) {

    public PolicySnapshot {
        rules = rules != null ? Map.copyOf(rules) : Map.of();
        if (defaultPermission == null) {
            defaultPermission = ToolPermission.ASK;
        }
    }

    public ToolRule ruleFor(String toolName) {
        ToolRule rule = rules.get(toolName);
        return rule != null ? rule : ToolRule.of(defaultPermission);
    }

    public boolean isConfigured(String toolName) {
        return rules.containsKey(toolName);
    }

    public PolicySnapshot withRule(String toolName, ToolRule rule) {
        Map<String, ToolRule> copy = new TreeMap<>(rules);
        copy.put(toolName, rule);
        return new PolicySnapshot(copy, defaultPermission);
    }

    /** Rules sorted by tool name, for display. */
    public Map<String, ToolRule> sortedRules() {
        return new TreeMap<>(rules);
    }
}
