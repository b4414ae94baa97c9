package com.toolgate.core.policy;

import com.toolgate.core.model.ToolPermission;

import java.util.List;

/**
 * Configured policy for one tool.
 *
 * @param permission static permission applied when no glob matches
 * @param allowlist  globs that approve a matching call outright
 * @param denylist   globs that deny a matching call outright; checked before the allowlist
 */
public record ToolRule(
    ToolPermission permission,
    List<String> allowlist,
    List<String> denylist
) {

    public ToolRule {
        allowlist = allowlist != null ? List.copyOf(allowlist) : List.of();
        denylist = denylist != null ? List.copyOf(denylist) : List.of();
    }

    public static ToolRule of(ToolPermission permission) {
        return new ToolRule(permission, List.of(), List.of());
    }

    public ToolRule withPermission(ToolPermission newPermission) {
        return new ToolRule(newPermission, allowlist, denylist);
    }
}
