package com.toolgate.core.policy;

import com.toolgate.core.model.ToolPermission;

import java.io.IOException;
import java.util.Map;

/**
 * Durable store for per-tool policy.
 */
public interface PermissionConfigStore {

    /**
     * Reads every configured tool rule. A store with nothing in it yields an empty map.
     */
    Map<String, ToolRule> load() throws IOException;

    /**
     * Writes {@code tools.<toolName>.permission}, leaving the rest of the configuration intact.
     */
    void setPermission(String toolName, ToolPermission permission) throws IOException;

    /** Human-readable location of the store, for logs and the CLI. */
    String location();
}
