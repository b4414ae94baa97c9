package com.toolgate.core.policy;

import com.toolgate.core.config.ToolgateProperties;
import com.toolgate.core.events.EventBus;
import com.toolgate.core.events.GateEvent;
import com.toolgate.core.model.InvalidPermissionException;
import com.toolgate.core.model.ToolArguments;
import com.toolgate.core.model.ToolPermission;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Resolves the static permission for a tool call.
 * <p>
 * Rules are read from an immutable {@link PolicySnapshot} held in an atomic reference;
 * readers never lock. {@link #persistAlways(String)} and {@link #reload()} serialize on a
 * dedicated write lock and publish a fresh snapshot only after the store accepted the change.
 */
@Service
public class PermissionPolicy {

    private static final Logger log = LoggerFactory.getLogger(PermissionPolicy.class);

    private final PermissionConfigStore store;
    private final EventBus eventBus;
    private final ToolPermission defaultPermission;
    private final AtomicReference<PolicySnapshot> snapshot = new AtomicReference<>();
    private final ReentrantLock writeLock = new ReentrantLock();

    @Autowired
    public PermissionPolicy(PermissionConfigStore store, ToolgateProperties properties, EventBus eventBus) {
        this(store, parseDefault(properties.getPolicy().getDefaultPermission()), eventBus);
    }

    public PermissionPolicy(PermissionConfigStore store, ToolPermission defaultPermission, EventBus eventBus) {
        this.store = store;
        this.eventBus = eventBus;
        this.defaultPermission = defaultPermission != null ? defaultPermission : ToolPermission.ASK;
        this.snapshot.set(loadSnapshot());
    }

    /**
     * Permission for this particular call. A deny glob match yields {@code NEVER} and an
     * allow glob match {@code ALWAYS}, for this call only; otherwise the tool's configured
     * permission, or the default for unconfigured tools.
     */
    public ToolPermission resolve(String toolName, Map<String, Object> args) {
        ToolRule rule = snapshot.get().ruleFor(toolName);
        String subject = ToolArguments.subject(args);
        if (!subject.isEmpty()) {
            if (ArgumentGlobMatcher.matchesAny(rule.denylist(), subject)) {
                log.debug("Deny glob matched for {}: {}", toolName, subject);
                return ToolPermission.NEVER;
            }
            if (ArgumentGlobMatcher.matchesAny(rule.allowlist(), subject)) {
                log.debug("Allow glob matched for {}: {}", toolName, subject);
                return ToolPermission.ALWAYS;
            }
        }
        return rule.permission();
    }

    public ToolRule rule(String toolName) {
        return snapshot.get().ruleFor(toolName);
    }

    public PolicySnapshot snapshot() {
        return snapshot.get();
    }

    public String location() {
        return store.location();
    }

    /**
     * Records {@code always} for the tool in the configuration store and then in memory.
     * Either both happen or neither.
     *
     * @throws PolicyPersistenceException if the store rejects the write; the in-memory policy is unchanged
     */
    public void persistAlways(String toolName) {
        writeLock.lock();
        try {
            try {
                store.setPermission(toolName, ToolPermission.ALWAYS);
            } catch (IOException | RuntimeException e) {
                throw new PolicyPersistenceException(
                        "Failed to persist 'always' for tool " + toolName + " to " + store.location(), e);
            }
            PolicySnapshot current = snapshot.get();
            snapshot.set(current.withRule(toolName, current.ruleFor(toolName).withPermission(ToolPermission.ALWAYS)));
        } finally {
            writeLock.unlock();
        }
        log.info("Persisted permission 'always' for tool {}", toolName);
        eventBus.publish(new GateEvent(GateEvent.POLICY_PERSISTED, toolName, null,
                Map.of("permission", ToolPermission.ALWAYS.configValue()), Instant.now()));
    }

    /**
     * Re-reads the store. On failure the current snapshot stays in place.
     */
    public void reload() {
        writeLock.lock();
        try {
            snapshot.set(readSnapshot());
            log.info("Reloaded tool policy from {}", store.location());
        } catch (IOException e) {
            throw new PolicyPersistenceException("Failed to reload tool policy from " + store.location(), e);
        } finally {
            writeLock.unlock();
        }
    }

    private PolicySnapshot loadSnapshot() {
        try {
            PolicySnapshot loaded = readSnapshot();
            log.info("Loaded {} tool rule(s) from {}", loaded.rules().size(), store.location());
            return loaded;
        } catch (IOException e) {
            log.warn("Could not read tool policy from {}: {}; using defaults", store.location(), e.getMessage());
            return new PolicySnapshot(Map.of(), defaultPermission);
        }
    }

    private PolicySnapshot readSnapshot() throws IOException {
        return new PolicySnapshot(store.load(), defaultPermission);
    }

    private static ToolPermission parseDefault(String value) {
        try {
            return ToolPermission.fromConfig(value);
        } catch (InvalidPermissionException e) {
            log.warn("Invalid toolgate.policy.default-permission: {}; using ask", e.getMessage());
            return ToolPermission.ASK;
        }
    }
}
