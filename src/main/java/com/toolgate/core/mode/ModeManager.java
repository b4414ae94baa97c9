package com.toolgate.core.mode;

import com.toolgate.core.config.ToolgateProperties;
import com.toolgate.core.events.EventBus;
import com.toolgate.core.events.GateEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Owns the session's operating mode.
 * <p>
 * Mode changes happen only through {@link #cycleMode()} and {@link #setMode(OperatingMode)};
 * every change is appended to the mutation log. The read-only veto in
 * {@link #shouldBlockTool(String, Map)} is absolute: no grant or static permission bypasses it.
 */
@Service
public class ModeManager {

    private static final Logger log = LoggerFactory.getLogger(ModeManager.class);

    private final EventBus eventBus;
    private final Clock clock;
    private final CopyOnWriteArrayList<ModeTransition> history = new CopyOnWriteArrayList<>();

    private volatile OperatingMode currentMode;

    @Autowired
    public ModeManager(ToolgateProperties properties, EventBus eventBus, Clock clock) {
        this(properties.getMode().getInitial(), eventBus, clock);
    }

    public ModeManager(OperatingMode initialMode, EventBus eventBus, Clock clock) {
        this.eventBus = eventBus;
        this.clock = clock;
        this.currentMode = initialMode != null ? initialMode : OperatingMode.NORMAL;
        this.history.add(new ModeTransition(this.currentMode, clock.instant()));
    }

    public OperatingMode currentMode() {
        return currentMode;
    }

    /**
     * Advances to the next mode in {@link OperatingMode#CYCLE_ORDER}.
     */
    public synchronized ModeChange cycleMode() {
        return transitionTo(currentMode.next());
    }

    public synchronized ModeChange setMode(OperatingMode mode) {
        if (mode == null) {
            throw new IllegalArgumentException("Mode must not be null");
        }
        return transitionTo(mode);
    }

    public List<ModeTransition> history() {
        return List.copyOf(history);
    }

    /**
     * Checks the current mode's veto for a tool call.
     *
     * @return {@link ToolBlock#allowed()} unless the mode is read-only and the call would write
     */
    public ToolBlock shouldBlockTool(String toolName, Map<String, Object> args) {
        return blockFor(currentMode, toolName, args);
    }

    /**
     * Whether an ask-type permission may be approved without prompting in the current mode.
     * Auto-approve modes approve everything; read-only modes approve only read-only tools.
     */
    public boolean shouldAutoApprove(String toolName) {
        OperatingMode mode = currentMode;
        if (mode.autoApprove()) {
            return true;
        }
        if (mode.readOnly()) {
            return WriteOperationClassifier.isReadOnlyTool(toolName);
        }
        return false;
    }

    public String systemPromptModifier() {
        return ModePrompts.modifierFor(currentMode);
    }

    /** Short display string for a mode indicator, e.g. {@code "PLAN (read-only)"}. */
    public String indicator() {
        OperatingMode mode = currentMode;
        if (mode.readOnly()) {
            return mode.name() + " (read-only)";
        }
        if (mode.autoApprove()) {
            return mode.name() + " (auto-approve)";
        }
        return mode.name();
    }

    public String description() {
        return currentMode.description();
    }

    static ToolBlock blockFor(OperatingMode mode, String toolName, Map<String, Object> args) {
        if (!mode.readOnly()) {
            return ToolBlock.allowed();
        }
        if (!WriteOperationClassifier.isWriteOperation(toolName, args)) {
            return ToolBlock.allowed();
        }
        String reason = "Tool '" + toolName + "' blocked in " + mode.name() + " mode. "
                + "This operation would modify files and " + mode.name() + " mode is read-only. "
                + "Switch to NORMAL or AUTO mode to run it, or approve the plan with \"go ahead\".";
        return ToolBlock.blocked(reason);
    }

    private ModeChange transitionTo(OperatingMode next) {
        OperatingMode previous = currentMode;
        Instant now = clock.instant();
        currentMode = next;
        history.add(new ModeTransition(next, now));
        log.info("Mode transition: {} -> {}", previous, next);

        eventBus.publish(new GateEvent(
                GateEvent.MODE_CHANGED, null, null,
                Map.of("previous", previous.name(), "current", next.name(),
                        "readOnly", next.readOnly(), "autoApprove", next.autoApprove()),
                now));
        return new ModeChange(previous, next);
    }
}
