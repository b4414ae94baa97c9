package com.toolgate.core.permission;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically purges expired time grants so idle tools do not keep stale entries.
 */
@Component
public class GrantSweeper {

    private final PermissionTracker tracker;

    public GrantSweeper(PermissionTracker tracker) {
        this.tracker = tracker;
    }

    @Scheduled(fixedDelayString = "#{@toolgateProperties.grants.sweepIntervalMs}")
    public void sweep() {
        tracker.cleanupExpired();
    }
}
