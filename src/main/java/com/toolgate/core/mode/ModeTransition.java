package com.toolgate.core.mode;

import java.time.Instant;

/**
 * One entry of the mode mutation log.
 */
public record ModeTransition(OperatingMode mode, Instant timestamp) {}
