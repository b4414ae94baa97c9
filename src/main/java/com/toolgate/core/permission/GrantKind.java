package com.toolgate.core.permission;

public enum GrantKind {
    TIME,
    ITERATIONS
}
