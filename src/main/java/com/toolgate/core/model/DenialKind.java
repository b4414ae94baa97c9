package com.toolgate.core.model;

/**
 * Why a tool call was skipped. Every kind is a local, recoverable outcome.
 */
public enum DenialKind {
    MODE_VETO,
    PERMISSION_DENIED,
    APPROVAL_DECLINED,
    APPROVAL_CANCELLED,
    APPROVAL_TIMEOUT,
    UNKNOWN_TOOL
}
