package com.toolgate.core.policy;

/**
 * Thrown when a policy change cannot be written to the configuration store.
 */
public class PolicyPersistenceException extends RuntimeException {
    public PolicyPersistenceException(String message) {
        super(message);
    }

    public PolicyPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
