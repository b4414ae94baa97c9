package com.toolgate.core.model;

public class InvalidPermissionException extends IllegalArgumentException {

    public InvalidPermissionException(String message) {
        super(message);
    }
}
