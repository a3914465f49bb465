package com.pandaduck.exception;

/**
 * Raised for selections this layer deliberately does not support: stepped
 * ranges, range or list selection without exactly one index column, bare
 * scalar row labels, bounded column ranges and partial-row assignment.
 */
public class UnsupportedSelectionException extends FrameOperationException {

    public UnsupportedSelectionException(String message, String operation) {
        super(message, operation, null);
    }

    public UnsupportedSelectionException(String message, String operation, String suggestion) {
        super(message, operation, suggestion);
    }
}
