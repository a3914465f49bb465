package com.pandaduck.exception;

/**
 * Raised when an operation is configured incorrectly: a malformed
 * aggregation spec, a grouped map without a declared return schema, or a
 * cumulative operation on a frame without an index.
 */
public class FrameConfigurationException extends FrameOperationException {

    public FrameConfigurationException(String message, String operation) {
        super(message, operation, null);
    }

    public FrameConfigurationException(String message, String operation, String suggestion) {
        super(message, operation, suggestion);
    }
}
