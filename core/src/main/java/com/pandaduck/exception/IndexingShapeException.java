package com.pandaduck.exception;

/**
 * Raised when a selection key has the wrong arity or shape, for example a
 * row/column pair handed to a single-column locator.
 */
public class IndexingShapeException extends FrameOperationException {

    public IndexingShapeException(String message, String operation) {
        super(message, operation, null);
    }

    public IndexingShapeException(String message, String operation, String suggestion) {
        super(message, operation, suggestion);
    }
}
