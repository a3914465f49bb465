package com.pandaduck.exception;

/**
 * Raised when an argument has the wrong kind: a missing grouped-map
 * function, a non-boolean row predicate or an assignment value of the wrong
 * shape.
 */
public class TypeMismatchException extends FrameOperationException {

    public TypeMismatchException(String message, String operation) {
        super(message, operation, null);
    }

    public TypeMismatchException(String message, String operation, String suggestion) {
        super(message, operation, suggestion);
    }
}
