package com.pandaduck.exception;

/**
 * Base class of the errors raised synchronously by frame, locator and
 * group-by operations, before any query is executed.
 *
 * <p>Every error names the attempted operation and, where one exists, the
 * nearest supported alternative:
 * <pre>
 *   try {
 *       frame.loc().get(RowSelector.label(3));
 *   } catch (FrameOperationException e) {
 *       System.err.println(e.getUserMessage());
 *   }
 * </pre>
 */
public class FrameOperationException extends RuntimeException {

    private final String operation;
    private final String suggestion;

    /**
     * Creates a frame operation exception.
     *
     * @param message the error message
     * @param operation the attempted operation (e.g. "loc", "groupby.aggregate")
     * @param suggestion the nearest supported alternative, or null
     */
    public FrameOperationException(String message, String operation, String suggestion) {
        super(message);
        this.operation = operation;
        this.suggestion = suggestion;
    }

    /**
     * Creates a frame operation exception with a cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     * @param operation the attempted operation
     */
    public FrameOperationException(String message, Throwable cause, String operation) {
        super(message, cause);
        this.operation = operation;
        this.suggestion = null;
    }

    /**
     * Returns the attempted operation.
     *
     * @return the operation name
     */
    public String getOperation() {
        return operation;
    }

    /**
     * Returns the nearest supported alternative.
     *
     * @return the suggestion, or null if there is none
     */
    public String getSuggestion() {
        return suggestion;
    }

    /**
     * Returns a message naming the operation, the problem and the suggested alternative.
     *
     * @return user-facing error message
     */
    public String getUserMessage() {
        StringBuilder sb = new StringBuilder();
        if (operation != null) {
            sb.append(operation).append(": ");
        }
        sb.append(getMessage());
        if (suggestion != null) {
            sb.append(" Suggestion: ").append(suggestion);
        }
        return sb.toString();
    }
}
