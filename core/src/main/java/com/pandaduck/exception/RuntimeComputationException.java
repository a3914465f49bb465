package com.pandaduck.exception;

/**
 * Exception thrown when a job fails on data it evaluates: a non-positive
 * value reaching a cumulative product, or a grouped-map function that throws
 * or returns rows that do not fit its declared schema.
 */
public class RuntimeComputationException extends QueryExecutionException {

    public RuntimeComputationException(String message, String sql) {
        super(message, sql);
    }

    public RuntimeComputationException(String message, Throwable cause, String sql) {
        super(message, cause, sql);
    }

    @Override
    public String getUserMessage() {
        return "Computation failed while evaluating data: " + getMessage();
    }
}
