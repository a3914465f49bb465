package com.pandaduck.exception;

import com.pandaduck.logical.LogicalPlan;

/**
 * Exception thrown when SQL generation fails.
 *
 * <p>Carries the plan node that could not be rendered.
 *
 * @see com.pandaduck.generator.SQLGenerator
 */
public class SQLGenerationException extends RuntimeException {

    private final LogicalPlan failedPlan;

    /**
     * Creates a SQL generation exception.
     *
     * @param message the error message
     * @param plan the logical plan that failed to generate SQL
     */
    public SQLGenerationException(String message, LogicalPlan plan) {
        super(message + " (plan type: " + (plan != null ? plan.getClass().getSimpleName() : "null") + ")");
        this.failedPlan = plan;
    }

    /**
     * Creates a SQL generation exception with a cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     * @param plan the logical plan that failed to generate SQL
     */
    public SQLGenerationException(String message, Throwable cause, LogicalPlan plan) {
        super(message + " (plan type: " + (plan != null ? plan.getClass().getSimpleName() : "null") + ")", cause);
        this.failedPlan = plan;
    }

    /**
     * Returns the logical plan that failed to generate SQL.
     *
     * @return the failed plan, or null if not available
     */
    public LogicalPlan getFailedPlan() {
        return failedPlan;
    }

    /**
     * Returns a user-friendly error message.
     *
     * @return user-friendly error message
     */
    public String getUserMessage() {
        String planType = failedPlan != null ? failedPlan.getClass().getSimpleName() : "unknown";

        switch (planType) {
            case "GroupMap":
                return "Grouped-map computations must be executed through the query executor, " +
                       "which materializes them before generating SQL.";
            case "LocalRelation":
                return "Failed to generate SQL for in-memory rows. " +
                       "Check that row values match the declared schema types.";
            default:
                return "Failed to generate SQL for query. " +
                       "Unsupported operation: " + planType + ".";
        }
    }

    /**
     * Returns a detailed technical message for debugging.
     *
     * @return technical error message with full context
     */
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("SQL Generation Failed\n");
        sb.append("Error: ").append(getMessage()).append("\n");

        if (failedPlan != null) {
            sb.append("Failed Plan Type: ").append(failedPlan.getClass().getName()).append("\n");
            sb.append("Plan String: ").append(failedPlan.toString()).append("\n");
        }

        if (getCause() != null) {
            sb.append("Cause: ").append(getCause().getMessage()).append("\n");
        }

        return sb.toString();
    }
}
