package com.pandaduck.exception;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Raised when selected or assigned column labels are absent from the
 * underlying schema.
 */
public class SchemaResolutionException extends FrameOperationException {

    private final List<String> missingLabels;

    /**
     * Creates a schema resolution exception.
     *
     * @param missingLabels the labels that could not be resolved
     * @param operation the attempted operation
     */
    public SchemaResolutionException(List<String> missingLabels, String operation) {
        super(missingLabels + " don't exist in columns", operation, null);
        this.missingLabels = new ArrayList<>(missingLabels);
    }

    /**
     * Returns the labels that could not be resolved.
     *
     * @return an unmodifiable list of labels
     */
    public List<String> getMissingLabels() {
        return Collections.unmodifiableList(missingLabels);
    }
}
