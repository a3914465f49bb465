package com.pandaduck.exception;

/**
 * Raised when a recognized pandas API name has no implementation.
 *
 * <p>Message format:
 * <pre>
 *   The method `pd.DataFrame.iloc()` is not implemented yet.
 * </pre>
 */
public class PandasNotImplementedException extends FrameOperationException {

    private final String className;
    private final String name;

    /**
     * Creates a not-implemented exception.
     *
     * @param className the pandas class name (e.g. "pd.DataFrame")
     * @param name the attempted method or property name
     * @param property whether the name is a property rather than a method
     * @param suggestion the suggested replacement idiom, or null
     */
    public PandasNotImplementedException(String className, String name, boolean property, String suggestion) {
        super(String.format("The %s `%s.%s%s` is not implemented yet.",
                property ? "property" : "method", className, name, property ? "" : "()"),
            className + "." + name, suggestion);
        this.className = className;
        this.name = name;
    }

    public String getClassName() {
        return className;
    }

    /**
     * Returns the attempted method or property name.
     *
     * @return the name
     */
    public String getName() {
        return name;
    }
}
