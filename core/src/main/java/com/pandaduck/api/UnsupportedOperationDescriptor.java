package com.pandaduck.api;

import com.pandaduck.exception.PandasNotImplementedException;

/**
 * A recognized pandas name without an implementation.
 *
 * @param className the pandas class, e.g. {@code pd.DataFrame}
 * @param name the method or property name
 * @param property whether the name is a property
 * @param suggestion the closest supported idiom, or null
 */
public record UnsupportedOperationDescriptor(String className, String name, boolean property, String suggestion) {

    public PandasNotImplementedException toException() {
        return new PandasNotImplementedException(className, name, property, suggestion);
    }
}
