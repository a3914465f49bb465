package com.pandaduck.api;

import com.pandaduck.frame.Frame;

import java.util.Locale;
import java.util.function.Function;

/**
 * Frame operations reachable by their pandas name through {@link Frame#call(String)}.
 */
public enum FrameOperation {
    SORT_INDEX("sort_index", Frame::sortIndex),
    RESET_INDEX("reset_index", Frame::resetIndex),
    TO_PANDAS("to_pandas", Frame::collect),
    COUNT_ROWS("__len__", Frame::count),
    EXPLAIN("explain", Frame::explain),
    COLUMNS("columns", Frame::columns);

    private final String pandasName;
    private final Function<Frame, Object> operation;

    FrameOperation(String pandasName, Function<Frame, Object> operation) {
        this.pandasName = pandasName;
        this.operation = operation;
    }

    public String pandasName() {
        return pandasName;
    }

    public Object invoke(Frame frame) {
        return operation.apply(frame);
    }

    /**
     * Looks up an operation by its pandas name.
     *
     * @param name the name
     * @return the operation, or null if none has that name
     */
    public static FrameOperation fromName(String name) {
        if (name == null) {
            return null;
        }
        String normalized = name.toLowerCase(Locale.ROOT);
        for (FrameOperation operation : values()) {
            if (operation.pandasName.equals(normalized)) {
                return operation;
            }
        }
        return null;
    }
}
