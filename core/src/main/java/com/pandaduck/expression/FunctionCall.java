package com.pandaduck.expression;

import com.pandaduck.types.DataType;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Expression representing a scalar function call rendered verbatim as DuckDB SQL.
 *
 * <p>Examples:
 * <pre>
 *   log(value)                 -- math function
 *   isnan(value)               -- NaN test
 *   coalesce(flag, TRUE)       -- multi-argument function
 *   error('message')           -- raises at evaluation time
 * </pre>
 */
public final class FunctionCall implements Expression {

    private final String functionName;
    private final List<Expression> arguments;
    private final DataType dataType;
    private final boolean nullable;

    /**
     * Creates a function call expression.
     *
     * @param functionName the DuckDB function name
     * @param arguments the function arguments
     * @param dataType the return data type
     * @param nullable whether the result can be null
     */
    public FunctionCall(String functionName, List<Expression> arguments,
                        DataType dataType, boolean nullable) {
        this.functionName = Objects.requireNonNull(functionName, "functionName must not be null");
        if (this.functionName.trim().isEmpty()) {
            throw new IllegalArgumentException("functionName must not be empty");
        }
        this.arguments = new ArrayList<>(Objects.requireNonNull(arguments, "arguments must not be null"));
        this.dataType = Objects.requireNonNull(dataType, "dataType must not be null");
        this.nullable = nullable;
    }

    /**
     * Creates a function call expression with nullable result.
     *
     * @param functionName the function name
     * @param arguments the function arguments
     * @param dataType the return data type
     */
    public FunctionCall(String functionName, List<Expression> arguments, DataType dataType) {
        this(functionName, arguments, dataType, true);
    }

    public String functionName() {
        return functionName;
    }

    /**
     * Returns the function arguments.
     *
     * @return an unmodifiable list of arguments
     */
    public List<Expression> arguments() {
        return Collections.unmodifiableList(arguments);
    }

    @Override
    public DataType dataType() {
        return dataType;
    }

    @Override
    public boolean nullable() {
        return nullable;
    }

    @Override
    public String toSQL() {
        String args = arguments.stream()
            .map(Expression::toSQL)
            .collect(Collectors.joining(", "));
        return functionName + "(" + args + ")";
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FunctionCall)) return false;
        FunctionCall that = (FunctionCall) obj;
        return nullable == that.nullable &&
               functionName.equals(that.functionName) &&
               arguments.equals(that.arguments) &&
               dataType.equals(that.dataType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(functionName, arguments, dataType, nullable);
    }

    /**
     * Creates a function call with nullable result.
     *
     * @param functionName the function name
     * @param returnType the return type
     * @param arguments the arguments
     * @return the function call
     */
    public static FunctionCall of(String functionName, DataType returnType, Expression... arguments) {
        return new FunctionCall(functionName, Arrays.asList(arguments), returnType);
    }
}
