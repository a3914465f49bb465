package com.pandaduck.logical;

import java.util.List;

/**
 * A per-group row function executed by a {@link GroupMap} node.
 *
 * <p>The function receives all rows of one physical group, laid out as the
 * child plan's schema and in the node's within-group order, and returns the
 * output rows laid out as the node's declared schema.
 */
@FunctionalInterface
public interface GroupMapFunction {

    /**
     * Computes the output rows of one group.
     *
     * @param groupRows the rows of the group
     * @return the output rows (never null)
     * @throws Exception if the user computation fails
     */
    List<Object[]> apply(List<Object[]> groupRows) throws Exception;
}
