package com.pandaduck.groupby;

import com.pandaduck.frame.LocalFrame;

/**
 * User function for {@link GroupBy#apply}: maps one group to any number of rows.
 */
@FunctionalInterface
public interface GroupApplyFunction {

    /**
     * Computes the output of one group.
     *
     * @param group the group's rows, carrying the parent's index
     * @return the output rows, laid out positionally as the declared schema
     * @throws Exception if the computation fails
     */
    LocalFrame apply(LocalFrame group) throws Exception;
}
