package com.pandaduck.groupby;

import com.pandaduck.frame.LocalSeries;

/**
 * User function for {@link GroupBy#transform}: maps one column of one group
 * to a column of the same length.
 */
@FunctionalInterface
public interface GroupTransformFunction {

    LocalSeries apply(LocalSeries column) throws Exception;
}
