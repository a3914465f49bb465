package com.pandaduck.groupby;

import com.pandaduck.frame.LocalFrame;

/**
 * User predicate for {@link GroupBy#filter}: decides whether a group's rows are kept.
 */
@FunctionalInterface
public interface GroupFilterFunction {

    boolean test(LocalFrame group) throws Exception;
}
