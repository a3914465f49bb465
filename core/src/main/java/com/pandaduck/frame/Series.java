package com.pandaduck.frame;

import com.pandaduck.logical.LogicalPlan;
import com.pandaduck.selection.Locator;

import java.util.ArrayList;
import java.util.List;

/**
 * A frame with exactly one data column.
 *
 * <p>The series name is the column's physical name. Its locator is bound to
 * that column, so {@code series.loc().get(rows)} keeps returning series.
 */
public class Series extends Frame {

    /**
     * Creates a series.
     *
     * @param session the owning session
     * @param plan the plan computing the rows
     * @param metadata metadata with exactly one data column
     * @throws IllegalArgumentException if the metadata does not have exactly one data column
     */
    public Series(FrameSession session, LogicalPlan plan, FrameMetadata metadata) {
        super(session, plan, metadata);
        if (metadata.dataColumns().size() != 1) {
            throw new IllegalArgumentException(
                "A series has exactly one data column, got " + metadata.dataColumns());
        }
    }

    public String name() {
        return metadata().dataColumns().get(0);
    }

    @Override
    protected Series withPlan(LogicalPlan newPlan) {
        return new Series(session(), newPlan, metadata().copy().schema(newPlan.schema()).build());
    }

    @Override
    public Series sortIndex() {
        return (Series) super.sortIndex();
    }

    @Override
    public Locator loc() {
        return new Locator(this, name());
    }

    /**
     * Executes the plan and returns the values with their index.
     *
     * @return the materialized series
     */
    public LocalSeries toLocalSeries() {
        LocalFrame frame = collect();
        List<Object[]> index = new ArrayList<>(frame.size());
        List<Object> values = new ArrayList<>(frame.size());
        for (int i = 0; i < frame.size(); i++) {
            index.add(frame.index(i));
            values.add(frame.row(i)[0]);
        }
        return new LocalSeries(name(), frame.indexNames(), index, values);
    }

    @Override
    public String toString() {
        return String.format("Series(name=%s, index=%s)", name(), indexNames());
    }
}
