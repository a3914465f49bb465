package com.pandaduck.test;

import com.pandaduck.frame.Frame;
import com.pandaduck.frame.FrameSession;
import com.pandaduck.runtime.FrameConfig;
import com.pandaduck.types.DataType;
import com.pandaduck.types.StructField;
import com.pandaduck.types.StructType;

import java.util.Arrays;
import java.util.List;

/**
 * Base class for tests that execute frames.
 *
 * <p>Each test gets its own session over a fresh in-memory database.
 */
public abstract class FrameTestBase extends TestBase {

    protected FrameSession session;

    @Override
    protected void doSetUp() {
        FrameConfig config = FrameConfig.defaults()
            .withJdbcUrl("jdbc:duckdb::memory:test_" + System.nanoTime())
            .withGroupMapParallelism(2)
            .withGroupMapTimeoutSeconds(60);
        session = FrameSession.create(config);
    }

    @Override
    protected void doTearDown() {
        if (session != null) {
            session.close();
        }
    }

    protected static StructType schema(StructField... fields) {
        return new StructType(fields);
    }

    protected static StructField field(String name, DataType type) {
        return new StructField(name, type, true);
    }

    protected static List<Object[]> rows(Object[]... rows) {
        return Arrays.asList(rows);
    }

    protected static Object[] row(Object... values) {
        return values;
    }

    protected Frame frame(StructType schema, Object[]... rows) {
        return session.createFrame(schema, rows(rows));
    }
}
