package com.pandaduck.runtime;

import com.pandaduck.test.TestBase;
import com.pandaduck.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("FrameConfig Tests")
public class FrameConfigTest extends TestBase {

    @Override
    protected void doTearDown() {
        System.clearProperty(FrameConfig.PROP_JDBC_URL);
        System.clearProperty(FrameConfig.PROP_GROUPMAP_PARALLELISM);
        System.clearProperty(FrameConfig.PROP_GROUPMAP_TIMEOUT_SECONDS);
    }

    @Test
    @DisplayName("Defaults should use an in-memory database")
    void testDefaults() {
        FrameConfig config = FrameConfig.defaults();

        assertThat(config.jdbcUrl()).isEqualTo("jdbc:duckdb:");
        assertThat(config.groupMapParallelism()).isEqualTo(Runtime.getRuntime().availableProcessors());
        assertThat(config.groupMapTimeoutSeconds()).isEqualTo(600L);
    }

    @Test
    @DisplayName("System properties should override the defaults")
    void testSystemProperties() {
        System.setProperty(FrameConfig.PROP_JDBC_URL, "jdbc:duckdb::memory:configured");
        System.setProperty(FrameConfig.PROP_GROUPMAP_PARALLELISM, " 3 ");
        System.setProperty(FrameConfig.PROP_GROUPMAP_TIMEOUT_SECONDS, "42");

        FrameConfig config = FrameConfig.fromSystemProperties();

        assertThat(config.jdbcUrl()).isEqualTo("jdbc:duckdb::memory:configured");
        assertThat(config.groupMapParallelism()).isEqualTo(3);
        assertThat(config.groupMapTimeoutSeconds()).isEqualTo(42L);
        assertThat(config.toString()).isEqualTo(
            "FrameConfig(url=jdbc:duckdb::memory:configured, parallelism=3, timeout=42s)");
    }

    @Test
    @DisplayName("Invalid or out of range properties should fall back to defaults")
    void testInvalidProperties() {
        System.setProperty(FrameConfig.PROP_GROUPMAP_PARALLELISM, "many");
        System.setProperty(FrameConfig.PROP_GROUPMAP_TIMEOUT_SECONDS, "-5");

        FrameConfig config = FrameConfig.fromSystemProperties();

        assertThat(config.groupMapParallelism()).isEqualTo(Runtime.getRuntime().availableProcessors());
        assertThat(config.groupMapTimeoutSeconds()).isEqualTo(FrameConfig.DEFAULT_GROUPMAP_TIMEOUT_SECONDS);
    }

    @Test
    @DisplayName("Explicit values should be validated")
    void testValidation() {
        FrameConfig defaults = FrameConfig.defaults();

        assertThatThrownBy(() -> defaults.withJdbcUrl(""))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> defaults.withGroupMapParallelism(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("groupMapParallelism");
        assertThatThrownBy(() -> defaults.withGroupMapTimeoutSeconds(0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("with methods should leave the original untouched")
    void testImmutable() {
        FrameConfig defaults = FrameConfig.defaults();
        FrameConfig changed = defaults.withGroupMapParallelism(7);

        assertThat(changed.groupMapParallelism()).isEqualTo(7);
        assertThat(defaults.groupMapParallelism()).isEqualTo(Runtime.getRuntime().availableProcessors());
    }
}
