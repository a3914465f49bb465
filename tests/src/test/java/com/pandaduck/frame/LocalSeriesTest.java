package com.pandaduck.frame;

import com.pandaduck.test.TestBase;
import com.pandaduck.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("LocalSeries Tests")
public class LocalSeriesTest extends TestBase {

    @Nested
    @DisplayName("min and max")
    class Extremes {

        @Test
        @DisplayName("Missing values should be skipped")
        void testSkipsMissing() {
            LocalSeries series = LocalSeries.of("v", Arrays.asList(3.0, null, Double.NaN, -1.5, 2.0));

            assertThat(series.min()).isEqualTo(-1.5);
            assertThat(series.max()).isEqualTo(3.0);
        }

        @Test
        @DisplayName("Strings should use their natural order")
        void testStrings() {
            LocalSeries series = LocalSeries.of("s", List.of("pear", "apple", "quince"));

            assertThat(series.min()).isEqualTo("apple");
            assertThat(series.max()).isEqualTo("quince");
        }

        @Test
        @DisplayName("An all-missing series should have no extreme")
        void testAllMissing() {
            LocalSeries series = LocalSeries.of("v", Arrays.asList(null, Double.NaN));

            assertThat(series.min()).isNull();
            assertThat(series.max()).isNull();
        }

        @Test
        @DisplayName("Values without a natural order should be rejected")
        void testUnordered() {
            LocalSeries series = LocalSeries.of("v", List.of(new Object(), new Object()));

            assertThatThrownBy(series::min)
                .isInstanceOf(ClassCastException.class)
                .hasMessageContaining("cannot be ordered");
        }
    }
}
