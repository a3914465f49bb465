package com.pandaduck.groupby;

import com.pandaduck.exception.FrameConfigurationException;
import com.pandaduck.test.TestBase;
import com.pandaduck.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("AggregationSpec Tests")
public class AggregationSpecTest extends TestBase {

    @Test
    @DisplayName("A single function per column should stay single-level")
    void testSingleLevel() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("B", "min");
        raw.put("C", List.of("sum"));

        AggregationSpec spec = AggregationSpec.parse(raw);

        assertThat(spec.columns()).containsExactly("B", "C");
        assertThat(spec.isMultiLevel()).isFalse();
        assertThat(spec.outputName("B", "min")).isEqualTo("B");
        assertThat(spec.outputLabel("C", "sum")).containsExactly("C");
    }

    @Test
    @DisplayName("Any list of several functions should make every output two-level")
    void testMultiLevel() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("B", "min");
        raw.put("C", List.of("sum", "mean"));

        AggregationSpec spec = AggregationSpec.parse(raw);

        assertThat(spec.isMultiLevel()).isTrue();
        assertThat(spec.functions().get("C")).containsExactly("sum", "mean");
        assertThat(spec.outputName("B", "min")).isEqualTo("('B', 'min')");
        assertThat(spec.outputLabel("B", "min")).containsExactly("B", "min");
    }

    @ParameterizedTest
    @ValueSource(strings = {"count", "sum", "mean", "min", "max", "first", "last", "std", "var", "all", "any",
        "median", "nunique", "SUM"})
    @DisplayName("Every supported function name should parse")
    void testSupportedFunction(String function) {
        AggregationSpec spec = AggregationSpec.parse(Map.of("B", function));

        assertThat(spec.functions().get("B")).containsExactly(function);
        assertThat(spec.isMultiLevel()).isFalse();
    }

    @Test
    @DisplayName("A function repeated for one column should be rejected")
    void testDuplicateFunction() {
        assertThatThrownBy(() -> AggregationSpec.parse(Map.of("B", List.of("sum", "sum"))))
            .isInstanceOf(FrameConfigurationException.class)
            .hasMessageContaining("requested twice");
    }

    @Test
    @DisplayName("Null, empty and mis-shaped specs should be rejected")
    void testShapes() {
        assertThatThrownBy(() -> AggregationSpec.parse(null))
            .isInstanceOf(FrameConfigurationException.class);
        assertThatThrownBy(() -> AggregationSpec.parse(Map.of("B", List.of())))
            .isInstanceOf(FrameConfigurationException.class);
        assertThatThrownBy(() -> AggregationSpec.parse(Map.of(1, "sum")))
            .isInstanceOf(FrameConfigurationException.class);
        assertThatThrownBy(() -> AggregationSpec.parse(Map.of("B", Arrays.asList("sum", 3))))
            .isInstanceOf(FrameConfigurationException.class)
            .hasMessageContaining("string or list of strings");
    }

    @Test
    @DisplayName("median and nunique should be accepted alongside the reductions")
    void testExtraFunctions() {
        AggregationSpec spec = AggregationSpec.parse(Map.of("B", List.of("median", "nunique", "std")));

        assertThat(spec.functions().get("B")).containsExactly("median", "nunique", "std");
    }

    @Test
    @DisplayName("An unknown function should carry the supported ones as suggestion")
    void testUnknownFunction() {
        assertThatThrownBy(() -> AggregationSpec.parse(Map.of("B", "skew")))
            .isInstanceOf(FrameConfigurationException.class)
            .satisfies(e -> assertThat(((FrameConfigurationException) e).getSuggestion()).contains("nunique"));
    }
}
