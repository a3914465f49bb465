package com.pandaduck.frame;

import com.pandaduck.exception.SchemaResolutionException;
import com.pandaduck.test.TestBase;
import com.pandaduck.test.TestCategories;
import com.pandaduck.types.DoubleType;
import com.pandaduck.types.IntegerType;
import com.pandaduck.types.LongType;
import com.pandaduck.types.StructField;
import com.pandaduck.types.StructType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("FrameMetadata Tests")
public class FrameMetadataTest extends TestBase {

    private StructType schema;

    @Override
    protected void doSetUp() {
        schema = new StructType(
            new StructField("__index_level_0__", LongType.get(), false),
            new StructField("A", IntegerType.get(), true),
            new StructField("B", DoubleType.get(), true));
    }

    private FrameMetadata metadata() {
        return FrameMetadata.builder(schema)
            .indexColumns(List.of(IndexColumn.unnamed("__index_level_0__")))
            .dataColumns(List.of("A", "B"))
            .build();
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("Should expose index and data columns in order")
        void testAccessors() {
            FrameMetadata metadata = metadata();

            assertThat(metadata.indexColumnIds()).containsExactly("__index_level_0__");
            assertThat(metadata.indexNames()).containsExactly((String) null);
            assertThat(metadata.dataColumns()).containsExactly("A", "B");
            assertThat(metadata.projectedColumnIds()).containsExactly("__index_level_0__", "A", "B");
            assertThat(metadata.columnLabels()).isEmpty();
            assertThat(metadata.hasIndex()).isTrue();
        }

        @Test
        @DisplayName("Should reject a column missing from the schema")
        void testMissingColumn() {
            assertThatThrownBy(() -> FrameMetadata.builder(schema).dataColumns(List.of("A", "Z")).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Z");
        }

        @Test
        @DisplayName("Should reject a column used twice")
        void testDuplicateColumn() {
            assertThatThrownBy(() -> FrameMetadata.builder(schema)
                    .indexColumns(List.of(IndexColumn.named("A")))
                    .dataColumns(List.of("A", "B"))
                    .build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate");
        }

        @Test
        @DisplayName("Should reject labels not aligned with data columns")
        void testMisalignedLabels() {
            assertThatThrownBy(() -> FrameMetadata.builder(schema)
                    .dataColumns(List.of("A", "B"))
                    .columnLabels(List.of(List.of("A", "min")))
                    .build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("1 column labels given for 2 data columns");
        }
    }

    @Nested
    @DisplayName("Copy-on-write")
    class CopyOnWrite {

        @Test
        @DisplayName("copy() should replace only the overridden fields")
        void testCopyOverrides() {
            FrameMetadata original = metadata();

            FrameMetadata narrowed = original.copy().dataColumns(List.of("B")).build();

            assertThat(narrowed.dataColumns()).containsExactly("B");
            assertThat(narrowed.indexColumns()).isEqualTo(original.indexColumns());
            assertThat(narrowed.schema()).isEqualTo(original.schema());
            assertThat(original.dataColumns()).containsExactly("A", "B");
        }

        @Test
        @DisplayName("Returned lists should be unmodifiable")
        void testImmutableLists() {
            FrameMetadata metadata = metadata();

            assertThatThrownBy(() -> metadata.dataColumns().add("C"))
                .isInstanceOf(UnsupportedOperationException.class);
        }

        @Test
        @DisplayName("Equal contents should give equal metadata")
        void testEquality() {
            assertThat(metadata()).isEqualTo(metadata());
            assertThat(metadata().hashCode()).isEqualTo(metadata().hashCode());
        }

        @Test
        @DisplayName("Dropping every labeled column should keep the label depth")
        void testLabelDepthSurvivesEmptySelection() {
            FrameMetadata labeled = metadata().copy()
                .columnLabels(List.of(List.of("A", "sum"), List.of("B", "sum")))
                .build();

            FrameMetadata emptied = labeled.copy()
                .dataColumns(List.of())
                .columnLabels(List.of())
                .build();

            assertThat(labeled.labelLevels()).isEqualTo(2);
            assertThat(emptied.labelLevels()).isEqualTo(2);
            assertThat(metadata().labelLevels()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Type lookup")
    class TypeLookup {

        @Test
        @DisplayName("declaredType should return the schema type")
        void testDeclaredType() {
            assertThat(metadata().declaredType("B")).isEqualTo(DoubleType.get());
            assertThat(metadata().declaredType("__index_level_0__")).isEqualTo(LongType.get());
        }

        @Test
        @DisplayName("declaredType of an unknown column should fail with the label")
        void testUnknownColumn() {
            assertThatThrownBy(() -> metadata().declaredType("Z"))
                .isInstanceOf(SchemaResolutionException.class)
                .satisfies(e -> assertThat(((SchemaResolutionException) e).getMissingLabels()).containsExactly("Z"));
        }

        @Test
        @DisplayName("labelOf should fall back to the column name")
        void testLabelOf() {
            FrameMetadata labeled = metadata().copy()
                .columnLabels(List.of(List.of("A", "min"), List.of("B", "sum")))
                .build();

            assertThat(metadata().labelOf("A")).containsExactly("A");
            assertThat(labeled.labelOf("B")).containsExactly("B", "sum");
        }
    }
}
