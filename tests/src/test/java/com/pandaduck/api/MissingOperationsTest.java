package com.pandaduck.api;

import com.pandaduck.exception.PandasNotImplementedException;
import com.pandaduck.frame.Frame;
import com.pandaduck.frame.LocalFrame;
import com.pandaduck.test.FrameTestBase;
import com.pandaduck.test.TestCategories;
import com.pandaduck.types.DoubleType;
import com.pandaduck.types.IntegerType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Integration
@DisplayName("Missing Operations Tests")
public class MissingOperationsTest extends FrameTestBase {

    private Frame df;

    @Override
    protected void doSetUp() {
        super.doSetUp();
        df = frame(schema(field("A", IntegerType.get()), field("B", DoubleType.get())),
            row(2, 1.0), row(1, 2.0), row(2, 3.0));
    }

    @Nested
    @DisplayName("Frame names")
    class FrameNames {

        @Test
        @DisplayName("A missing property should name the property and its alternative")
        void testMissingProperty() {
            assertThatThrownBy(() -> df.call("iloc"))
                .isInstanceOf(PandasNotImplementedException.class)
                .hasMessage("The property `pd.DataFrame.iloc` is not implemented yet.")
                .satisfies(e -> {
                    PandasNotImplementedException missing = (PandasNotImplementedException) e;
                    assertThat(missing.getClassName()).isEqualTo("pd.DataFrame");
                    assertThat(missing.getName()).isEqualTo("iloc");
                    assertThat(missing.getSuggestion()).contains("loc()");
                });
        }

        @Test
        @DisplayName("A missing method should render with parentheses")
        void testMissingMethod() {
            assertThatThrownBy(() -> df.call("transpose"))
                .isInstanceOf(PandasNotImplementedException.class)
                .hasMessage("The method `pd.DataFrame.transpose()` is not implemented yet.");
        }

        @Test
        @DisplayName("An unknown name should not look like a missing operation")
        void testUnknownName() {
            assertThatThrownBy(() -> df.call("no_such_thing"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("no_such_thing");
        }

        @Test
        @DisplayName("Supported names should dispatch to the operation")
        void testSupportedNames() {
            Object sorted = df.call("sort_index");
            Object columns = df.call("columns");
            Object length = df.call("__len__");

            assertThat(sorted).isInstanceOf(Frame.class);
            assertThat(columns).isEqualTo(List.of("A", "B"));
            assertThat(length).isEqualTo(3L);
            assertThat(df.call("to_pandas")).isInstanceOf(LocalFrame.class);
        }

        @Test
        @DisplayName("sort_index should not be registered as missing")
        void testSortIndexNotMissing() {
            assertThat(MissingOperations.lookup(MissingOperations.FRAME, "sort_index")).isEmpty();
            assertThat(MissingOperations.registered(MissingOperations.FRAME)).containsKey("transpose");
        }
    }

    @Nested
    @DisplayName("GroupBy names")
    class GroupByNames {

        @Test
        @DisplayName("A missing group-by method should suggest a supported idiom")
        void testMissingGroupByMethod() {
            assertThatThrownBy(() -> df.groupBy("A").call("median"))
                .isInstanceOf(PandasNotImplementedException.class)
                .hasMessage("The method `pd.GroupBy.median()` is not implemented yet.")
                .satisfies(e -> assertThat(((PandasNotImplementedException) e).getSuggestion())
                    .contains("aggregate"));
        }

        @Test
        @DisplayName("A missing group-by property should not render parentheses")
        void testMissingGroupByProperty() {
            assertThatThrownBy(() -> df.groupBy("A").call("ngroups"))
                .isInstanceOf(PandasNotImplementedException.class)
                .hasMessage("The property `pd.GroupBy.ngroups` is not implemented yet.");
        }

        @Test
        @DisplayName("Supported group-by names should dispatch")
        void testSupportedGroupByName() {
            Frame summed = df.groupBy("A").call("sum");

            assertThat(summed.collect().column("B")).containsExactly(2.0, 4.0);
            assertThat(GroupByOperation.fromName("cumprod")).isEqualTo(GroupByOperation.CUMPROD);
            assertThat(GroupByOperation.fromName("median")).isNull();
        }
    }
}
