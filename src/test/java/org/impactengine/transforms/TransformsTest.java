package org.impactengine.transforms;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.impactengine.api.data.ColumnType;
import org.impactengine.api.data.PanelFrame;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertSame;

@Tag("unit")
class TransformsTest {

    private static PanelFrame metrics() {
        return PanelFrame.builder()
            .column("product_id", ColumnType.STRING)
            .column("date", ColumnType.DATE)
            .column("revenue", ColumnType.DOUBLE)
            .column("units", ColumnType.LONG)
            .column("quality_score", ColumnType.DOUBLE)
            .column("metrics_source", ColumnType.STRING)
            .row("p1", "2024-01-02", 10.0, 1L, 0.5, "file")
            .row("p2", "2024-01-01", 20.0, 2L, 0.7, "file")
            .row("p1", "2024-01-01", 5.0, null, 0.5, "file")
            .row("p2", "2024-01-02", null, 4L, null, "file")
            .build();
    }

    private static Config params(Map<String, ?> values) {
        return ConfigFactory.parseMap(values);
    }

    @Test
    void passthrough_returnsInput() {
        PanelFrame data = metrics();
        assertSame(data, new PassthroughTransform().apply(data, ConfigFactory.empty()));
    }

    @Test
    void aggregateByDate_sumsNumericColumnsPerDate() {
        PanelFrame result = new AggregateByDateTransform().apply(metrics(), ConfigFactory.empty());

        assertThat(result.columns()).containsExactly("date", "revenue", "units", "quality_score");
        assertThat(result.column("date")).containsExactly(LocalDate.parse("2024-01-01"), LocalDate.parse("2024-01-02"));
        assertThat(result.column("revenue")).containsExactly(25.0, 10.0);
        assertThat(result.column("units")).containsExactly(2L, 5L);
        assertThat(result.type("units")).isEqualTo(ColumnType.LONG);
    }

    @Test
    void aggregateByDate_ordersKeysByColumnTypeWithNullsLast() {
        PanelFrame weekly = PanelFrame.builder()
            .column("week", ColumnType.LONG)
            .column("revenue", ColumnType.DOUBLE)
            .row(10L, 1.0)
            .row(null, 4.0)
            .row(9L, 2.0)
            .row(10L, 3.0)
            .build();

        PanelFrame result = new AggregateByDateTransform().apply(weekly, params(Map.of("date_column", "week")));

        assertThat(result.column("week")).containsExactly(9L, 10L, null);
        assertThat(result.column("revenue")).containsExactly(2.0, 4.0, 4.0);
    }

    @Test
    void aggregateByDate_missingOrNonNumericMetric_fails() {
        AggregateByDateTransform transform = new AggregateByDateTransform();

        assertThatThrownBy(() -> transform.apply(metrics(), params(Map.of("metric", "sales"))))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("sales");
        assertThatThrownBy(() -> transform.apply(metrics(), params(Map.of("metric", "metrics_source"))))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("must be numeric");
        assertThatThrownBy(() -> transform.apply(metrics().select(List.of("revenue")), ConfigFactory.empty()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("'date'");
    }

    @Test
    void aggregateForApproximation_buildsOneRowPerProduct() {
        PanelFrame result = new AggregateForApproximationTransform()
            .apply(metrics(), params(Map.of("carry_columns", List.of("quality_score"))));

        assertThat(result.columns()).containsExactly("product_id", "baseline_sales", "quality_score");
        assertThat(result.column("product_id")).containsExactly("p1", "p2");
        assertThat(result.column("baseline_sales")).containsExactly(15.0, 20.0);
        assertThat(result.column("quality_score")).containsExactly(0.5, 0.7);
    }

    @Test
    void aggregateForApproximation_fallsBackToAsin() {
        PanelFrame data = PanelFrame.builder()
            .column("asin", ColumnType.STRING)
            .column("revenue", ColumnType.LONG)
            .row("B01", 3L)
            .row("B01", 4L)
            .build();

        PanelFrame result = new AggregateForApproximationTransform().apply(data, ConfigFactory.empty());

        assertThat(result.column("product_id")).containsExactly("B01");
        assertThat(result.column("baseline_sales")).containsExactly(7.0);
    }

    @Test
    void aggregateForApproximation_withoutIdColumn_fails() {
        PanelFrame data = metrics().select(List.of("date", "revenue"));
        assertThatThrownBy(() -> new AggregateForApproximationTransform().apply(data, ConfigFactory.empty()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("'product_id' or 'asin'");
    }
}
