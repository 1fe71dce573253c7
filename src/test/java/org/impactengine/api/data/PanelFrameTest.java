package org.impactengine.api.data;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@Tag("unit")
class PanelFrameTest {

    private static PanelFrame panel() {
        return PanelFrame.builder()
            .column("product_id", ColumnType.STRING)
            .column("date", ColumnType.DATE)
            .column("revenue", ColumnType.DOUBLE)
            .row("p1", LocalDate.parse("2024-01-01"), 10.0)
            .row("p1", LocalDate.parse("2024-01-02"), 12.0)
            .row("p2", LocalDate.parse("2024-01-01"), 7.5)
            .build();
    }

    @Test
    void builder_coercesCompatibleValues() {
        PanelFrame frame = PanelFrame.builder()
            .column("n", ColumnType.LONG)
            .column("x", ColumnType.DOUBLE)
            .column("d", ColumnType.DATE)
            .row(3, 4, "2024-03-01")
            .build();

        assertEquals(3L, frame.get(0, "n"));
        assertEquals(4.0, frame.get(0, "x"));
        assertEquals(LocalDate.parse("2024-03-01"), frame.get(0, "d"));
    }

    @Test
    void builder_rejectsValuesThatDoNotFitTheColumnType() {
        PanelFrame.Builder builder = PanelFrame.builder().column("n", ColumnType.LONG).row("three");
        assertThatThrownBy(builder::build)
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Column 'n'");
    }

    @Test
    void builder_rejectsRowsOfWrongWidth() {
        PanelFrame.Builder builder = PanelFrame.builder().column("a", ColumnType.STRING);
        assertThrows(IllegalArgumentException.class, () -> builder.row("x", "y"));
    }

    @Test
    void doubles_returnsNumericValues() {
        assertThat(panel().doubles("revenue")).containsExactly(10.0, 12.0, 7.5);
    }

    @Test
    void doubles_onStringColumn_fails() {
        assertThatThrownBy(() -> panel().doubles("product_id"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("not numeric");
    }

    @Test
    void requireColumns_namesEveryMissingColumn() {
        assertThatThrownBy(() -> panel().requireColumns(List.of("date", "treated", "size")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("[treated, size]");
    }

    @Test
    void hasUniqueKey_detectsDuplicatePanelKeys() {
        PanelFrame frame = panel();
        assertThat(frame.hasUniqueKey("product_id", "date")).isTrue();
        assertThat(frame.hasUniqueKey("product_id")).isFalse();
    }

    @Test
    void groupRows_keepsFirstSeenOrder() {
        Map<Object, List<Integer>> groups = panel().groupRows("product_id");
        assertThat(groups.keySet()).containsExactly("p1", "p2");
        assertThat(groups.get("p1")).containsExactly(0, 1);
    }

    @Test
    void filterAndSelect_leaveTheReceiverUntouched() {
        PanelFrame frame = panel();

        PanelFrame filtered = frame.filter(row -> "p2".equals(frame.get(row, "product_id")));
        PanelFrame selected = frame.select(List.of("revenue"));

        assertThat(filtered.rowCount()).isEqualTo(1);
        assertThat(selected.columns()).containsExactly("revenue");
        assertThat(frame.rowCount()).isEqualTo(3);
        assertThat(frame.columns()).containsExactly("product_id", "date", "revenue");
    }

    @Test
    void withColumn_onEmptyFrame_setsRowCount() {
        PanelFrame frame = PanelFrame.empty().withColumn("x", ColumnType.LONG, List.of(1L, 2L));
        assertThat(frame.rowCount()).isEqualTo(2);
        assertThat(PanelFrame.empty().isEmpty()).isTrue();
    }

    @Test
    void withColumn_wrongLength_fails() {
        assertThrows(IllegalArgumentException.class, () -> panel().withColumn("x", ColumnType.LONG, List.of(1L)));
    }

    @Test
    void withConstantColumn_replacesExistingColumn() {
        PanelFrame frame = panel().withConstantColumn("revenue", ColumnType.STRING, "n/a");
        assertThat(frame.type("revenue")).isEqualTo(ColumnType.STRING);
        assertThat(frame.column("revenue")).containsOnly("n/a");
        assertThat(frame.columns()).containsExactly("product_id", "date", "revenue");
    }

    @Test
    void equals_comparesTypesAndValues() {
        assertEquals(panel(), panel());
        assertThat(panel()).isNotEqualTo(panel().withConstantColumn("revenue", ColumnType.DOUBLE, 0.0));
    }
}
