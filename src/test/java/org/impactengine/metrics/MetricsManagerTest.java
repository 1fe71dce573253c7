package org.impactengine.metrics;

import com.typesafe.config.ConfigFactory;
import org.impactengine.api.data.ColumnType;
import org.impactengine.api.data.PanelFrame;
import org.impactengine.api.exceptions.ConnectionFailureException;
import org.impactengine.api.metrics.IMetricsAdapter;
import org.impactengine.config.SourceSection;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
class MetricsManagerTest {

    private static final LocalDate START = LocalDate.parse("2024-01-01");
    private static final LocalDate END = LocalDate.parse("2024-01-31");

    @Mock
    private IMetricsAdapter adapter;

    private static SourceSection source() {
        return new SourceSection("mock", ConfigFactory.parseString("path = \"x.csv\""), "x.csv", START, END);
    }

    private static PanelFrame products() {
        return PanelFrame.builder().column("product_id", ColumnType.STRING).row("p1").build();
    }

    @Test
    void constructor_connectsOnceWithSourceConfig() {
        when(adapter.connect(any())).thenReturn(true);

        new MetricsManager(source(), adapter);

        verify(adapter, times(1)).connect(source().config());
    }

    @Test
    void constructor_failedConnect_isConnectionFailure() {
        when(adapter.connect(any())).thenReturn(false);

        assertThatThrownBy(() -> new MetricsManager(source(), adapter))
            .isInstanceOf(ConnectionFailureException.class)
            .hasMessageContaining("mock");
    }

    @Test
    void constructor_rejectedConfig_isConnectionFailure() {
        when(adapter.connect(any())).thenThrow(new IllegalArgumentException("path is required"));

        assertThatThrownBy(() -> new MetricsManager(source(), adapter))
            .isInstanceOf(ConnectionFailureException.class)
            .hasMessageContaining("path is required")
            .hasCauseInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void retrieve_usesConfiguredRangeAndStampsProvenance() throws IOException {
        when(adapter.connect(any())).thenReturn(true);
        PanelFrame metrics = PanelFrame.builder()
            .column("product_id", ColumnType.STRING)
            .column("revenue", ColumnType.DOUBLE)
            .row("p1", 5.0)
            .build();
        when(adapter.retrieveBusinessMetrics(any(), eq(START), eq(END))).thenReturn(metrics);

        PanelFrame result = new MetricsManager(source(), adapter).retrieve(products());

        assertThat(result.columns()).containsExactly("product_id", "revenue", "metrics_source", "retrieval_timestamp");
        assertThat(result.get(0, "metrics_source")).isEqualTo("mock");
        assertThat((String) result.get(0, "retrieval_timestamp")).endsWith("Z");
    }

    @Test
    void retrieve_emptyProducts_isRejectedBeforeAdapterCall() throws IOException {
        when(adapter.connect(any())).thenReturn(true);
        MetricsManager manager = new MetricsManager(source(), adapter);

        assertThatThrownBy(() -> manager.retrieve(products().filter(row -> false)))
            .isInstanceOf(IllegalArgumentException.class);
        verify(adapter, never()).retrieveBusinessMetrics(any(), any(), any());
    }
}
