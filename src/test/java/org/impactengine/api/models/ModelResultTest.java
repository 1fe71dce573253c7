package org.impactengine.api.models;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.impactengine.api.data.ColumnType;
import org.impactengine.api.data.PanelFrame;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ModelResultTest {

    @Test
    void data_alwaysHasExactlyTheThreeSections() {
        ModelResult empty = ModelResult.builder("stub").build();
        ModelResult full = ModelResult.builder("stub")
            .modelParam("alpha", 0.05)
            .impactEstimate("effect", 1.5)
            .summary("n_observations", 10)
            .build();

        assertThat(empty.data()).containsOnlyKeys("model_params", "impact_estimates", "model_summary");
        assertThat(full.data()).containsOnlyKeys("model_params", "impact_estimates", "model_summary");
        assertThat(empty.data().get("impact_estimates")).isEqualTo(Map.of());
    }

    @Test
    void toEnvelope_hasVersionedLayout() {
        ModelResult result = ModelResult.builder("stub")
            .impactEstimate("effect", 2.0)
            .build()
            .withMetadata("executed_at", "2024-01-01T00:00:00Z");

        Map<String, Object> envelope = result.toEnvelope();

        assertThat(envelope).containsOnlyKeys("schema_version", "model_type", "data", "metadata");
        assertThat(envelope.get("schema_version")).isEqualTo(ModelResult.SCHEMA_VERSION);
        assertThat(envelope.get("model_type")).isEqualTo("stub");
        assertThat(envelope.get("metadata")).isEqualTo(Map.of("executed_at", "2024-01-01T00:00:00Z"));
    }

    @Test
    void withMetadata_keepsArtifactsAndLeavesOriginalUnchanged() {
        PanelFrame table = PanelFrame.builder().column("x", ColumnType.LONG).row(1L).build();
        ModelResult original = ModelResult.builder("stub").artifact("details", table).build();

        ModelResult stamped = original.withMetadata("k", "v");

        assertThat(stamped.getArtifacts()).containsEntry("details", table);
        assertThat(original.getMetadata()).isEmpty();
    }

    @Test
    void abstractAdapter_enforcesConnectOnceAndConnectBeforeFit() {
        CountingAdapter adapter = new CountingAdapter();
        Config params = ConfigFactory.empty();

        assertThatThrownBy(() -> adapter.fit(PanelFrame.empty(), params)).isInstanceOf(IllegalStateException.class);
        assertThat(adapter.connect(params)).isTrue();
        adapter.fit(PanelFrame.empty(), params);
        adapter.fit(PanelFrame.empty(), params);

        assertThat(adapter.fits).isEqualTo(2);
        assertThatThrownBy(() -> adapter.connect(params)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void abstractAdapter_failedConnectStaysUnconnected() {
        CountingAdapter adapter = new CountingAdapter();
        adapter.accept = false;

        assertThat(adapter.connect(ConfigFactory.empty())).isFalse();
        assertThat(adapter.validateConnection()).isFalse();
        assertThatThrownBy(() -> adapter.fit(PanelFrame.empty(), ConfigFactory.empty()))
            .isInstanceOf(IllegalStateException.class);
    }

    private static final class CountingAdapter extends AbstractModelAdapter {
        boolean accept = true;
        int fits;

        @Override
        protected boolean doConnect(Config config) {
            return accept;
        }

        @Override
        public void validateParams(Config params) {
        }

        @Override
        protected ModelResult doFit(PanelFrame data, Config params) {
            fits++;
            return ModelResult.builder("counting").build();
        }
    }
}
