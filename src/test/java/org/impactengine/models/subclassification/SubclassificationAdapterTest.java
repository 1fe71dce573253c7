package org.impactengine.models.subclassification;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.impactengine.api.data.ColumnType;
import org.impactengine.api.data.PanelFrame;
import org.impactengine.api.exceptions.InvalidParameterException;
import org.impactengine.api.models.ModelResult;
import org.impactengine.junit.extensions.logging.ExpectLog;
import org.impactengine.junit.extensions.logging.LogLevel;
import org.impactengine.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class SubclassificationAdapterTest {

    private static Config params(Map<String, ?> values) {
        return ConfigFactory.parseMap(values);
    }

    private static Config defaultParams() {
        return params(Map.of("treatment_column", "treated", "covariate_columns", List.of("size"), "n_strata", 2));
    }

    private static PanelFrame data() {
        return PanelFrame.builder()
            .column("product_id", ColumnType.STRING)
            .column("treated", ColumnType.LONG)
            .column("size", ColumnType.DOUBLE)
            .column("revenue", ColumnType.DOUBLE)
            .row("a", 1L, 1.0, 12.0)
            .row("b", 0L, 2.0, 10.0)
            .row("c", 1L, 8.0, 30.0)
            .row("d", 0L, 9.0, 25.0)
            .build();
    }

    private static SubclassificationAdapter connected(Config params) {
        SubclassificationAdapter adapter = new SubclassificationAdapter();
        adapter.connect(params);
        return adapter;
    }

    @Test
    void connect_requiresTreatmentAndCovariates() {
        assertThatThrownBy(() -> new SubclassificationAdapter().connect(params(Map.of("covariate_columns", "size"))))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("treatment_column is required");
        assertThatThrownBy(() -> new SubclassificationAdapter().connect(params(Map.of("treatment_column", "treated"))))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("covariate_columns is required");
    }

    @Test
    void connect_rejectsInvalidStrataAndEstimand() {
        Map<String, Object> base = Map.of("treatment_column", "t", "covariate_columns", "x");
        assertThrows(IllegalArgumentException.class, () -> new SubclassificationAdapter()
            .connect(params(Map.of("treatment_column", "t", "covariate_columns", "x", "n_strata", 0))));
        assertThrows(IllegalArgumentException.class, () -> new SubclassificationAdapter()
            .connect(params(Map.of("treatment_column", "t", "covariate_columns", "x", "n_strata", 2.5))));
        assertThrows(IllegalArgumentException.class, () -> new SubclassificationAdapter()
            .connect(params(Map.of("treatment_column", "t", "covariate_columns", "x", "estimand", "atc"))));
        assertThat(new SubclassificationAdapter().connect(params(base))).isTrue();
    }

    @Test
    void getRequiredColumns_listsTreatmentThenCovariates() {
        SubclassificationAdapter adapter = connected(params(Map.of(
            "treatment_column", "treated", "covariate_columns", List.of("size", "price"))));
        assertThat(adapter.getRequiredColumns()).containsExactly("treated", "size", "price");
    }

    @Test
    void validateParams_namesTheOffendingParameter() {
        SubclassificationAdapter adapter = new SubclassificationAdapter();

        InvalidParameterException missing = assertThrows(InvalidParameterException.class,
            () -> adapter.validateParams(params(Map.of("covariate_columns", "size"))));
        InvalidParameterException badEstimand = assertThrows(InvalidParameterException.class,
            () -> adapter.validateParams(params(Map.of("treatment_column", "t", "covariate_columns", "x", "estimand", "foo"))));

        assertEquals("treatment_column", missing.getParameter());
        assertEquals("estimand", badEstimand.getParameter());
    }

    @Test
    void connectAndValidate_wronglyTypedColumns_nameTheKey() {
        Config listTreatment = params(Map.of("treatment_column", List.of("a", "b"), "covariate_columns", "size"));
        Config objectCovariate = params(Map.of("treatment_column", "treated", "covariate_columns", List.of(Map.of("k", 1))));

        assertThatThrownBy(() -> new SubclassificationAdapter().connect(listTreatment))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("treatment_column must be a string");
        assertThatThrownBy(() -> new SubclassificationAdapter().connect(objectCovariate))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("covariate_columns must be a list of column names");
        InvalidParameterException invalid = assertThrows(InvalidParameterException.class,
            () -> new SubclassificationAdapter().validateParams(objectCovariate));
        assertEquals("covariate_columns", invalid.getParameter());
    }

    @Test
    void fit_paramsOverrideConnectTimeValues() {
        SubclassificationAdapter adapter = connected(defaultParams());
        PanelFrame renamed = PanelFrame.builder()
            .column("exposed", ColumnType.BOOLEAN)
            .column("size", ColumnType.DOUBLE)
            .column("units", ColumnType.DOUBLE)
            .row(true, 1.0, 4.0)
            .row(false, 2.0, 1.0)
            .build();

        ModelResult result = adapter.fit(renamed, params(Map.of(
            "treatment_column", "exposed", "dependent_variable", "units", "n_strata", 1, "estimand", "ate")));

        assertThat(result.getImpactEstimates()).containsEntry("treatment_effect", 3.0).containsEntry("n_strata", 1);
        assertThat(result.getModelParams())
            .containsEntry("treatment_column", "exposed")
            .containsEntry("dependent_variable", "units")
            .containsEntry("n_strata", 1)
            .containsEntry("estimand", "ate")
            .containsEntry("covariate_columns", List.of("size"));
    }

    @Test
    void fit_producesStandardSectionsAndStratumDetails() {
        SubclassificationAdapter adapter = connected(defaultParams());

        ModelResult result = adapter.fit(data(), defaultParams());

        assertThat(result.getModelType()).isEqualTo("subclassification");
        // stratum 0: 12 - 10, stratum 1: 30 - 25
        assertThat(result.getImpactEstimates())
            .containsEntry("treatment_effect", 3.5)
            .containsEntry("n_strata", 2)
            .containsEntry("n_strata_dropped", 0);
        assertThat(result.getModelSummary())
            .containsEntry("n_observations", 4)
            .containsEntry("n_treated", 2L)
            .containsEntry("n_control", 2L)
            .containsEntry("estimand", "att");
        assertThat(result.getModelParams())
            .containsEntry("dependent_variable", "revenue")
            .containsEntry("covariate_columns", List.of("size"));
        assertThat(result.getArtifacts()).containsOnlyKeys(SubclassificationAdapter.STRATUM_DETAILS);
        assertThat(result.getArtifacts().get(SubclassificationAdapter.STRATUM_DETAILS).columns())
            .containsExactly("stratum", "n_treated", "n_control", "mean_treated", "mean_control", "effect");
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Stratum .* lacks common support.*", occurrences = 2)
    @ExpectLog(level = LogLevel.WARN, messagePattern = "All 2 strata dropped.*")
    void fit_noCommonSupport_returnsZeroEffectWithoutArtifact() {
        PanelFrame disjoint = PanelFrame.builder()
            .column("treated", ColumnType.BOOLEAN)
            .column("size", ColumnType.DOUBLE)
            .column("revenue", ColumnType.DOUBLE)
            .row(true, 1.0, 5.0)
            .row(true, 2.0, 6.0)
            .row(false, 10.0, 7.0)
            .row(false, 11.0, 8.0)
            .build();

        ModelResult result = connected(defaultParams()).fit(disjoint, defaultParams());

        assertThat(result.getImpactEstimates())
            .containsEntry("treatment_effect", 0.0)
            .containsEntry("n_strata", 0)
            .containsEntry("n_strata_dropped", 2);
        assertThat(result.getModelSummary()).containsEntry("n_observations", 4);
        assertThat(result.getArtifacts()).isEmpty();
    }

    @Test
    void fit_missingOutcomeColumn_failsValidation() {
        SubclassificationAdapter adapter = connected(defaultParams());
        PanelFrame noRevenue = data().select(List.of("treated", "size"));

        assertThatThrownBy(() -> adapter.fit(noRevenue, defaultParams()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("revenue");
    }

    @Test
    void fit_emptyData_failsValidation() {
        SubclassificationAdapter adapter = connected(defaultParams());
        assertThatThrownBy(() -> adapter.fit(data().filter(row -> false), defaultParams()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("empty");
    }

    @Test
    void treatmentIndicator_rejectsNonBinaryValues() {
        PanelFrame frame = PanelFrame.builder().column("t", ColumnType.LONG).row(1L).row(2L).build();
        assertThatThrownBy(() -> SubclassificationAdapter.treatmentIndicator(frame, "t"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("only 0 and 1");

        PanelFrame text = PanelFrame.builder().column("t", ColumnType.STRING).row("yes").build();
        assertThrows(IllegalArgumentException.class, () -> SubclassificationAdapter.treatmentIndicator(text, "t"));
    }
}
