package org.impactengine.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ModelParamSchemasTest {

    @Test
    void bundled_knowsBuiltinModelsButNotTheTypeBlock() {
        ModelParamSchemas schemas = ModelParamSchemas.bundled();

        assertThat(schemas.knownModels()).containsExactlyInAnyOrder("subclassification", "metrics_approximation");
        assertThat(schemas.lookup(ModelParamSchemas.REQUIRED_TYPES)).isEmpty();
    }

    @Test
    void validate_checksDeclaredTypesOfMustSupplyParameters() {
        ModelParamSchemas schemas = new ModelParamSchemas(ConfigFactory.parseString(
            "ranker { target = null, features = null, notes = null }\n"
                + "required-types.ranker { target = string, features = strings }"));
        ModelParamSchema schema = schemas.lookup("ranker").orElseThrow();

        List<ConfigError> ok = schema.validate(ConfigFactory.parseMap(Map.of(
            "target", "y", "features", List.of("a", "b"), "notes", List.of(1, 2))));
        List<ConfigError> wrong = schema.validate(ConfigFactory.parseMap(Map.of(
            "target", 3, "features", Map.of("a", 1), "notes", "free")));

        assertThat(ok).isEmpty();
        assertThat(wrong).extracting(ConfigError::path)
            .containsExactly("MEASUREMENT.PARAMS.features", "MEASUREMENT.PARAMS.target");
    }

    @Test
    void constructor_rejectsTypesForParametersWithDefaults() {
        Config defaults = ConfigFactory.parseString("n = 5");

        assertThatThrownBy(() -> new ModelParamSchema("m", defaults, Map.of("n", ModelParamSchema.RequiredType.STRING)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("not a must-supply parameter");
        assertThatThrownBy(() -> ModelParamSchema.RequiredType.fromName("number"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Supported: string, strings");
    }
}
