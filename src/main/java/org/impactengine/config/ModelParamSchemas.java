package org.impactengine.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigUtil;
import com.typesafe.config.ConfigValue;
import com.typesafe.config.ConfigValueType;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Lookup of parameter schemas for statically known models.
 * <p>
 * A model without a schema is an extension model: its parameters are not checked during
 * configuration processing and are left entirely to the adapter's {@code validateParams}
 * at fit time. {@link #lookup(String)} makes that decision explicit.
 */
public final class ModelParamSchemas {

    /** Classpath resource holding the bundled schemas. */
    public static final String RESOURCE = "model-params.conf";

    /** Top-level block declaring the expected types of must-supply parameters per model. */
    public static final String REQUIRED_TYPES = "required-types";

    private final Map<String, ModelParamSchema> schemas;

    public ModelParamSchemas(Config schemaConfig) {
        Map<String, ModelParamSchema> byModel = new TreeMap<>();
        Config requiredTypes = schemaConfig.hasPath(REQUIRED_TYPES)
            ? schemaConfig.getConfig(REQUIRED_TYPES) : ConfigFactory.empty();
        for (Map.Entry<String, ConfigValue> entry : schemaConfig.root().entrySet()) {
            String model = entry.getKey();
            if (REQUIRED_TYPES.equals(model)) {
                continue;
            }
            if (entry.getValue().valueType() != ConfigValueType.OBJECT) {
                throw new IllegalArgumentException("Schema of model '" + model + "' must be a mapping");
            }
            String path = ConfigUtil.quoteString(model);
            byModel.put(model, new ModelParamSchema(model, schemaConfig.getConfig(path),
                requiredTypes(model, requiredTypes.hasPath(path) ? requiredTypes.getConfig(path) : ConfigFactory.empty())));
        }
        this.schemas = Collections.unmodifiableMap(byModel);
    }

    private static Map<String, ModelParamSchema.RequiredType> requiredTypes(String model, Config types) {
        Map<String, ModelParamSchema.RequiredType> byKey = new TreeMap<>();
        for (Map.Entry<String, ConfigValue> entry : types.root().entrySet()) {
            if (entry.getValue().valueType() != ConfigValueType.STRING) {
                throw new IllegalArgumentException("Required type of '" + model + "." + entry.getKey() + "' must be a string");
            }
            byKey.put(entry.getKey(), ModelParamSchema.RequiredType.fromName((String) entry.getValue().unwrapped()));
        }
        return byKey;
    }

    /**
     * Loads the schemas bundled with the application.
     */
    public static ModelParamSchemas bundled() {
        return new ModelParamSchemas(ConfigFactory.parseResources(RESOURCE).resolve());
    }

    /**
     * @return the schema, or empty if the model is not statically known
     */
    public Optional<ModelParamSchema> lookup(String model) {
        return Optional.ofNullable(schemas.get(model));
    }

    public Set<String> knownModels() {
        return schemas.keySet();
    }
}
