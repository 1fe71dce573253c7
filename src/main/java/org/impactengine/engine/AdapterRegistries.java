package org.impactengine.engine;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import com.typesafe.config.ConfigValueType;
import org.impactengine.api.metrics.IMetricsAdapter;
import org.impactengine.api.models.IModelAdapter;
import org.impactengine.api.registry.ContractViolationException;
import org.impactengine.api.registry.Registry;
import org.impactengine.api.storage.IStorageAdapter;
import org.impactengine.api.transforms.ITransform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * The four adapter registries a pipeline run resolves its stages from.
 * <p>
 * Built-in adapters are registered explicitly by {@link BuiltinAdapters}. Extension adapters
 * are declared in the application configuration and registered by class name:
 * <pre>
 * impact-engine.adapters {
 *   models { my_model = "com.example.MyModelAdapter" }
 *   metrics { warehouse { className = "com.example.WarehouseMetrics" } }
 * }
 * </pre>
 */
public final class AdapterRegistries {

    private static final Logger log = LoggerFactory.getLogger(AdapterRegistries.class);

    static final String ADAPTERS_PATH = "impact-engine.adapters";

    private final Registry<IMetricsAdapter> metrics = new Registry<>("metrics adapter", IMetricsAdapter.class);
    private final Registry<IModelAdapter> models = new Registry<>("model", IModelAdapter.class);
    private final Registry<IStorageAdapter> storage = new Registry<>("storage backend", IStorageAdapter.class);
    private final Registry<ITransform> transforms = new Registry<>("transform", ITransform.class);

    /**
     * Creates registries holding only the built-in adapters.
     */
    public static AdapterRegistries withBuiltins() {
        AdapterRegistries registries = new AdapterRegistries();
        BuiltinAdapters.registerAll(registries);
        return registries;
    }

    /**
     * Creates registries holding the built-in adapters plus the extension adapters declared
     * under {@code impact-engine.adapters} in the application configuration.
     *
     * @throws ContractViolationException if an extension class cannot be registered
     */
    public static AdapterRegistries forApplication(Config appConfig) {
        AdapterRegistries registries = withBuiltins();
        if (appConfig.hasPath(ADAPTERS_PATH)) {
            registries.registerFromConfig(appConfig.getConfig(ADAPTERS_PATH));
        }
        return registries;
    }

    /**
     * Registers extension adapters from an {@code adapters} block with the optional
     * sub-blocks {@code metrics}, {@code models}, {@code storage} and {@code transforms}.
     * Entries are either a class name or an object with a {@code className} key.
     *
     * @throws ContractViolationException if a class cannot be loaded or violates its contract
     */
    public void registerFromConfig(Config adapters) {
        registerSection(adapters, "metrics", metrics);
        registerSection(adapters, "models", models);
        registerSection(adapters, "storage", storage);
        registerSection(adapters, "transforms", transforms);
    }

    private static void registerSection(Config adapters, String section, Registry<?> registry) {
        if (!adapters.hasPath(section)) {
            return;
        }
        for (Map.Entry<String, ConfigValue> entry : adapters.getObject(section).entrySet()) {
            String key = entry.getKey();
            ConfigValue value = entry.getValue();
            String className;
            if (value.valueType() == ConfigValueType.STRING) {
                className = value.unwrapped().toString();
            } else if (value.valueType() == ConfigValueType.OBJECT && adapters.getConfig(section).hasPath(key + ".className")) {
                className = adapters.getConfig(section).getString(key + ".className");
            } else {
                throw new ContractViolationException(String.format(
                    "Extension %s '%s' must be a class name or an object with 'className'", registry.getName(), key));
            }
            registry.register(key, className);
            log.info("Registered extension {} '{}' -> {}", registry.getName(), key, className);
        }
    }

    public Registry<IMetricsAdapter> metrics() {
        return metrics;
    }

    public Registry<IModelAdapter> models() {
        return models;
    }

    public Registry<IStorageAdapter> storage() {
        return storage;
    }

    public Registry<ITransform> transforms() {
        return transforms;
    }
}
