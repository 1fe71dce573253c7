package org.impactengine.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigParseOptions;
import com.typesafe.config.ConfigUtil;
import com.typesafe.config.ConfigValue;
import com.typesafe.config.ConfigValueFactory;
import com.typesafe.config.ConfigValueType;
import org.impactengine.utils.DocumentCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Turns a user pipeline document into a validated {@link PipelineConfig}.
 * <p>
 * Processing runs in five stages, each short-circuiting on failure:
 * <ol>
 *   <li><strong>Load</strong>: parse a YAML, JSON or HOCON file, or accept an in-memory map.
 *       Fails with {@link ConfigNotFoundException} or {@link ConfigParseException}.</li>
 *   <li><strong>Merge</strong>: deep-merge the document over the bundled defaults. Nested
 *       mappings merge key by key; every other value is replaced wholesale.</li>
 *   <li><strong>Structural validation</strong>: every required path must hold a non-null,
 *       non-empty value. All violations are collected before failing.</li>
 *   <li><strong>Parameter validation</strong>: for models with a {@link ModelParamSchema},
 *       unexpected parameters and unset must-supply parameters are rejected and the schema
 *       defaults are applied. Models without a schema skip this stage; their adapter
 *       validates its own parameters at fit time.</li>
 *   <li><strong>Derived fields</strong>: {@code DATA.ENRICHMENT.PARAMS.enrichment_start} is
 *       copied into {@code DATA.TRANSFORM.PARAMS}.</li>
 * </ol>
 * Documents are held as immutable Typesafe {@link Config} trees; a {@code null} leaf in the
 * defaults marks a value the user must supply.
 */
public final class ConfigProcessor {

    private static final Logger log = LoggerFactory.getLogger(ConfigProcessor.class);

    /** Classpath resource holding the bundled pipeline defaults. */
    public static final String DEFAULTS_RESOURCE = "pipeline-defaults.conf";

    static final String DATA = "DATA";
    static final String SOURCE = "DATA.SOURCE";
    static final String SOURCE_TYPE = "DATA.SOURCE.type";
    static final String SOURCE_CONFIG = "DATA.SOURCE.CONFIG";
    static final String SOURCE_PATH = "DATA.SOURCE.CONFIG.path";
    static final String START_DATE = "DATA.SOURCE.CONFIG.start_date";
    static final String END_DATE = "DATA.SOURCE.CONFIG.end_date";
    static final String TRANSFORM = "DATA.TRANSFORM";
    static final String TRANSFORM_FUNCTION = "DATA.TRANSFORM.FUNCTION";
    static final String TRANSFORM_PARAMS = "DATA.TRANSFORM.PARAMS";
    static final String ENRICHMENT = "DATA.ENRICHMENT";
    static final String ENRICHMENT_PARAMS = "DATA.ENRICHMENT.PARAMS";
    static final String ENRICHMENT_START_KEY = "enrichment_start";
    static final String ENRICHMENT_START = ENRICHMENT_PARAMS + "." + ENRICHMENT_START_KEY;
    static final String MEASUREMENT = "MEASUREMENT";
    static final String MODEL = "MEASUREMENT.MODEL";
    static final String MODEL_PARAMS = "MEASUREMENT.PARAMS";

    private static final DateTimeFormatter DATE_FORMAT =
        DateTimeFormatter.ofPattern("uuuu-MM-dd").withResolverStyle(ResolverStyle.STRICT);

    private final Config defaults;
    private final ModelParamSchemas schemas;

    /**
     * Creates a processor using the bundled defaults and model schemas.
     */
    public ConfigProcessor() {
        this(ConfigFactory.parseResources(DEFAULTS_RESOURCE).resolve(), ModelParamSchemas.bundled());
    }

    public ConfigProcessor(Config defaults, ModelParamSchemas schemas) {
        this.defaults = defaults;
        this.schemas = schemas;
    }

    public PipelineConfig process(Path file) {
        return process(load(file));
    }

    public PipelineConfig process(Map<String, ?> document) {
        return process(fromMap(document));
    }

    /**
     * Runs stages 2 to 5 on an already loaded document.
     *
     * @throws ConfigurationException aggregating every violation of the failing stage
     */
    public PipelineConfig process(Config document) {
        Config merged = merge(defaults, document);

        List<ConfigError> errors = validateStructure(merged);
        if (!errors.isEmpty()) {
            throw new ConfigurationException(errors);
        }

        Config resolved = resolveModelParameters(merged);
        Config injected = injectEnrichmentStart(resolved);

        log.info("Configuration validated: source '{}', transform '{}', model '{}'",
            injected.getString(SOURCE_TYPE), injected.getString(TRANSFORM_FUNCTION), injected.getString(MODEL));
        return new PipelineConfig(injected);
    }

    // ========================================================================
    // Stage 1: Load
    // ========================================================================

    /**
     * Loads a pipeline document. The format follows the file extension ({@code .yaml},
     * {@code .yml}, {@code .json}, {@code .conf}); other extensions are tried as JSON, then YAML.
     *
     * @throws ConfigNotFoundException if the file does not exist
     * @throws ConfigParseException    if the file cannot be parsed into a mapping
     */
    public static Config load(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new ConfigNotFoundException(file);
        }
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        try {
            if (name.endsWith(".conf")) {
                return ConfigFactory.parseFile(file.toFile(), ConfigParseOptions.defaults().setAllowMissing(false)).resolve();
            }
            byte[] bytes = Files.readAllBytes(file);
            if (name.endsWith(".yaml") || name.endsWith(".yml")) {
                return fromMap(DocumentCodec.parseYaml(bytes));
            }
            if (name.endsWith(".json")) {
                return fromMap(DocumentCodec.parseJson(bytes));
            }
            try {
                return fromMap(DocumentCodec.parseJson(bytes));
            } catch (IOException notJson) {
                log.debug("{} is not JSON, trying YAML: {}", file, notJson.getMessage());
                return fromMap(DocumentCodec.parseYaml(bytes));
            }
        } catch (IOException | ConfigException e) {
            throw new ConfigParseException("Cannot parse configuration file " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Converts an in-memory mapping into a configuration tree. Map keys are taken literally.
     *
     * @throws ConfigParseException if the mapping holds values a configuration cannot represent
     */
    public static Config fromMap(Map<String, ?> document) {
        try {
            return ConfigValueFactory.fromMap(document).toConfig();
        } catch (ConfigException | ClassCastException e) {
            throw new ConfigParseException("Configuration mapping cannot be represented: " + e.getMessage(), e);
        }
    }

    // ========================================================================
    // Stage 2: Merge
    // ========================================================================

    /**
     * Deep-merges {@code override} over {@code base}. Neither input is modified.
     */
    public static Config merge(Config base, Config override) {
        return override.withFallback(base);
    }

    // ========================================================================
    // Stage 3: Structural validation
    // ========================================================================

    /**
     * Collects every structural violation of a merged document.
     */
    public List<ConfigError> validateStructure(Config config) {
        List<ConfigError> errors = new ArrayList<>();

        if (requireObject(config, DATA, errors)) {
            if (requireObject(config, SOURCE, errors)) {
                requireString(config, SOURCE_TYPE, errors);
                if (requireObject(config, SOURCE_CONFIG, errors)) {
                    requireString(config, SOURCE_PATH, errors);
                    LocalDate start = requireDate(config, START_DATE, errors);
                    LocalDate end = requireDate(config, END_DATE, errors);
                    if (start != null && end != null && start.isAfter(end)) {
                        errors.add(new ConfigError(SOURCE_CONFIG, String.format(
                            "start_date (%s) must be on or before end_date (%s)", start, end)));
                    }
                }
            }
            if (requireObject(config, TRANSFORM, errors)) {
                requireString(config, TRANSFORM_FUNCTION, errors);
                optionalObject(config, TRANSFORM_PARAMS, errors);
            }
            if (config.hasPath(ENRICHMENT) && requireObject(config, ENRICHMENT, errors)
                && optionalObject(config, ENRICHMENT_PARAMS, errors) && config.hasPath(ENRICHMENT_START)) {
                requireDate(config, ENRICHMENT_START, errors);
            }
        }

        if (requireObject(config, MEASUREMENT, errors)) {
            requireString(config, MODEL, errors);
            if (requireObject(config, MODEL_PARAMS, errors)) {
                validateParamDates(config, errors);
            }
        }
        return errors;
    }

    private static void validateParamDates(Config config, List<ConfigError> errors) {
        for (String key : new TreeSet<>(config.getObject(MODEL_PARAMS).keySet())) {
            String path = ConfigUtil.joinPath(MEASUREMENT, "PARAMS", key);
            if ((key.endsWith("_date") || key.equals(ENRICHMENT_START_KEY)) && config.hasPath(path)) {
                requireDate(config, path, MODEL_PARAMS + "." + key, errors);
            }
        }
    }

    private static boolean requireObject(Config config, String path, List<ConfigError> errors) {
        if (!config.hasPath(path)) {
            errors.add(new ConfigError(path, "is required"));
            return false;
        }
        ConfigValueType type = config.getValue(path).valueType();
        if (type != ConfigValueType.OBJECT) {
            errors.add(new ConfigError(path, "must be a mapping, got " + type.name().toLowerCase(Locale.ROOT)));
            return false;
        }
        return true;
    }

    private static boolean optionalObject(Config config, String path, List<ConfigError> errors) {
        if (!config.hasPath(path)) {
            return true;
        }
        return requireObject(config, path, errors);
    }

    private static String requireString(Config config, String path, List<ConfigError> errors) {
        if (!config.hasPath(path)) {
            errors.add(new ConfigError(path, "is required"));
            return null;
        }
        ConfigValue value = config.getValue(path);
        if (value.valueType() == ConfigValueType.OBJECT || value.valueType() == ConfigValueType.LIST) {
            errors.add(new ConfigError(path, "must be a scalar value, got " + value.valueType().name().toLowerCase(Locale.ROOT)));
            return null;
        }
        String text = value.unwrapped().toString();
        if (text.isBlank()) {
            errors.add(new ConfigError(path, "must not be empty"));
            return null;
        }
        return text;
    }

    private static LocalDate requireDate(Config config, String path, List<ConfigError> errors) {
        return requireDate(config, path, path, errors);
    }

    private static LocalDate requireDate(Config config, String path, String reportedPath, List<ConfigError> errors) {
        String text = requireString(config, path, errors);
        if (text == null) {
            return null;
        }
        try {
            return LocalDate.parse(text, DATE_FORMAT);
        } catch (DateTimeParseException e) {
            errors.add(new ConfigError(reportedPath, "must be a date in YYYY-MM-DD format, got '" + text + "'"));
            return null;
        }
    }

    // ========================================================================
    // Stage 4: Parameter validation
    // ========================================================================

    /**
     * Validates {@code MEASUREMENT.PARAMS} against the model's schema and applies its defaults.
     * Documents for models without a schema are returned unchanged.
     *
     * @throws ConfigurationException aggregating every parameter violation
     */
    public Config resolveModelParameters(Config merged) {
        String model = merged.getString(MODEL);
        Optional<ModelParamSchema> schema = schemas.lookup(model);
        if (schema.isEmpty()) {
            log.debug("No parameter schema for model '{}', parameters are validated by the adapter at fit time", model);
            return merged;
        }
        Config userParams = merged.getConfig(MODEL_PARAMS);
        List<ConfigError> errors = schema.get().validate(userParams);
        if (!errors.isEmpty()) {
            throw new ConfigurationException(errors);
        }
        return merged.withValue(MODEL_PARAMS, schema.get().applyDefaults(userParams).root());
    }

    // ========================================================================
    // Stage 5: Derived fields
    // ========================================================================

    /**
     * Copies {@code DATA.ENRICHMENT.PARAMS.enrichment_start} into {@code DATA.TRANSFORM.PARAMS}.
     * Applying it to its own output yields an equal document.
     */
    public static Config injectEnrichmentStart(Config config) {
        if (!config.hasPath(ENRICHMENT_START)) {
            return config;
        }
        return config.withValue(TRANSFORM_PARAMS + "." + ENRICHMENT_START_KEY, config.getValue(ENRICHMENT_START));
    }
}
