package org.impactengine.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigList;
import com.typesafe.config.ConfigValue;
import com.typesafe.config.ConfigValueType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Parameter schema of one statically known model.
 * <p>
 * The schema is a mapping of every allowed {@code MEASUREMENT.PARAMS} key to its default.
 * A {@code null} default marks a parameter the user must supply, whose expected type may be
 * declared as a {@link RequiredType}; a non-null default fixes the expected value type itself.
 */
public final class ModelParamSchema {

    private static final String PARAMS_PATH = "MEASUREMENT.PARAMS";

    private final String model;
    private final Config defaults;
    private final Map<String, RequiredType> requiredTypes;

    /**
     * Expected type of a must-supply parameter.
     */
    public enum RequiredType {
        /** A single string. */
        STRING("string", "a string"),
        /** A string or a list of strings. */
        STRINGS("strings", "a string or a list of strings");

        private final String key;
        private final String description;

        RequiredType(String key, String description) {
            this.key = key;
            this.description = description;
        }

        /**
         * @throws IllegalArgumentException for unknown names
         */
        public static RequiredType fromName(String name) {
            for (RequiredType type : values()) {
                if (type.key.equals(name)) {
                    return type;
                }
            }
            throw new IllegalArgumentException("Unknown required type '" + name + "'. Supported: string, strings");
        }

        boolean accepts(ConfigValue value) {
            if (value.valueType() == ConfigValueType.STRING) {
                return true;
            }
            if (this != STRINGS || value.valueType() != ConfigValueType.LIST) {
                return false;
            }
            for (ConfigValue element : (ConfigList) value) {
                if (element.valueType() != ConfigValueType.STRING) {
                    return false;
                }
            }
            return true;
        }
    }

    public ModelParamSchema(String model, Config defaults) {
        this(model, defaults, Map.of());
    }

    /**
     * @param requiredTypes expected types of must-supply parameters; keys without an entry
     *                      are only checked for presence
     * @throws IllegalArgumentException if a typed key is not a must-supply parameter of the schema
     */
    public ModelParamSchema(String model, Config defaults, Map<String, RequiredType> requiredTypes) {
        this.model = model;
        this.defaults = defaults;
        for (String key : requiredTypes.keySet()) {
            ConfigValue defaultValue = defaults.root().get(key);
            if (defaultValue == null || defaultValue.valueType() != ConfigValueType.NULL) {
                throw new IllegalArgumentException(String.format(
                    "Required type declared for '%s' of model '%s', which is not a must-supply parameter", key, model));
            }
        }
        this.requiredTypes = Map.copyOf(requiredTypes);
    }

    public String getModel() {
        return model;
    }

    public Set<String> allowedKeys() {
        return new TreeSet<>(defaults.root().keySet());
    }

    /**
     * Merges the schema defaults under the user parameters.
     */
    public Config applyDefaults(Config userParams) {
        return userParams.withFallback(defaults);
    }

    /**
     * Checks user parameters against the schema. All violations are collected.
     *
     * @param userParams the parameters as written by the user, before defaults are applied
     * @return the violations; empty if the parameters are acceptable
     */
    public List<ConfigError> validate(Config userParams) {
        List<ConfigError> errors = new ArrayList<>();
        Map<String, ConfigValue> allowed = defaults.root();

        for (String key : new TreeSet<>(userParams.root().keySet())) {
            if (!allowed.containsKey(key)) {
                errors.add(new ConfigError(PARAMS_PATH + "." + key, String.format(
                    "Unexpected parameter for model '%s'. Allowed: %s", model, allowedKeys())));
            }
        }

        Config merged = applyDefaults(userParams);
        for (String key : allowedKeys()) {
            ConfigValue defaultValue = allowed.get(key);
            ConfigValue actual = merged.root().get(key);
            if (defaultValue.valueType() == ConfigValueType.NULL) {
                RequiredType required = requiredTypes.get(key);
                if (isBlank(actual)) {
                    errors.add(new ConfigError(PARAMS_PATH + "." + key, String.format(
                        "must be provided by user for model '%s'", model)));
                } else if (required != null && !required.accepts(actual)) {
                    errors.add(new ConfigError(PARAMS_PATH + "." + key, String.format(
                        "expected %s but got %s", required.description, describeContent(actual))));
                }
            } else if (actual != null && actual.valueType() != defaultValue.valueType()) {
                errors.add(new ConfigError(PARAMS_PATH + "." + key, String.format(
                    "expected %s but got %s", describe(defaultValue.valueType()), describe(actual.valueType()))));
            }
        }
        return errors;
    }

    private static boolean isBlank(ConfigValue value) {
        if (value == null || value.valueType() == ConfigValueType.NULL) {
            return true;
        }
        if (value.valueType() == ConfigValueType.STRING) {
            return value.unwrapped().toString().isBlank();
        }
        if (value.valueType() == ConfigValueType.LIST) {
            return ((ConfigList) value).isEmpty();
        }
        return false;
    }

    private static String describeContent(ConfigValue value) {
        if (value.valueType() == ConfigValueType.LIST) {
            for (ConfigValue element : (ConfigList) value) {
                if (element.valueType() != ConfigValueType.STRING) {
                    return "a list containing " + describe(element.valueType());
                }
            }
        }
        return describe(value.valueType());
    }

    private static String describe(ConfigValueType type) {
        return switch (type) {
            case OBJECT -> "a mapping";
            case LIST -> "a list";
            case NUMBER -> "a number";
            case BOOLEAN -> "a boolean";
            case NULL -> "null";
            case STRING -> "a string";
        };
    }
}
