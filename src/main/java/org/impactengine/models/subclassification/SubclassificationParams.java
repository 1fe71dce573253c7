package org.impactengine.models.subclassification;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigList;
import com.typesafe.config.ConfigValue;
import com.typesafe.config.ConfigValueType;
import org.impactengine.api.exceptions.InvalidParameterException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Supplier;

/**
 * Effective parameters of one subclassification fit.
 * <p>
 * Values are read key by key; a key missing from the given configuration keeps the value of
 * the fallback, so fit-time parameters override connect-time ones without having to repeat them.
 *
 * @param treatmentColumn   binary treatment column, {@code null} until supplied
 * @param covariateColumns  covariates to stratify on
 * @param dependentVariable numeric outcome column
 * @param nStrata           quantile bins per covariate
 * @param estimand          target population
 */
record SubclassificationParams(String treatmentColumn, List<String> covariateColumns, String dependentVariable,
                               int nStrata, Estimand estimand) {

    static final SubclassificationParams DEFAULTS =
        new SubclassificationParams(null, List.of(), "revenue", 5, Estimand.ATT);

    SubclassificationParams {
        covariateColumns = List.copyOf(covariateColumns);
    }

    /**
     * Reads the parameters present in {@code config} over {@code fallback}.
     *
     * @throws InvalidParameterException naming the first malformed key
     */
    static SubclassificationParams read(Config config, SubclassificationParams fallback) {
        String treatment = read(config, "treatment_column", fallback.treatmentColumn(), () -> string(config, "treatment_column"));
        List<String> covariates = read(config, "covariate_columns", fallback.covariateColumns(), () -> covariates(config));
        String outcome = read(config, "dependent_variable", fallback.dependentVariable(), () -> string(config, "dependent_variable"));
        int strata = read(config, "n_strata", fallback.nStrata(), () -> positiveInt(config, "n_strata"));
        Estimand estimand = read(config, "estimand", fallback.estimand(), () -> Estimand.fromKey(string(config, "estimand")));
        return new SubclassificationParams(treatment, covariates, outcome, strata, estimand);
    }

    /**
     * @throws InvalidParameterException if the treatment or covariate columns are missing
     */
    SubclassificationParams requireColumns() {
        if (treatmentColumn == null || treatmentColumn.isBlank()) {
            throw missing("treatment_column");
        }
        if (covariateColumns.isEmpty()) {
            throw missing("covariate_columns");
        }
        return this;
    }

    private static InvalidParameterException missing(String key) {
        return new InvalidParameterException(key,
            key + " is required for subclassification. Specify it in MEASUREMENT.PARAMS.");
    }

    private static <T> T read(Config config, String key, T fallback, Supplier<T> reader) {
        if (!config.hasPath(key)) {
            return fallback;
        }
        try {
            return reader.get();
        } catch (IllegalArgumentException | ConfigException e) {
            throw new InvalidParameterException(key, e.getMessage());
        }
    }

    private static String string(Config config, String key) {
        ConfigValue value = config.getValue(key);
        if (value.valueType() != ConfigValueType.STRING) {
            throw new IllegalArgumentException(key + " must be a string, got " + describe(value));
        }
        return (String) value.unwrapped();
    }

    private static List<String> covariates(Config config) {
        ConfigValue value = config.getValue("covariate_columns");
        if (value.valueType() == ConfigValueType.STRING) {
            String single = (String) value.unwrapped();
            return single.isBlank() ? List.of() : List.of(single);
        }
        if (value.valueType() != ConfigValueType.LIST) {
            throw new IllegalArgumentException(
                "covariate_columns must be a column name or a list of column names, got " + describe(value));
        }
        List<String> names = new ArrayList<>();
        for (ConfigValue element : (ConfigList) value) {
            if (element.valueType() != ConfigValueType.STRING) {
                throw new IllegalArgumentException(
                    "covariate_columns must be a list of column names, found " + describe(element));
            }
            names.add((String) element.unwrapped());
        }
        return names;
    }

    private static int positiveInt(Config config, String key) {
        ConfigValue value = config.getValue(key);
        if (value.valueType() != ConfigValueType.NUMBER) {
            throw new IllegalArgumentException(key + " must be a positive integer, got " + describe(value));
        }
        Number number = (Number) value.unwrapped();
        if (number.doubleValue() != Math.rint(number.doubleValue()) || number.intValue() < 1) {
            throw new IllegalArgumentException(key + " must be a positive integer, got " + number);
        }
        return number.intValue();
    }

    private static String describe(ConfigValue value) {
        return value.valueType().name().toLowerCase(Locale.ROOT);
    }
}
