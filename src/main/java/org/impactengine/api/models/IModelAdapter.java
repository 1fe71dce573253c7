package org.impactengine.api.models;

import com.typesafe.config.Config;
import org.impactengine.api.data.PanelFrame;

import java.util.List;

/**
 * Capability contract of a causal-effect model.
 * <p>
 * <strong>Lifecycle:</strong> an adapter is created unconnected. {@link #connect(Config)} is
 * called exactly once; a failed connect leaves the adapter unconnected. Once connected,
 * {@link #validateParams(Config)} and {@link #fit(PanelFrame, Config)} may be called any
 * number of times. No data call succeeds before a successful connect.
 * <p>
 * Adapters never persist anything themselves. They return tables as
 * {@link ModelResult#getArtifacts() artifacts} and the models manager writes them.
 * <p>
 * Implementations must be public with a public no-argument constructor so that they can be
 * registered in the model registry.
 */
public interface IModelAdapter {

    /**
     * Initializes the adapter from the measurement parameters.
     * Performs type-only validation; must not touch data.
     *
     * @param config the {@code MEASUREMENT.PARAMS} section
     * @return true on success
     * @throws IllegalArgumentException if a structural value has the wrong type or range
     */
    boolean connect(Config config);

    /**
     * Validates the merged fit parameters. Called once per fit, after overrides are applied.
     *
     * @throws org.impactengine.api.exceptions.InvalidParameterException naming the bad key
     */
    void validateParams(Config params);

    /**
     * Fits the model.
     *
     * @param data   the transformed input data
     * @param params merged fit parameters
     * @return the standardized result
     * @throws IllegalArgumentException if the data does not meet the model's requirements
     * @throws org.impactengine.api.exceptions.EstimationFailureException if the computation fails
     */
    ModelResult fit(PanelFrame data, Config params);

    /**
     * Columns the input data must contain. Empty by default.
     */
    default List<String> getRequiredColumns() {
        return List.of();
    }

    /**
     * Whether the adapter is connected and ready. Defaults to true.
     */
    default boolean validateConnection() {
        return true;
    }
}
