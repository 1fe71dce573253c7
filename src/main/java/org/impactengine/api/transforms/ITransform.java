package org.impactengine.api.transforms;

import com.typesafe.config.Config;
import org.impactengine.api.data.PanelFrame;

/**
 * A named, pure data transformation applied between metrics retrieval and model fitting.
 * <p>
 * Implementations must not keep state between calls and must document which input
 * columns survive the transformation. They are registered by class and therefore need
 * a public no-argument constructor.
 */
@FunctionalInterface
public interface ITransform {

    /**
     * @param data   retrieved metrics
     * @param params the {@code DATA.TRANSFORM.PARAMS} section
     * @return the shaped data
     * @throws IllegalArgumentException if the data lacks a column the transform needs
     */
    PanelFrame apply(PanelFrame data, Config params);
}
