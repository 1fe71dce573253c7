package org.impactengine.transforms;

import com.typesafe.config.Config;
import org.impactengine.api.data.PanelFrame;
import org.impactengine.api.transforms.ITransform;

/**
 * Returns the input unchanged. Every column survives.
 */
public class PassthroughTransform implements ITransform {

    @Override
    public PanelFrame apply(PanelFrame data, Config params) {
        return data;
    }
}
