package org.impactengine.cli;

import com.typesafe.config.Config;
import org.impactengine.api.data.PanelFrame;
import org.impactengine.api.models.AbstractModelAdapter;
import org.impactengine.api.models.ModelResult;

import java.util.List;

/**
 * Extension model registered through application configuration in CLI tests.
 */
public class DateCountingModel extends AbstractModelAdapter {

    @Override
    protected boolean doConnect(Config config) {
        return true;
    }

    @Override
    public void validateParams(Config params) {
    }

    @Override
    public List<String> getRequiredColumns() {
        return List.of("date");
    }

    @Override
    protected ModelResult doFit(PanelFrame data, Config params) {
        return ModelResult.builder("extension_model")
            .impactEstimate("n_dates", data.rowCount())
            .build();
    }
}
