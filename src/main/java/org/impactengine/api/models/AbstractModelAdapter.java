package org.impactengine.api.models;

import com.typesafe.config.Config;
import org.impactengine.api.data.PanelFrame;

/**
 * Base class enforcing the connect-once lifecycle of {@link IModelAdapter}.
 * <p>
 * Subclasses implement {@link #doConnect(Config)} and {@link #doFit(PanelFrame, Config)};
 * this class guarantees that connect is entered at most once and that fits are rejected
 * until a connect succeeded.
 */
public abstract class AbstractModelAdapter implements IModelAdapter {

    private boolean connectAttempted;
    private boolean connected;

    @Override
    public final boolean connect(Config config) {
        if (connectAttempted) {
            throw new IllegalStateException(getClass().getSimpleName() + " is already connected");
        }
        connectAttempted = true;
        connected = doConnect(config);
        return connected;
    }

    @Override
    public final ModelResult fit(PanelFrame data, Config params) {
        if (!connected) {
            throw new IllegalStateException(getClass().getSimpleName() + " is not connected. Call connect() first.");
        }
        return doFit(data, params);
    }

    @Override
    public boolean validateConnection() {
        return connected;
    }

    /**
     * Validates and stores the structural configuration.
     *
     * @return true if the adapter is ready
     */
    protected abstract boolean doConnect(Config config);

    protected abstract ModelResult doFit(PanelFrame data, Config params);
}
