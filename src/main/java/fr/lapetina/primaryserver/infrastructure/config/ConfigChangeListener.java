package fr.lapetina.primaryserver.infrastructure.config;

import fr.lapetina.primaryserver.domain.model.RunConfig;

/**
 * Listener interface for run configuration changes.
 */
@FunctionalInterface
public interface ConfigChangeListener {

    /**
     * Called after the server adopted a new run configuration.
     *
     * @param oldConfig The previous configuration
     * @param newConfig The new configuration
     */
    void onConfigChanged(RunConfig oldConfig, RunConfig newConfig);
}
