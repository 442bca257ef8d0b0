package fr.lapetina.primaryserver.server;

import fr.lapetina.primaryserver.domain.model.ReconfigRequest;

/**
 * Target of a reconfiguration command.
 */
@FunctionalInterface
public interface Reconfigurable {

    /**
     * Adopts the request and starts a new generation cycle.
     *
     * @throws fr.lapetina.primaryserver.infrastructure.config.ConfigLoader.ConfigurationException
     *         if a referenced configuration file cannot be loaded
     * @throws IllegalArgumentException if the resulting run configuration is invalid
     */
    void reconfigure(ReconfigRequest request);
}
