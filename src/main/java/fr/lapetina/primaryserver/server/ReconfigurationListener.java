package fr.lapetina.primaryserver.server;

import fr.lapetina.primaryserver.domain.model.ReconfigRequest;
import fr.lapetina.primaryserver.infrastructure.config.ConfigLoader;
import fr.lapetina.primaryserver.infrastructure.control.ControlChannel;
import fr.lapetina.primaryserver.infrastructure.control.ControlCommandException;
import fr.lapetina.primaryserver.infrastructure.control.ControlCommandParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Waits for control input while an idle server runs as a service.
 *
 * Invoked on the serving thread; the serving loop stays blocked until a
 * command was applied, a stop was requested or the control timeout expired.
 */
public final class ReconfigurationListener {

    private static final Logger log = LoggerFactory.getLogger(ReconfigurationListener.class);

    public static final String AWAITING_INPUT = "PRIMSERVER : STATUS : AWAITING INPUT";
    public static final String STOPPING = "PRIMSERVER : STATUS : STOPPING";
    public static final String RECONFIGURED = "PRIMSERVER : STATUS : RECONFIGURED";
    public static final String ERROR_PREFIX = "PRIMSERVER : ERROR : ";

    private final ControlChannel channel;
    private final Duration controlTimeout;

    /**
     * @param controlTimeout how long to wait for a command; zero waits forever
     */
    public ReconfigurationListener(ControlChannel channel, Duration controlTimeout) {
        this.channel = channel;
        this.controlTimeout = controlTimeout;
    }

    /**
     * Blocks until a command is applied to the target or the server must stop.
     *
     * @return true if the target was reconfigured, false if it must stop
     */
    public boolean awaitControlInput(Reconfigurable target) throws InterruptedException {
        channel.publish(AWAITING_INPUT);
        while (true) {
            Optional<String> command = channel.awaitCommand(controlTimeout);
            if (command.isEmpty()) {
                log.warn("No control input received, stopping: timeout={}", controlTimeout);
                channel.publish(STOPPING);
                return false;
            }

            ReconfigRequest request;
            try {
                request = ControlCommandParser.parse(command.get());
            } catch (ControlCommandException e) {
                log.warn("Rejected control command: command={}, reason={}", command.get(), e.getMessage());
                channel.publish(ERROR_PREFIX + e.getMessage());
                continue;
            }

            if (request.stop()) {
                log.info("Stop requested through control channel");
                channel.publish(STOPPING);
                return false;
            }

            try {
                target.reconfigure(request);
            } catch (ConfigLoader.ConfigurationException | IllegalArgumentException e) {
                log.warn("Reconfiguration failed: command={}, reason={}", command.get(), e.getMessage());
                channel.publish(ERROR_PREFIX + e.getMessage());
                continue;
            }
            channel.publish(RECONFIGURED);
            return true;
        }
    }
}
