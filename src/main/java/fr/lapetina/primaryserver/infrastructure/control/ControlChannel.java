package fr.lapetina.primaryserver.infrastructure.control;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Publish/subscribe control channel between the server and its driver.
 *
 * No retention: a command is only accepted while a listener is waiting for it.
 */
public interface ControlChannel extends AutoCloseable {

    /**
     * Publishes a notification of the form {@code <component> : <kind> : <message>}.
     */
    void publish(String notification);

    /**
     * Waits for the next command.
     *
     * @param timeout how long to wait; zero or negative waits until the channel is closed
     * @return the command, or empty on timeout or close
     */
    Optional<String> awaitCommand(Duration timeout) throws InterruptedException;

    /**
     * Hands a command to a waiting listener.
     *
     * @return true if a listener took the command
     */
    boolean deliver(String command, Duration handoffTimeout) throws InterruptedException;

    /**
     * Most recent notifications, oldest first.
     */
    List<String> recentNotifications();

    @Override
    void close();
}
