package fr.lapetina.primaryserver.infrastructure.driver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Reports the ordinal of each newly started event to an external driver.
 *
 * The ordinal is written as a 4-byte integer in native byte order. The target
 * is either a file descriptor number inherited from the driver (written through
 * {@code /dev/fd/N}) or a path. Failures are logged and otherwise ignored.
 */
public class DriverNotifier {

    private static final Logger log = LoggerFactory.getLogger(DriverNotifier.class);

    private static final DriverNotifier NONE = new DriverNotifier(null);

    private final Path target;
    private boolean warned;

    DriverNotifier(Path target) {
        this.target = target;
    }

    /**
     * Creates a notifier for the configured pipe.
     *
     * @param pipe file descriptor number or path, or null for no driver
     */
    public static DriverNotifier forPipe(String pipe) {
        if (pipe == null || pipe.isBlank()) {
            return NONE;
        }
        String trimmed = pipe.trim();
        if (trimmed.chars().allMatch(Character::isDigit)) {
            return new DriverNotifier(Path.of("/dev/fd", trimmed));
        }
        return new DriverNotifier(Path.of(trimmed));
    }

    public static DriverNotifier none() {
        return NONE;
    }

    public boolean isEnabled() {
        return target != null;
    }

    /**
     * Writes the event ordinal; best effort.
     */
    public void notifyEventStarted(int eventId) {
        if (target == null) {
            return;
        }
        ByteBuffer buffer = ByteBuffer.allocate(Integer.BYTES).order(ByteOrder.nativeOrder());
        buffer.putInt(eventId).flip();
        try (FileChannel channel = FileChannel.open(target, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            log.debug("Driver notified: eventId={}, target={}", eventId, target);
        } catch (IOException e) {
            if (!warned) {
                log.warn("Driver notification failed, continuing without: target={}, error={}",
                        target, e.getMessage());
                warned = true;
            } else {
                log.debug("Driver notification failed: eventId={}", eventId, e);
            }
        }
    }

    @Override
    public String toString() {
        return "DriverNotifier{target=" + target + '}';
    }
}
