package fr.lapetina.primaryserver.infrastructure.control;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.TimeUnit;

/**
 * In-process control channel backed by a {@link SynchronousQueue}.
 * The HTTP control endpoint delivers into it, the reconfiguration listener waits on it.
 */
public final class QueueControlChannel implements ControlChannel {

    private static final Logger log = LoggerFactory.getLogger(QueueControlChannel.class);

    private static final long POLL_SLICE_MS = 500;

    private final SynchronousQueue<String> commands = new SynchronousQueue<>();
    private final Deque<String> notifications = new ArrayDeque<>();
    private final int historySize;
    private volatile boolean closed;

    public QueueControlChannel(int historySize) {
        this.historySize = Math.max(1, historySize);
    }

    public QueueControlChannel() {
        this(100);
    }

    @Override
    public void publish(String notification) {
        log.info("Notification: {}", notification);
        synchronized (notifications) {
            if (notifications.size() == historySize) {
                notifications.removeFirst();
            }
            notifications.addLast(notification);
        }
    }

    @Override
    public Optional<String> awaitCommand(Duration timeout) throws InterruptedException {
        boolean bounded = !timeout.isZero() && !timeout.isNegative();
        long deadline = bounded ? System.nanoTime() + timeout.toNanos() : Long.MAX_VALUE;
        while (!closed) {
            long slice = POLL_SLICE_MS;
            if (bounded) {
                long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remainingMs <= 0) {
                    return Optional.empty();
                }
                slice = Math.min(slice, remainingMs);
            }
            String command = commands.poll(slice, TimeUnit.MILLISECONDS);
            if (command != null) {
                return Optional.of(command);
            }
        }
        return Optional.empty();
    }

    @Override
    public boolean deliver(String command, Duration handoffTimeout) throws InterruptedException {
        if (closed) {
            return false;
        }
        boolean taken = commands.offer(command, handoffTimeout.toMillis(), TimeUnit.MILLISECONDS);
        if (!taken) {
            log.warn("Control command rejected, no listener waiting: command={}", command);
        }
        return taken;
    }

    @Override
    public List<String> recentNotifications() {
        synchronized (notifications) {
            return List.copyOf(notifications);
        }
    }

    @Override
    public void close() {
        closed = true;
    }
}
