package fr.lapetina.primaryserver.disruptor;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.primaryserver.disruptor.exception.BackpressureException;
import fr.lapetina.primaryserver.disruptor.handlers.ServingHandler;
import fr.lapetina.primaryserver.domain.event.WorkRequestEvent;
import fr.lapetina.primaryserver.domain.event.WorkRequestEventFactory;
import fr.lapetina.primaryserver.infrastructure.config.PrimaryServerConfig;
import fr.lapetina.primaryserver.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.primaryserver.server.JobServer;
import fr.lapetina.primaryserver.server.ServeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Serving loop of the primary server.
 *
 * HTTP threads publish work-channel requests into a ring buffer; a single
 * consumer thread ({@code primary-server-serving}) serves them one at a time,
 * strictly in arrival order. Producers are MULTI since every HTTP thread
 * publishes. A full ring buffer rejects the request instead of blocking.
 */
public final class WorkRequestPipeline implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkRequestPipeline.class);

    public static final String SERVING_THREAD_NAME = "primary-server-serving";

    private final Disruptor<WorkRequestEvent> disruptor;
    private final RingBuffer<WorkRequestEvent> ringBuffer;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final MetricsRegistry metricsRegistry;

    private WorkRequestPipeline(Builder builder) {
        this.metricsRegistry = builder.metricsRegistry;
        this.disruptor = new Disruptor<>(
                new WorkRequestEventFactory(),
                builder.ringBufferSize,
                r -> {
                    Thread t = new Thread(r, SERVING_THREAD_NAME);
                    t.setDaemon(false);
                    return t;
                },
                ProducerType.MULTI,
                createWaitStrategy(builder.waitStrategy)
        );

        disruptor.handleEventsWith(new ServingHandler(builder.jobServer, builder.metricsRegistry, builder.servingFinished));
        disruptor.setDefaultExceptionHandler(new ServingExceptionHandler());
        this.ringBuffer = disruptor.getRingBuffer();

        log.info("WorkRequestPipeline created: ringBufferSize={}, waitStrategy={}",
                builder.ringBufferSize, builder.waitStrategy);
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            disruptor.start();
            log.info("WorkRequestPipeline started");
        }
    }

    /**
     * Queues a request for the serving thread.
     *
     * @param requestId correlation id used in logs
     * @param payload   raw request token
     * @return future completed by the serving thread with the reply
     * @throws BackpressureException if the ring buffer is full or the loop is not running
     */
    public CompletableFuture<ServeResult> submit(String requestId, String payload) {
        if (!running.get()) {
            throw new BackpressureException(BackpressureException.BackpressureReason.NOT_SERVING);
        }

        CompletableFuture<ServeResult> replyFuture = new CompletableFuture<>();
        long sequence;
        try {
            sequence = ringBuffer.tryNext();
        } catch (InsufficientCapacityException e) {
            throw new BackpressureException(
                    BackpressureException.BackpressureReason.RING_BUFFER_FULL,
                    "Ring buffer full, remaining capacity: " + ringBuffer.remainingCapacity()
            );
        }

        try {
            WorkRequestEvent event = ringBuffer.get(sequence);
            event.initialize(requestId, payload, replyFuture);
            event.setSequence(sequence);
        } finally {
            ringBuffer.publish(sequence);
        }
        metricsRegistry.setRingBufferRemaining((int) ringBuffer.remainingCapacity());

        log.debug("Request submitted: requestId={}, sequence={}", requestId, sequence);
        return replyFuture;
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down WorkRequestPipeline...");
            try {
                disruptor.shutdown(10, TimeUnit.SECONDS);
                log.info("WorkRequestPipeline shut down gracefully");
            } catch (TimeoutException e) {
                log.warn("WorkRequestPipeline shutdown timed out, halting...");
                disruptor.halt();
            }
        }
    }

    private static WaitStrategy createWaitStrategy(String name) {
        return switch (name.toLowerCase()) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "busy-spin" -> new BusySpinWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                yield new BlockingWaitStrategy();
            }
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    private static class ServingExceptionHandler implements ExceptionHandler<WorkRequestEvent> {

        private static final Logger log = LoggerFactory.getLogger(ServingExceptionHandler.class);

        @Override
        public void handleEventException(Throwable ex, long sequence, WorkRequestEvent event) {
            log.error("Exception in serving loop: sequence={}, event={}", sequence, event, ex);
            if (event.getReplyFuture() != null && !event.getReplyFuture().isDone()) {
                event.getReplyFuture().completeExceptionally(ex);
            }
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during serving loop start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during serving loop shutdown", ex);
        }
    }

    /**
     * Builder for WorkRequestPipeline.
     */
    public static final class Builder {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private JobServer jobServer;
        private MetricsRegistry metricsRegistry;
        private Runnable servingFinished = () -> { };

        public Builder ringBufferSize(int size) {
            // Must be power of 2
            if (Integer.bitCount(size) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2");
            }
            this.ringBufferSize = size;
            return this;
        }

        public Builder waitStrategy(String strategy) {
            this.waitStrategy = strategy;
            return this;
        }

        public Builder jobServer(JobServer jobServer) {
            this.jobServer = jobServer;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry registry) {
            this.metricsRegistry = registry;
            return this;
        }

        /**
         * Callback run on the serving thread each time the loop reports no more work.
         */
        public Builder servingFinished(Runnable callback) {
            this.servingFinished = callback;
            return this;
        }

        public Builder fromConfig(PrimaryServerConfig config) {
            ringBufferSize(config.getDisruptor().getRingBufferSize());
            this.waitStrategy = config.getDisruptor().getWaitStrategy();
            return this;
        }

        public WorkRequestPipeline build() {
            if (jobServer == null) {
                throw new IllegalStateException("JobServer is required");
            }
            if (metricsRegistry == null) {
                throw new IllegalStateException("MetricsRegistry is required");
            }
            return new WorkRequestPipeline(this);
        }
    }
}
