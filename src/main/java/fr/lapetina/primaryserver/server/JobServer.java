package fr.lapetina.primaryserver.server;

import fr.lapetina.primaryserver.domain.generator.GenerationException;
import fr.lapetina.primaryserver.domain.generator.Generator;
import fr.lapetina.primaryserver.domain.generator.GeneratorCoordinator;
import fr.lapetina.primaryserver.domain.model.ErrorType;
import fr.lapetina.primaryserver.domain.model.EventHeader;
import fr.lapetina.primaryserver.domain.model.LifecycleState;
import fr.lapetina.primaryserver.domain.model.PrimaryChunk;
import fr.lapetina.primaryserver.domain.model.PrimaryEvent;
import fr.lapetina.primaryserver.domain.model.ReconfigRequest;
import fr.lapetina.primaryserver.domain.model.RequestToken;
import fr.lapetina.primaryserver.domain.model.RunConfig;
import fr.lapetina.primaryserver.domain.model.SubEventInfo;
import fr.lapetina.primaryserver.domain.partition.ChunkPartitioner;
import fr.lapetina.primaryserver.infrastructure.config.ConfigChangeListener;
import fr.lapetina.primaryserver.infrastructure.config.ConfigLoader;
import fr.lapetina.primaryserver.infrastructure.driver.DriverNotifier;
import fr.lapetina.primaryserver.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The primary server state machine.
 *
 * Owns the lifecycle state, the current event and the partitioning cursor.
 * Request handling ({@link #handleRequest}, {@link #completeCycle} and
 * {@link #reconfigure}) runs on the single serving thread; events are produced
 * on the {@code event-generator} thread, at most one at a time, and handed
 * over through a single future.
 *
 * <pre>
 * INITIALIZING -> WAITING_EVENT -> READY_TO_SERVE -> IDLE -> STOPPED
 *       ^                                             |
 *       +------------------ reconfigure --------------+
 * </pre>
 */
public final class JobServer implements Reconfigurable, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(JobServer.class);

    private final AtomicReference<LifecycleState> state = new AtomicReference<>(LifecycleState.INITIALIZING);
    private final GeneratorCoordinator coordinator;
    private final MetricsRegistry metrics;
    private final DriverNotifier driverNotifier;
    private final ReconfigurationListener reconfigurationListener;
    private final ExecutorService generationExecutor;
    private final List<ConfigChangeListener> configListeners = new CopyOnWriteArrayList<>();

    private volatile RunConfig runConfig;
    private volatile long initialSeed;
    private volatile boolean failed;

    // Cursor, written by the serving thread only
    private volatile int eventCounter;
    private volatile int partCounter;
    private boolean needNewEvent = true;
    private PrimaryEvent currentEvent = PrimaryEvent.empty();
    private CompletableFuture<PrimaryEvent> pendingGeneration;
    private int announcedEvent;

    // Touched by the generation thread only
    private Generator cycleGenerator;

    /**
     * @param reconfigurationListener listener awaited when idle, or null when not running as a service
     */
    public JobServer(
            RunConfig runConfig,
            GeneratorCoordinator coordinator,
            MetricsRegistry metrics,
            DriverNotifier driverNotifier,
            ReconfigurationListener reconfigurationListener
    ) {
        this.runConfig = runConfig;
        this.coordinator = coordinator;
        this.metrics = metrics;
        this.driverNotifier = driverNotifier;
        this.reconfigurationListener = reconfigurationListener;
        this.generationExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "event-generator");
            t.setDaemon(true);
            return t;
        });

        metrics.registerLifecycleState(() -> state.get().getCode());
        metrics.registerEventCounter(() -> eventCounter);
    }

    /**
     * Seeds the random source and starts producing the first event.
     *
     * @throws IllegalArgumentException if the generator is unknown or the trigger is not understood
     */
    public void start() {
        coordinator.validate(runConfig);
        initialSeed = coordinator.reseed(runConfig.seed());
        log.info("JobServer starting: generator={}, nEvents={}, chunkSize={}, seed={}, service={}",
                runConfig.generator(), runConfig.nEvents(), runConfig.chunkSize(), initialSeed, isAsService());
        beginCycle();
    }

    private void beginCycle() {
        if (runConfig.nEvents() > 0) {
            startGeneration(true);
        } else {
            state.set(LifecycleState.READY_TO_SERVE);
        }
    }

    private void startGeneration(boolean firstOfCycle) {
        RunConfig config = runConfig;
        pendingGeneration = CompletableFuture.supplyAsync(() -> {
            if (firstOfCycle) {
                cycleGenerator = coordinator.initialize(config);
                state.compareAndSet(LifecycleState.INITIALIZING, LifecycleState.WAITING_EVENT);
            }
            long start = System.nanoTime();
            PrimaryEvent event = coordinator.produceEvent(cycleGenerator, config);
            Duration latency = Duration.ofNanos(System.nanoTime() - start);
            metrics.recordEventGenerated(latency);
            log.debug("Event generated: primaries={}, latencyMs={}", event.size(), latency.toMillis());
            if (firstOfCycle) {
                state.compareAndSet(LifecycleState.WAITING_EVENT, LifecycleState.READY_TO_SERVE);
            }
            return event;
        }, generationExecutor);
    }

    /**
     * Decodes a work-channel payload and serves it.
     */
    public ServeResult handleRequest(String payload) {
        Optional<RequestToken> token = RequestToken.fromWire(payload);
        if (token.isEmpty()) {
            log.warn("Protocol violation, unknown request token: payload={}", abbreviate(payload));
            metrics.incrementProtocolViolations();
            metrics.incrementErrorCount(ErrorType.PROTOCOL_VIOLATION);
            return ServeResult.ofError(ErrorType.PROTOCOL_VIOLATION, "Unknown request token: " + abbreviate(payload));
        }
        return switch (token.get()) {
            case CONFIG_REQUEST -> handleConfigRequest();
            case WORK_REQUEST -> handleWorkRequest();
        };
    }

    /**
     * Returns the current run configuration unchanged.
     */
    public ServeResult handleConfigRequest() {
        return ServeResult.ofConfig(runConfig);
    }

    /**
     * Hands out the next chunk, or the exhaustion signal once the event budget is spent.
     */
    public ServeResult handleWorkRequest() {
        if (failed) {
            return ServeResult.ofError(ErrorType.GENERATION_FAILED, "Event generation failed");
        }
        RunConfig config = runConfig;

        if (state.get() == LifecycleState.STOPPED
                || (needNewEvent && eventCounter >= config.nEvents())) {
            metrics.incrementExhaustionSignals();
            SubEventInfo last = new SubEventInfo(eventCounter, config.nEvents(), partCounter, 0,
                    eventCounter + initialSeed, 0, EventHeader.empty());
            return ServeResult.ofChunk(PrimaryChunk.exhausted(last));
        }

        if (needNewEvent) {
            try {
                currentEvent = awaitGeneration();
            } catch (GenerationException e) {
                failed = true;
                metrics.incrementErrorCount(ErrorType.GENERATION_FAILED);
                log.error("Event generation failed: eventId={}, generator={}",
                        eventCounter + 1, config.generator(), e);
                return ServeResult.ofError(ErrorType.GENERATION_FAILED, e.getMessage());
            }
            partCounter = 0;
            eventCounter++;
            needNewEvent = false;
        }

        PrimaryChunk chunk = ChunkPartitioner.chunk(
                currentEvent, config.chunkSize(), partCounter, eventCounter, config.nEvents(), initialSeed);
        if (announcedEvent != eventCounter) {
            announcedEvent = eventCounter;
            driverNotifier.notifyEventStarted(eventCounter);
        }
        partCounter++;
        if (partCounter >= chunk.info().nparts()) {
            needNewEvent = true;
            // A prefetch survives a rolled back last part
            if (eventCounter < config.nEvents() && pendingGeneration == null) {
                startGeneration(false);
            }
        }

        metrics.recordChunkServed(chunk.particles().size());
        log.debug("Chunk served: eventId={}/{}, part={}/{}, particles={}",
                chunk.info().eventId(), chunk.info().maxEvents(),
                chunk.info().part(), chunk.info().nparts(), chunk.particles().size());
        return ServeResult.ofChunk(chunk);
    }

    /**
     * Puts back a chunk whose reply never reached its requester, so the next
     * work request is served the same part of the same event.
     *
     * @return true when the cursor moved back
     */
    public boolean rollback(ServeResult undelivered) {
        if (!undelivered.isChunk() || undelivered.isExhaustionSignal()) {
            return false;
        }
        SubEventInfo info = undelivered.chunk().info();
        if (info.eventId() != eventCounter || info.part() != partCounter) {
            log.warn("Cannot roll back a stale chunk: eventId={}, part={}, cursor={}/{}",
                    info.eventId(), info.part(), eventCounter, partCounter);
            return false;
        }
        partCounter = info.part() - 1;
        needNewEvent = false;
        metrics.incrementChunksRolledBack();
        log.info("Chunk rolled back: eventId={}, part={}/{}", info.eventId(), info.part(), info.nparts());
        return true;
    }

    private PrimaryEvent awaitGeneration() {
        CompletableFuture<PrimaryEvent> pending = pendingGeneration;
        pendingGeneration = null;
        if (pending == null) {
            throw new GenerationException("No event generation in flight");
        }
        try {
            return pending.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof GenerationException ge) {
                throw ge;
            }
            throw new GenerationException("Event generation failed: " + cause, cause);
        } catch (CancellationException e) {
            throw new GenerationException("Event generation cancelled", e);
        }
    }

    /**
     * Applies the state transitions following a reply that was already handed back.
     *
     * @return false when the serving loop has no more work to serve
     */
    public boolean completeCycle(ServeResult result) {
        if (result.isError()) {
            if (result.error().type() == ErrorType.GENERATION_FAILED) {
                state.set(LifecycleState.STOPPED);
                return false;
            }
            return true;
        }
        if (result.isConfig()) {
            return true;
        }
        if (!result.isExhaustionSignal()) {
            state.set(LifecycleState.READY_TO_SERVE);
            return true;
        }

        if (state.get() == LifecycleState.STOPPED) {
            return false;
        }
        state.set(LifecycleState.IDLE);
        if (reconfigurationListener == null) {
            log.info("No more work: eventsServed={}", eventCounter);
            return false;
        }

        log.info("Idle, awaiting control input: eventsServed={}", eventCounter);
        boolean reconfigured;
        try {
            reconfigured = reconfigurationListener.awaitControlInput(this);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            reconfigured = false;
        }
        if (!reconfigured) {
            state.set(LifecycleState.STOPPED);
            log.info("JobServer stopped");
            return false;
        }
        return true;
    }

    /**
     * Starts a new generation cycle. Resets the cursor; the next chunk is event 1, part 1.
     * A rejected request leaves the server untouched.
     */
    @Override
    public void reconfigure(ReconfigRequest request) {
        RunConfig base = runConfig;
        if (request.configFile() != null) {
            base = ConfigLoader.loadFile(Path.of(request.configFile())).getRun().toRunConfig();
        }
        RunConfig next = request.applyTo(base);
        coordinator.validate(next);

        discardPendingGeneration();
        RunConfig previous = runConfig;
        runConfig = next;
        initialSeed = coordinator.reseed(next.seed());
        eventCounter = 0;
        partCounter = 0;
        announcedEvent = 0;
        needNewEvent = true;
        currentEvent = PrimaryEvent.empty();
        state.set(LifecycleState.INITIALIZING);
        metrics.incrementReconfigurations();

        log.info("JobServer reconfigured: generator={}, nEvents={}, chunkSize={}, seed={}",
                next.generator(), next.nEvents(), next.chunkSize(), initialSeed);
        for (ConfigChangeListener listener : configListeners) {
            try {
                listener.onConfigChanged(previous, next);
            } catch (Exception e) {
                log.error("Error notifying config change listener", e);
            }
        }
        beginCycle();
    }

    private void discardPendingGeneration() {
        CompletableFuture<PrimaryEvent> pending = pendingGeneration;
        pendingGeneration = null;
        if (pending == null) {
            return;
        }
        try {
            pending.join();
        } catch (CompletionException | CancellationException e) {
            log.warn("Discarded failed event generation: {}", e.getMessage());
        }
    }

    public void addConfigChangeListener(ConfigChangeListener listener) {
        configListeners.add(listener);
    }

    public LifecycleState getState() {
        return state.get();
    }

    public RunConfig getRunConfig() {
        return runConfig;
    }

    public long getInitialSeed() {
        return initialSeed;
    }

    public int getEventCounter() {
        return eventCounter;
    }

    public int getPartCounter() {
        return partCounter;
    }

    public boolean hasFailed() {
        return failed;
    }

    public boolean isAsService() {
        return reconfigurationListener != null;
    }

    @Override
    public void close() {
        state.set(LifecycleState.STOPPED);
        generationExecutor.shutdownNow();
        try {
            if (!generationExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Event generator did not terminate in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        coordinator.close();
    }

    private static String abbreviate(String payload) {
        if (payload == null) {
            return "null";
        }
        return payload.length() <= 64 ? payload : payload.substring(0, 64) + "...";
    }
}
