package fr.lapetina.primaryserver.worker;

import fr.lapetina.primaryserver.domain.model.ErrorReply;
import fr.lapetina.primaryserver.domain.model.LifecycleState;
import fr.lapetina.primaryserver.domain.model.PrimaryChunk;
import fr.lapetina.primaryserver.infrastructure.codec.WireCodec;
import fr.lapetina.primaryserver.infrastructure.http.PrimaryServerClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Client-side loop of one worker: probe, request, process, repeat.
 *
 * Stateless across cycles apart from its transport engine. The wait for a
 * reply is retried up to {@code receiveAttempts} times; the request itself is
 * never re-sent.
 */
public final class WorkerKernel {

    private static final Logger log = LoggerFactory.getLogger(WorkerKernel.class);

    private final String workerId;
    private final PrimaryServerClient client;
    private final WireCodec codec;
    private final TransportEngine engine;
    private final boolean probeStatus;
    private final Duration replyTimeout;
    private final int receiveAttempts;

    public WorkerKernel(
            String workerId,
            PrimaryServerClient client,
            TransportEngine engine,
            boolean probeStatus,
            Duration replyTimeout,
            int receiveAttempts
    ) {
        if (receiveAttempts < 1) {
            throw new IllegalArgumentException("Receive attempts must be at least 1");
        }
        this.workerId = workerId;
        this.client = client;
        this.codec = client.getCodec();
        this.engine = engine;
        this.probeStatus = probeStatus;
        this.replyTimeout = replyTimeout;
        this.receiveAttempts = receiveAttempts;
    }

    /**
     * Runs cycles until the server reports no more work.
     *
     * @param backoff                pause after an idle or unavailable cycle
     * @param maxConsecutiveFailures give up after this many unavailable cycles in a row, 0 never
     * @return {@link KernelResult#NO_MORE_WORK}, or {@link KernelResult#UNAVAILABLE} when giving up
     */
    public KernelResult run(Duration backoff, int maxConsecutiveFailures) {
        int failures = 0;
        long processed = 0;
        while (!Thread.currentThread().isInterrupted()) {
            KernelResult result = runCycle();
            switch (result) {
                case PROCESSED -> {
                    processed++;
                    failures = 0;
                }
                case NO_MORE_WORK -> {
                    log.info("Worker finished: worker={}, chunksProcessed={}", workerId, processed);
                    return result;
                }
                case SERVER_IDLE -> {
                    failures = 0;
                    pause(backoff);
                }
                case UNAVAILABLE -> {
                    failures++;
                    if (maxConsecutiveFailures > 0 && failures >= maxConsecutiveFailures) {
                        log.error("Giving up after {} consecutive failures: worker={}", failures, workerId);
                        return result;
                    }
                    pause(backoff);
                }
            }
        }
        log.warn("Worker interrupted: worker={}, chunksProcessed={}", workerId, processed);
        return KernelResult.UNAVAILABLE;
    }

    /**
     * Runs a single cycle.
     */
    public KernelResult runCycle() {
        MDC.put("worker", workerId);
        try {
            if (probeStatus) {
                Optional<LifecycleState> state = client.probeStatus(replyTimeout);
                if (state.isEmpty()) {
                    log.debug("Server status unknown, skipping cycle");
                    return KernelResult.UNAVAILABLE;
                }
                if (state.get() == LifecycleState.IDLE) {
                    return KernelResult.SERVER_IDLE;
                }
                if (!state.get().acceptsWorkRequests()) {
                    log.debug("Server not serving: state={}", state.get());
                    return KernelResult.UNAVAILABLE;
                }
            }

            CompletableFuture<PrimaryServerClient.WireReply> pending;
            try {
                pending = client.requestWork();
            } catch (RuntimeException e) {
                log.warn("Work request could not be sent: {}", e.getMessage());
                return KernelResult.UNAVAILABLE;
            }

            Optional<PrimaryServerClient.WireReply> reply = awaitReply(pending);
            if (reply.isEmpty()) {
                return KernelResult.UNAVAILABLE;
            }
            return handleReply(reply.get());
        } finally {
            MDC.remove("worker");
        }
    }

    private Optional<PrimaryServerClient.WireReply> awaitReply(CompletableFuture<PrimaryServerClient.WireReply> pending) {
        for (int attempt = 1; attempt <= receiveAttempts; attempt++) {
            try {
                return Optional.of(pending.get(replyTimeout.toMillis(), TimeUnit.MILLISECONDS));
            } catch (TimeoutException e) {
                log.debug("No reply yet: attempt={}/{}", attempt, receiveAttempts);
            } catch (ExecutionException e) {
                log.warn("Work request failed: {}", String.valueOf(e.getCause()));
                return Optional.empty();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                pending.cancel(true);
                return Optional.empty();
            }
        }
        log.warn("No reply after {} attempts of {} ms", receiveAttempts, replyTimeout.toMillis());
        pending.cancel(true);
        return Optional.empty();
    }

    private KernelResult handleReply(PrimaryServerClient.WireReply reply) {
        if (!reply.isOk()) {
            try {
                ErrorReply error = codec.decodeErrorReply(reply.body());
                log.warn("Server replied with error: status={}, type={}, message={}",
                        reply.statusCode(), error.type(), error.message());
            } catch (RuntimeException e) {
                log.warn("Server replied with error: status={}", reply.statusCode());
            }
            return KernelResult.UNAVAILABLE;
        }

        PrimaryChunk chunk;
        try {
            chunk = codec.decodeChunk(reply.body());
        } catch (RuntimeException e) {
            log.warn("Undecodable chunk: {}", e.getMessage());
            return KernelResult.UNAVAILABLE;
        }

        if (chunk.isExhaustionSignal()) {
            log.info("No more work available");
            return KernelResult.NO_MORE_WORK;
        }

        engine.setPrimaries(chunk.particles(), chunk.info());
        engine.seed(chunk.info().seed());
        engine.processEvent();
        return KernelResult.PROCESSED;
    }

    private static void pause(Duration backoff) {
        if (backoff.isZero() || backoff.isNegative()) {
            return;
        }
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
