package fr.lapetina.primaryserver.worker;

import fr.lapetina.primaryserver.domain.model.ErrorType;
import fr.lapetina.primaryserver.domain.model.EventHeader;
import fr.lapetina.primaryserver.domain.model.LifecycleState;
import fr.lapetina.primaryserver.domain.model.Particle;
import fr.lapetina.primaryserver.domain.model.PrimaryChunk;
import fr.lapetina.primaryserver.domain.model.RunConfig;
import fr.lapetina.primaryserver.domain.model.SubEventInfo;
import fr.lapetina.primaryserver.infrastructure.config.PrimaryServerConfig;
import fr.lapetina.primaryserver.infrastructure.http.PrimaryServerClient.WireReply;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class WorkerKernelTest {

    private StubPrimaryServerClient client;
    private AccountingTransportEngine engine;
    private ScheduledExecutorService scheduler;

    @BeforeEach
    void setUp() {
        client = new StubPrimaryServerClient();
        engine = new AccountingTransportEngine();
        scheduler = Executors.newSingleThreadScheduledExecutor();
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    private WorkerKernel kernel(boolean probe) {
        return new WorkerKernel("worker-test", client, engine, probe, Duration.ofMillis(100), 3);
    }

    private static PrimaryChunk chunk(int eventId, int part, int particles) {
        List<Particle> primaries = new ArrayList<>();
        for (int i = 0; i < particles; i++) {
            primaries.add(Particle.atOrigin(211, 0, 0, 1, 2.0));
        }
        return new PrimaryChunk(new SubEventInfo(eventId, 2, part, 1, 40L + eventId, 0, EventHeader.empty()), primaries);
    }

    private static PrimaryChunk exhausted() {
        return PrimaryChunk.exhausted(new SubEventInfo(2, 2, 1, 1, 42, 0, EventHeader.empty()));
    }

    @Nested
    @DisplayName("single cycle")
    class SingleCycle {

        @Test
        @DisplayName("should process a chunk with the chunk seed")
        void shouldProcessChunk() {
            client.reply(chunk(1, 1, 3));

            assertThat(kernel(true).runCycle()).isEqualTo(KernelResult.PROCESSED);
            assertThat(engine.getChunksProcessed()).isEqualTo(1);
            assertThat(engine.getParticlesProcessed()).isEqualTo(3);
            assertThat(engine.getTotalEnergy()).isEqualTo(6.0);
            assertThat(engine.getLastSeed()).isEqualTo(41);
        }

        @Test
        @DisplayName("should report no more work on the exhaustion signal")
        void shouldStopOnExhaustion() {
            client.reply(exhausted());

            assertThat(kernel(true).runCycle()).isEqualTo(KernelResult.NO_MORE_WORK);
            assertThat(engine.getChunksProcessed()).isZero();
        }

        @Test
        @DisplayName("should not request work from an idle server")
        void shouldSkipIdleServer() {
            client.withStatus(LifecycleState.IDLE).reply(chunk(1, 1, 1));

            assertThat(kernel(true).runCycle()).isEqualTo(KernelResult.SERVER_IDLE);
            assertThat(client.getRequestsSent()).isZero();
        }

        @Test
        @DisplayName("should treat a stopped or silent server as unavailable")
        void shouldTreatStoppedServerAsUnavailable() {
            client.withStatus(LifecycleState.STOPPED);
            assertThat(kernel(true).runCycle()).isEqualTo(KernelResult.UNAVAILABLE);

            client.withStatus(null);
            assertThat(kernel(true).runCycle()).isEqualTo(KernelResult.UNAVAILABLE);
            assertThat(client.getRequestsSent()).isZero();
        }

        @Test
        @DisplayName("should request work without probing when probing is disabled")
        void shouldRequestWithoutProbe() {
            client.withStatus(LifecycleState.IDLE).reply(chunk(1, 1, 1));

            assertThat(kernel(false).runCycle()).isEqualTo(KernelResult.PROCESSED);
        }

        @Test
        @DisplayName("should treat an error reply as unavailable")
        void shouldTreatErrorReplyAsUnavailable() {
            client.replyError(ErrorType.GENERATION_FAILED);

            assertThat(kernel(true).runCycle()).isEqualTo(KernelResult.UNAVAILABLE);
        }

        @Test
        @DisplayName("should keep waiting for a late reply without re-sending")
        void shouldRetryWaitOnly() {
            CompletableFuture<WireReply> late = new CompletableFuture<>();
            client.reply(late);
            byte[] body = client.getCodec().encode(chunk(1, 1, 2));
            scheduler.schedule(() -> late.complete(new WireReply(200, body)), 150, TimeUnit.MILLISECONDS);

            assertThat(kernel(true).runCycle()).isEqualTo(KernelResult.PROCESSED);
            assertThat(client.getRequestsSent()).isEqualTo(1);
        }

        @Test
        @DisplayName("should give up after the last receive attempt")
        void shouldGiveUpAfterAttempts() {
            CompletableFuture<WireReply> never = new CompletableFuture<>();
            client.reply(never);

            assertThat(kernel(true).runCycle()).isEqualTo(KernelResult.UNAVAILABLE);
            assertThat(never).isCancelled();
            assertThat(client.getRequestsSent()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("run loop")
    class RunLoop {

        @Test
        @DisplayName("should process until no more work is left")
        void shouldProcessUntilExhausted() {
            client.reply(chunk(1, 1, 4)).reply(chunk(2, 1, 5)).reply(exhausted());

            assertThat(kernel(true).run(Duration.ZERO, 3)).isEqualTo(KernelResult.NO_MORE_WORK);
            assertThat(engine.getChunksProcessed()).isEqualTo(2);
            assertThat(engine.getParticlesProcessed()).isEqualTo(9);
        }

        @Test
        @DisplayName("should give up after consecutive failures")
        void shouldGiveUpAfterConsecutiveFailures() {
            client.withStatus(LifecycleState.STOPPED);

            assertThat(kernel(true).run(Duration.ofMillis(1), 4)).isEqualTo(KernelResult.UNAVAILABLE);
        }

        @Test
        @DisplayName("should reset the failure count after a processed chunk")
        void shouldResetFailuresAfterSuccess() {
            client.replyError(ErrorType.UNAVAILABLE)
                    .reply(chunk(1, 1, 1))
                    .replyError(ErrorType.UNAVAILABLE)
                    .reply(exhausted());

            assertThat(kernel(true).run(Duration.ZERO, 2)).isEqualTo(KernelResult.NO_MORE_WORK);
            assertThat(engine.getChunksProcessed()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("worker application")
    class Application {

        @Test
        @DisplayName("should exit with the no-config code when the configuration is unavailable")
        void shouldFailWithoutConfig() {
            WorkerApplication application = new WorkerApplication(new PrimaryServerConfig.WorkerConfig(), client);

            assertThat(application.run()).isEqualTo(WorkerApplication.EXIT_NO_CONFIG);
        }

        @Test
        @DisplayName("should run the configured engine until no more work")
        void shouldRunConfiguredEngine() {
            client.withConfig(RunConfig.builder().mcEngine("unknown-engine").build())
                    .reply(chunk(1, 1, 2))
                    .reply(exhausted());
            PrimaryServerConfig.WorkerConfig config = new PrimaryServerConfig.WorkerConfig();
            config.setBackoffMs(0);
            config.setReplyTimeoutMs(500);

            WorkerApplication application = new WorkerApplication(config, client);

            assertThat(application.run()).isEqualTo(WorkerApplication.EXIT_OK);
            assertThat(application.getResults()).containsEntry("worker-0", KernelResult.NO_MORE_WORK);
            assertThat(application.getEngines()).singleElement()
                    .isInstanceOfSatisfying(AccountingTransportEngine.class,
                            e -> assertThat(e.getChunksProcessed()).isEqualTo(1));
        }
    }
}
