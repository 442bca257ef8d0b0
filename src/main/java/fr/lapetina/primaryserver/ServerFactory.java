package fr.lapetina.primaryserver;

import fr.lapetina.primaryserver.api.WorkChannelServer;
import fr.lapetina.primaryserver.disruptor.WorkRequestPipeline;
import fr.lapetina.primaryserver.domain.generator.GeneratorCoordinator;
import fr.lapetina.primaryserver.domain.model.RunConfig;
import fr.lapetina.primaryserver.infrastructure.codec.WireCodec;
import fr.lapetina.primaryserver.infrastructure.config.ConfigLoader;
import fr.lapetina.primaryserver.infrastructure.config.PrimaryServerConfig;
import fr.lapetina.primaryserver.infrastructure.control.ControlChannel;
import fr.lapetina.primaryserver.infrastructure.control.QueueControlChannel;
import fr.lapetina.primaryserver.infrastructure.driver.DriverNotifier;
import fr.lapetina.primaryserver.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.primaryserver.server.JobServer;
import fr.lapetina.primaryserver.server.ReconfigurationListener;
import fr.lapetina.primaryserver.server.StatusResponder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Creates a fully-wired primary server from configuration.
 *
 * <p>Usage:
 * <pre>{@code
 * try (ServerFactory server = ServerFactory.create("config.yaml").start()) {
 *     server.awaitServingFinished();
 * }
 * }</pre>
 */
public class ServerFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ServerFactory.class);

    public static final String INITIALIZING = "PRIMSERVER : STATUS : INITIALIZING";

    private final PrimaryServerConfig config;
    private final MetricsRegistry metricsRegistry;
    private final WireCodec codec;
    private final ControlChannel controlChannel;
    private final JobServer jobServer;
    private final WorkRequestPipeline pipeline;
    private final WorkChannelServer workChannel;
    private final StatusResponder statusResponder;
    private final CountDownLatch servingFinished = new CountDownLatch(1);

    protected ServerFactory(PrimaryServerConfig config) {
        this.config = config;
        RunConfig runConfig = config.getRun().toRunConfig();
        PrimaryServerConfig.ServiceConfig service = config.getService();
        PrimaryServerConfig.ServerConfig server = config.getServer();

        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());
        this.codec = new WireCodec();
        this.controlChannel = new QueueControlChannel(service.getNotificationHistory());

        ReconfigurationListener listener = service.isAsService()
                ? new ReconfigurationListener(controlChannel, Duration.ofMillis(service.getControlTimeoutMs()))
                : null;

        this.jobServer = new JobServer(
                runConfig,
                new GeneratorCoordinator(),
                metricsRegistry,
                DriverNotifier.forPipe(service.getDriverPipe()),
                listener
        );
        jobServer.addConfigChangeListener(this::onRunConfigChanged);

        this.pipeline = WorkRequestPipeline.builder()
                .fromConfig(config)
                .jobServer(jobServer)
                .metricsRegistry(metricsRegistry)
                .servingFinished(servingFinished::countDown)
                .build();

        try {
            this.workChannel = new WorkChannelServer(
                    server.getHost(),
                    server.getWorkPort(),
                    server.getBacklog(),
                    server.getReplyTimeoutMs(),
                    pipeline,
                    controlChannel,
                    codec
            );
            this.statusResponder = new StatusResponder(
                    server.getHost(),
                    server.getStatusPort(),
                    server.getBacklog(),
                    jobServer,
                    metricsRegistry,
                    codec
            );
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to bind server channels", e);
        }

        log.info("ServerFactory initialized: generator={}, service={}, driver={}",
                runConfig.generator(), service.isAsService(), service.getDriverPipe());
    }

    /**
     * Creates a server from the specified configuration file.
     */
    public static ServerFactory create(String configPath) {
        return new ServerFactory(new ConfigLoader(configPath).load());
    }

    public static ServerFactory create(PrimaryServerConfig config) {
        return new ServerFactory(config);
    }

    /**
     * Starts generation, the serving loop and both channels.
     */
    public ServerFactory start() {
        controlChannel.publish(INITIALIZING);
        jobServer.start();
        pipeline.start();
        statusResponder.start();
        workChannel.start();
        log.info("Primary server started: workPort={}, statusPort={}", getWorkPort(), getStatusPort());
        return this;
    }

    /**
     * Blocks until the serving loop reports that no more work may exist.
     */
    public void awaitServingFinished() throws InterruptedException {
        servingFinished.await();
    }

    public boolean awaitServingFinished(Duration timeout) throws InterruptedException {
        return servingFinished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public int getWorkPort() {
        return workChannel.getPort();
    }

    public int getStatusPort() {
        return statusResponder.getPort();
    }

    public JobServer getJobServer() {
        return jobServer;
    }

    public ControlChannel getControlChannel() {
        return controlChannel;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public WireCodec getCodec() {
        return codec;
    }

    public PrimaryServerConfig getConfig() {
        return config;
    }

    private void onRunConfigChanged(RunConfig oldConfig, RunConfig newConfig) {
        log.info("Run configuration changed: generator={} -> {}, nEvents={} -> {}",
                oldConfig.generator(), newConfig.generator(), oldConfig.nEvents(), newConfig.nEvents());
        controlChannel.publish("PRIMSERVER : CONFIG : generator=" + newConfig.generator()
                + " nEvents=" + newConfig.nEvents() + " chunkSize=" + newConfig.chunkSize());
    }

    @Override
    public void close() {
        log.info("Shutting down primary server...");

        // Unblocks a listener waiting for control input
        controlChannel.close();

        try {
            workChannel.close();
        } catch (Exception e) {
            log.warn("Error closing work channel", e);
        }

        try {
            pipeline.close();
        } catch (Exception e) {
            log.warn("Error closing pipeline", e);
        }

        try {
            statusResponder.close();
        } catch (Exception e) {
            log.warn("Error closing status responder", e);
        }

        try {
            jobServer.close();
        } catch (Exception e) {
            log.warn("Error closing job server", e);
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        log.info("Primary server shut down");
    }
}
