package fr.lapetina.primaryserver.worker;

import fr.lapetina.primaryserver.domain.model.RunConfig;
import fr.lapetina.primaryserver.infrastructure.codec.WireCodec;
import fr.lapetina.primaryserver.infrastructure.config.ConfigLoader;
import fr.lapetina.primaryserver.infrastructure.config.PrimaryServerConfig;
import fr.lapetina.primaryserver.infrastructure.http.ConfigurationUnavailableException;
import fr.lapetina.primaryserver.infrastructure.http.PrimaryServerClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hosts one or more worker kernels.
 *
 * Exits 0 once every kernel finished, 2 when the configuration round trip failed.
 */
public class WorkerApplication {

    private static final Logger log = LoggerFactory.getLogger(WorkerApplication.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_NO_CONFIG = 2;

    private final PrimaryServerConfig.WorkerConfig workerConfig;
    private final PrimaryServerClient client;
    private final Map<String, KernelResult> results = new ConcurrentHashMap<>();
    private final List<TransportEngine> engines = new ArrayList<>();

    public WorkerApplication(PrimaryServerConfig.WorkerConfig workerConfig, PrimaryServerClient client) {
        this.workerConfig = workerConfig;
        this.client = client;
    }

    public WorkerApplication(PrimaryServerConfig.WorkerConfig workerConfig) {
        this(workerConfig, new PrimaryServerClient(
                workerConfig.getServerUrl(),
                workerConfig.getStatusUrl(),
                Duration.ofMillis(workerConfig.getConnectTimeoutMs()),
                new WireCodec()
        ));
    }

    /**
     * Fetches the run configuration, then runs the kernels until they finish.
     *
     * @return the process exit code
     */
    public int run() {
        RunConfig runConfig;
        try {
            runConfig = client.fetchConfig(Duration.ofMillis(workerConfig.getReplyTimeoutMs()));
        } catch (ConfigurationUnavailableException e) {
            log.error("Cannot start workers without configuration: {}", e.getMessage());
            return EXIT_NO_CONFIG;
        }

        Duration backoff = Duration.ofMillis(workerConfig.getBackoffMs());
        List<Thread> threads = new ArrayList<>();
        for (int i = 0; i < Math.max(1, workerConfig.getCount()); i++) {
            String workerId = "worker-" + i;
            TransportEngine engine = TransportEngineFactory.createOrDefault(runConfig.mcEngine());
            engines.add(engine);
            WorkerKernel kernel = new WorkerKernel(
                    workerId,
                    client,
                    engine,
                    workerConfig.isProbeStatus(),
                    Duration.ofMillis(workerConfig.getReplyTimeoutMs()),
                    workerConfig.getReceiveAttempts()
            );
            Thread thread = new Thread(
                    () -> results.put(workerId, kernel.run(backoff, workerConfig.getMaxConsecutiveFailures())),
                    workerId
            );
            threads.add(thread);
            thread.start();
        }
        log.info("Started {} worker kernels: mcEngine={}", threads.size(), runConfig.mcEngine());

        for (Thread thread : threads) {
            try {
                thread.join();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                threads.forEach(Thread::interrupt);
                break;
            }
        }
        log.info("All worker kernels finished: results={}", results);
        return EXIT_OK;
    }

    public Map<String, KernelResult> getResults() {
        return Map.copyOf(results);
    }

    public List<TransportEngine> getEngines() {
        return List.copyOf(engines);
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : "config.yaml";
        int exitCode;
        try {
            PrimaryServerConfig config = new ConfigLoader(configPath).load();
            exitCode = new WorkerApplication(config.getWorker()).run();
        } catch (ConfigLoader.ConfigurationException e) {
            log.error("Invalid worker configuration", e);
            exitCode = EXIT_NO_CONFIG;
        }
        System.exit(exitCode);
    }
}
