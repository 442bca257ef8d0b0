package fr.lapetina.primaryserver.infrastructure.config;

import fr.lapetina.primaryserver.domain.model.RunConfig;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root configuration object for the primary server and its workers.
 * Designed to be populated from YAML.
 */
public class PrimaryServerConfig {

    private ServerConfig server = new ServerConfig();
    private RunSection run = new RunSection();
    private ServiceConfig service = new ServiceConfig();
    private DisruptorConfig disruptor = new DisruptorConfig();
    private WorkerConfig worker = new WorkerConfig();
    private MetricsConfig metrics = new MetricsConfig();

    public ServerConfig getServer() { return server; }
    public void setServer(ServerConfig server) { this.server = server; }

    public RunSection getRun() { return run; }
    public void setRun(RunSection run) { this.run = run; }

    public ServiceConfig getService() { return service; }
    public void setService(ServiceConfig service) { this.service = service; }

    public DisruptorConfig getDisruptor() { return disruptor; }
    public void setDisruptor(DisruptorConfig disruptor) { this.disruptor = disruptor; }

    public WorkerConfig getWorker() { return worker; }
    public void setWorker(WorkerConfig worker) { this.worker = worker; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Work and status channel endpoints. Port 0 binds an ephemeral port.
     */
    public static class ServerConfig {
        private String host = "0.0.0.0";
        private int workPort = 8100;
        private int statusPort = 8101;
        private int backlog = 100;
        private long replyTimeoutMs = 30_000;

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getWorkPort() { return workPort; }
        public void setWorkPort(int workPort) { this.workPort = workPort; }

        public int getStatusPort() { return statusPort; }
        public void setStatusPort(int statusPort) { this.statusPort = statusPort; }

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }

        public long getReplyTimeoutMs() { return replyTimeoutMs; }
        public void setReplyTimeoutMs(long replyTimeoutMs) { this.replyTimeoutMs = replyTimeoutMs; }
    }

    /**
     * Parameters of the first generation cycle.
     */
    public static class RunSection {
        private String generator = "boxgen";
        private String trigger = "";
        private String mcEngine = "accounting";
        private int chunkSize = 500;
        private long seed = -1;
        private int numberOfEvents = 1;
        private String embedIntoFile;
        private String extKinFile;
        private Map<String, Object> generatorOptions = new LinkedHashMap<>();

        public String getGenerator() { return generator; }
        public void setGenerator(String generator) { this.generator = generator; }

        public String getTrigger() { return trigger; }
        public void setTrigger(String trigger) { this.trigger = trigger; }

        public String getMcEngine() { return mcEngine; }
        public void setMcEngine(String mcEngine) { this.mcEngine = mcEngine; }

        public int getChunkSize() { return chunkSize; }
        public void setChunkSize(int chunkSize) { this.chunkSize = chunkSize; }

        public long getSeed() { return seed; }
        public void setSeed(long seed) { this.seed = seed; }

        public int getNumberOfEvents() { return numberOfEvents; }
        public void setNumberOfEvents(int numberOfEvents) { this.numberOfEvents = numberOfEvents; }

        public String getEmbedIntoFile() { return embedIntoFile; }
        public void setEmbedIntoFile(String embedIntoFile) { this.embedIntoFile = embedIntoFile; }

        public String getExtKinFile() { return extKinFile; }
        public void setExtKinFile(String extKinFile) { this.extKinFile = extKinFile; }

        public Map<String, Object> getGeneratorOptions() { return generatorOptions; }
        public void setGeneratorOptions(Map<String, Object> generatorOptions) { this.generatorOptions = generatorOptions; }

        /**
         * Converts this section into the immutable run configuration.
         * YAML scalars in the generator options are kept in their textual form.
         */
        public RunConfig toRunConfig() {
            Map<String, String> options = new LinkedHashMap<>();
            if (generatorOptions != null) {
                generatorOptions.forEach((k, v) -> options.put(k, String.valueOf(v)));
            }
            return RunConfig.builder()
                    .generator(generator)
                    .trigger(trigger)
                    .mcEngine(mcEngine)
                    .chunkSize(chunkSize)
                    .seed(seed)
                    .nEvents(numberOfEvents)
                    .embedIntoFile(embedIntoFile)
                    .extKinFile(extKinFile)
                    .generatorOptions(options)
                    .build();
        }
    }

    /**
     * Service mode and driver side channel.
     */
    public static class ServiceConfig {
        private boolean asService = false;
        private long controlTimeoutMs = 0;
        private String driverPipe;
        private int notificationHistory = 100;

        public boolean isAsService() { return asService; }
        public void setAsService(boolean asService) { this.asService = asService; }

        /**
         * How long an idle service waits for control input; 0 waits forever.
         */
        public long getControlTimeoutMs() { return controlTimeoutMs; }
        public void setControlTimeoutMs(long controlTimeoutMs) { this.controlTimeoutMs = controlTimeoutMs; }

        /**
         * File descriptor number or path of the driver pipe, or null when there is no driver.
         */
        public String getDriverPipe() { return driverPipe; }
        public void setDriverPipe(String driverPipe) { this.driverPipe = driverPipe; }

        public int getNotificationHistory() { return notificationHistory; }
        public void setNotificationHistory(int notificationHistory) { this.notificationHistory = notificationHistory; }
    }

    /**
     * LMAX Disruptor configuration.
     */
    public static class DisruptorConfig {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }
    }

    /**
     * Worker side settings.
     */
    public static class WorkerConfig {
        private String serverUrl = "http://localhost:8100";
        private String statusUrl = "http://localhost:8101";
        private int count = 1;
        private boolean probeStatus = true;
        private long connectTimeoutMs = 5_000;
        private long replyTimeoutMs = 10_000;
        private int receiveAttempts = 3;
        private long backoffMs = 500;
        private int maxConsecutiveFailures = 10;

        public String getServerUrl() { return serverUrl; }
        public void setServerUrl(String serverUrl) { this.serverUrl = serverUrl; }

        public String getStatusUrl() { return statusUrl; }
        public void setStatusUrl(String statusUrl) { this.statusUrl = statusUrl; }

        public int getCount() { return count; }
        public void setCount(int count) { this.count = count; }

        public boolean isProbeStatus() { return probeStatus; }
        public void setProbeStatus(boolean probeStatus) { this.probeStatus = probeStatus; }

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        public long getReplyTimeoutMs() { return replyTimeoutMs; }
        public void setReplyTimeoutMs(long replyTimeoutMs) { this.replyTimeoutMs = replyTimeoutMs; }

        public int getReceiveAttempts() { return receiveAttempts; }
        public void setReceiveAttempts(int receiveAttempts) { this.receiveAttempts = receiveAttempts; }

        public long getBackoffMs() { return backoffMs; }
        public void setBackoffMs(long backoffMs) { this.backoffMs = backoffMs; }

        public int getMaxConsecutiveFailures() { return maxConsecutiveFailures; }
        public void setMaxConsecutiveFailures(int maxConsecutiveFailures) { this.maxConsecutiveFailures = maxConsecutiveFailures; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "primserver";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
