package fr.lapetina.primaryserver.infrastructure.http;

import fr.lapetina.primaryserver.domain.model.LifecycleState;
import fr.lapetina.primaryserver.domain.model.RequestToken;
import fr.lapetina.primaryserver.domain.model.RunConfig;
import fr.lapetina.primaryserver.infrastructure.codec.WireCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Worker side of the work and status channels.
 *
 * Uses java.net.http.HttpClient; work requests are sent asynchronously so that
 * the caller controls how long it waits for the reply.
 */
public class PrimaryServerClient {

    private static final Logger log = LoggerFactory.getLogger(PrimaryServerClient.class);

    private final HttpClient httpClient;
    private final WireCodec codec;
    private final URI workUri;
    private final URI statusUri;

    public PrimaryServerClient(String serverUrl, String statusUrl, Duration connectTimeout, WireCodec codec) {
        this.codec = codec;
        this.workUri = resolve(serverUrl, "primary-get");
        this.statusUri = resolve(statusUrl, "primary-status");
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    /**
     * Raw work channel reply.
     */
    public record WireReply(int statusCode, byte[] body) {
        public boolean isOk() {
            return statusCode == 200;
        }
    }

    /**
     * Sends a work request. The future fails if the request cannot be sent.
     */
    public CompletableFuture<WireReply> requestWork() {
        return send(RequestToken.WORK_REQUEST);
    }

    private CompletableFuture<WireReply> send(RequestToken token) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(workUri)
                .header("Content-Type", "text/plain")
                .POST(HttpRequest.BodyPublishers.ofString(token.getWireValue()))
                .build();
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray())
                .thenApply(response -> new WireReply(response.statusCode(), response.body()));
    }

    /**
     * Asks the status channel for the server state.
     *
     * @return the state, or empty if the server did not answer or sent an unknown code
     */
    public Optional<LifecycleState> probeStatus(Duration timeout) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(statusUri)
                .timeout(timeout)
                .GET()
                .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                log.debug("Status probe failed: status={}", response.statusCode());
                return Optional.empty();
            }
            return LifecycleState.fromCode(Integer.parseInt(response.body().trim()));
        } catch (IOException | NumberFormatException e) {
            log.debug("Status probe failed: {}", e.toString());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    /**
     * One-shot configuration round trip.
     *
     * @throws ConfigurationUnavailableException on send failure, timeout or an undecodable reply
     */
    public RunConfig fetchConfig(Duration timeout) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(workUri)
                .timeout(timeout)
                .header("Content-Type", "text/plain")
                .POST(HttpRequest.BodyPublishers.ofString(RequestToken.CONFIG_REQUEST.getWireValue()))
                .build();
        HttpResponse<byte[]> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (IOException e) {
            throw new ConfigurationUnavailableException("Config request to " + workUri + " failed: " + e, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConfigurationUnavailableException("Interrupted while fetching configuration", e);
        }
        if (response.statusCode() != 200) {
            throw new ConfigurationUnavailableException("Config request rejected: status=" + response.statusCode());
        }
        try {
            RunConfig config = codec.decodeRunConfig(response.body());
            log.info("Configuration received: generator={}, mcEngine={}, nEvents={}",
                    config.generator(), config.mcEngine(), config.nEvents());
            return config;
        } catch (RuntimeException e) {
            throw new ConfigurationUnavailableException("Undecodable configuration reply: " + e.getMessage(), e);
        }
    }

    public WireCodec getCodec() {
        return codec;
    }

    private static URI resolve(String base, String path) {
        String normalized = base.endsWith("/") ? base : base + "/";
        return URI.create(normalized).resolve(path);
    }
}
