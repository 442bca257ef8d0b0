package fr.lapetina.primaryserver;

import fr.lapetina.primaryserver.infrastructure.config.ConfigLoader;
import fr.lapetina.primaryserver.infrastructure.config.PrimaryServerConfig;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Server on ephemeral loopback ports, configured from test-config.yaml.
 */
public class TestServerFactory extends ServerFactory {

    private final HttpClient httpClient = HttpClient.newHttpClient();

    private TestServerFactory(PrimaryServerConfig config) {
        super(config);
    }

    public static TestServerFactory create(Consumer<PrimaryServerConfig> customizer) {
        PrimaryServerConfig config = new ConfigLoader("test-config.yaml", Map.of()).load();
        customizer.accept(config);
        return new TestServerFactory(config);
    }

    public String workUrl() {
        return "http://127.0.0.1:" + getWorkPort();
    }

    public String statusUrl() {
        return "http://127.0.0.1:" + getStatusPort();
    }

    public HttpResponse<String> post(String path, String body) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(URI.create(workUrl() + path))
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    public HttpResponse<String> getWork(String path) throws IOException, InterruptedException {
        return get(workUrl() + path);
    }

    public HttpResponse<String> getStatus(String path) throws IOException, InterruptedException {
        return get(statusUrl() + path);
    }

    private HttpResponse<String> get(String url) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(URI.create(url)).GET().build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }
}
