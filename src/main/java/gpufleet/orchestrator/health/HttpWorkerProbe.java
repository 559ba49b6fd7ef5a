package gpufleet.orchestrator.health;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Probes real workers over TCP and HTTP.
 */
public class HttpWorkerProbe implements WorkerProbe {

    private static final Logger log = LoggerFactory.getLogger(HttpWorkerProbe.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final HttpClient http;
    private final Duration timeout;

    public HttpWorkerProbe(Duration timeout) {
        this.timeout = timeout;
        this.http = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
    }

    @Override
    public boolean isReachable(String ip, int port) {
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(ip, port), (int) timeout.toMillis());
            return true;
        } catch (IOException e) {
            log.debug("{}:{} not reachable: {}", ip, port, e.getMessage());
            return false;
        }
    }

    @Override
    public boolean isWorkerReady(String ip, int healthPort) {
        try {
            HttpResponse<String> response = get("http://" + ip + ":" + healthPort + "/readyz");
            return response.statusCode() == 200;
        } catch (IOException e) {
            log.debug("Readiness probe on {} failed: {}", ip, e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public boolean isModelLoaded(String ip, int vllmPort, String modelId) {
        try {
            HttpResponse<String> response = get("http://" + ip + ":" + vllmPort + "/v1/models");
            if (response.statusCode() != 200) {
                return false;
            }
            JsonNode data = MAPPER.readTree(response.body()).path("data");
            if (modelId == null || modelId.isBlank()) {
                return data.isArray() && data.size() > 0;
            }
            for (JsonNode model : data) {
                if (modelId.equals(model.path("id").asText())) {
                    return true;
                }
            }
            return false;
        } catch (IOException e) {
            log.debug("Model probe on {} failed: {}", ip, e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private HttpResponse<String> get(String url) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(timeout)
                .GET()
                .build();
        return http.send(request, HttpResponse.BodyHandlers.ofString());
    }
}
