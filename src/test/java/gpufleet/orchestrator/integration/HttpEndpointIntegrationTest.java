package gpufleet.orchestrator.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import gpufleet.orchestrator.FleetFixture;
import gpufleet.orchestrator.model.InstanceStatus;
import gpufleet.orchestrator.scheduler.HealthCheckJob;
import org.junit.jupiter.api.*;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives the HTTP API through a real Netty server on an ephemeral port.
 */
class HttpEndpointIntegrationTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private FleetFixture fleet;
    private HttpClient httpClient;
    private String baseUrl;

    @BeforeEach
    void setUp() {
        fleet = new FleetFixture("test-http");
        fleet.deps.server().start("127.0.0.1", 0);
        baseUrl = "http://127.0.0.1:" + fleet.deps.server().port();

        httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    @AfterEach
    void tearDown() {
        fleet.close();
    }

    @Test
    @DisplayName("Create instance, bring it up, register its worker and route to it")
    void instanceLifecycleOverHttp() throws Exception {
        HttpResponse<String> created = post("/api/v1/instances", """
                {
                  "provider": "mock",
                  "zone": "zone-a",
                  "instance_type": "MOCK-GPU-S",
                  "model_id": "llama"
                }
                """);
        assertEquals(201, created.statusCode(), "Body: " + created.body());
        JsonNode instance = MAPPER.readTree(created.body());
        String id = instance.get("id").asText();
        assertEquals("provisioning", instance.get("status").asText());
        assertEquals(5, instance.get("progress").asInt());

        // Nobody consumes the bus here; run the workflow the dispatcher would run.
        fleet.deps.provisioningService().resume(fleet.reload(id));
        JsonNode booting = getJson("/api/v1/instances/" + id);
        assertEquals("booting", booting.get("status").asText());
        assertTrue(booting.get("progress").asInt() >= 30);
        assertTrue(booting.has("ip_address"));

        HttpResponse<String> noWorker = get("/api/v1/route?model=llama");
        assertEquals(503, noWorker.statusCode());
        assertEquals("5", noWorker.headers().firstValue("Retry-After").orElse(null));

        HttpResponse<String> registered = post("/internal/v1/worker/register", String.format("""
                {"instance_id": "%s", "model_id": "llama", "vllm_port": 8000, "health_port": 8080}
                """, id));
        assertEquals(200, registered.statusCode(), "Body: " + registered.body());
        assertEquals("ok", MAPPER.readTree(registered.body()).get("status").asText());

        HealthCheckJob healthCheck = fleet.healthCheckJob();
        for (int i = 0; i < 3; i++) {
            HttpResponse<String> heartbeat = post("/internal/v1/worker/heartbeat", String.format("""
                    {"instance_id": "%s", "status": "ready", "model_id": "llama", "queue_depth": 1,
                     "gpu_utilization": 35.0}
                    """, id));
            assertEquals(200, heartbeat.statusCode(), "Body: " + heartbeat.body());
            healthCheck.runOnce();
        }
        assertEquals(InstanceStatus.READY, fleet.reload(id).status());

        HttpResponse<String> routed = get("/api/v1/route?model=llama&sticky=session-1");
        assertEquals(200, routed.statusCode(), "Body: " + routed.body());
        JsonNode route = MAPPER.readTree(routed.body());
        assertEquals(id, route.get("instance_id").asText());
        assertEquals(8000, route.get("port").asInt());
        assertEquals("http://" + fleet.reload(id).ipAddress() + ":8000", route.get("base_url").asText());

        assertEquals(503, get("/api/v1/route?model=mistral").statusCode());

        JsonNode history = MAPPER.readTree(get("/api/v1/instances/" + id + "/history").body());
        assertTrue(history.isArray());
        assertEquals("ready", history.get(history.size() - 1).get("to_status").asText());

        JsonNode list = getJson("/api/v1/instances");
        assertEquals(1, list.size());
    }

    @Test
    void commandIsAccepted() throws Exception {
        HttpResponse<String> response = post("/api/v1/commands", """
                {"type": "reconcile"}
                """);

        assertEquals(202, response.statusCode(), "Body: " + response.body());
        JsonNode body = MAPPER.readTree(response.body());
        assertTrue(body.get("accepted").asBoolean());
        assertEquals("RECONCILE", body.get("type").asText());
        assertEquals(0, body.get("delivered").asInt());
    }

    @Test
    void badRequestsAreRejected() throws Exception {
        assertEquals(400, post("/api/v1/instances", "{not json").statusCode());
        assertEquals(400, post("/api/v1/instances", "{\"zone\": \"zone-a\"}").statusCode());
        assertEquals(400, post("/api/v1/commands", "{\"type\": \"reboot\", \"instance_id\": \"i-1\"}").statusCode());
        assertEquals(400, post("/api/v1/commands", "{\"type\": \"terminate\"}").statusCode());
        assertEquals(400, post("/internal/v1/worker/heartbeat",
                "{\"instance_id\": \"i-1\", \"status\": \"ready\", \"gpu_utilization\": 250}").statusCode());
    }

    @Test
    void unknownInstancesAre404() throws Exception {
        assertEquals(404, get("/api/v1/instances/missing").statusCode());
        assertEquals(404, get("/api/v1/instances/missing/history").statusCode());

        HttpResponse<String> heartbeat = post("/internal/v1/worker/heartbeat",
                "{\"instance_id\": \"missing\", \"status\": \"ready\"}");
        assertEquals(404, heartbeat.statusCode());
        assertEquals("instance_not_found", MAPPER.readTree(heartbeat.body()).get("error").asText());
    }

    @Test
    void healthReportsDatabaseAndCounts() throws Exception {
        fleet.readyInstance("llama");

        HttpResponse<String> response = get("/api/v1/health");

        assertEquals(200, response.statusCode(), "Body: " + response.body());
        JsonNode health = MAPPER.readTree(response.body());
        assertEquals("healthy", health.get("status").asText());
        assertEquals(1, health.get("instances").get("ready").asInt());
        assertNotNull(health.get("version"));
    }

    private JsonNode getJson(String path) throws Exception {
        HttpResponse<String> response = get(path);
        assertEquals(200, response.statusCode(), "Body: " + response.body());
        return MAPPER.readTree(response.body());
    }

    private HttpResponse<String> get(String path) throws Exception {
        return httpClient.send(
                HttpRequest.newBuilder().uri(URI.create(baseUrl + path)).GET().build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        return httpClient.send(
                HttpRequest.newBuilder()
                        .uri(URI.create(baseUrl + path))
                        .header("Content-Type", "application/json")
                        .POST(HttpRequest.BodyPublishers.ofString(body))
                        .build(),
                HttpResponse.BodyHandlers.ofString());
    }
}
