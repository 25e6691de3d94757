package openorchestrator.scheduler.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import openorchestrator.scheduler.TestTriggers;
import openorchestrator.scheduler.config.Dependencies;
import openorchestrator.scheduler.config.SchedulerConfig;
import openorchestrator.scheduler.model.Trigger;
import openorchestrator.scheduler.model.TriggerStatus;
import openorchestrator.scheduler.server.RouterHandler;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Hits the operator API through a real Netty server.
 */
class HttpEndpointIntegrationTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int TEST_PORT = 18085;
    private static final String ADMIN_KEY = "let-me-in";
    private static final String BASE_URL = "http://localhost:" + TEST_PORT;

    @TempDir
    Path tmp;

    private Dependencies deps;
    private HttpClient httpClient;

    @BeforeEach
    void setUp() {
        SchedulerConfig config = SchedulerConfig.defaults()
                .withDatabaseUrl(TestTriggers.memoryDbUrl("http"))
                .withMachineName("http-host")
                .withCryptoKey("key")
                .withAdminKey(ADMIN_KEY)
                .withServerPort(TEST_PORT)
                .withTickInterval(Duration.ofMillis(200))
                .withCheckoutRoot(tmp.resolve("repos"));

        deps = Dependencies.create(config);
        deps.startServer();

        httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    @AfterEach
    void tearDown() {
        deps.close();
    }

    private HttpResponse<String> get(String path) throws Exception {
        return httpClient.send(
                HttpRequest.newBuilder().uri(URI.create(BASE_URL + path)).GET().build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body, boolean withKey) throws Exception {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(BASE_URL + path))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body));
        if (withKey) {
            builder.header(RouterHandler.ADMIN_KEY_HEADER, ADMIN_KEY);
        }
        return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void health() throws Exception {
        HttpResponse<String> response = get("/api/v1/health");

        assertEquals(200, response.statusCode(), response.body());
        JsonNode body = MAPPER.readTree(response.body());
        assertEquals("healthy", body.get("status").asText());
        assertEquals("http-host", body.get("machineName").asText());
        assertFalse(body.get("running").asBoolean());
        assertEquals(0, body.get("runningJobs").asInt());
    }

    @Test
    @DisplayName("POST without the admin key is forbidden; GET is open")
    void adminKeyRequiredForPost() throws Exception {
        assertEquals(403, post("/api/v1/scheduler/run", "", false).statusCode());
        assertFalse(deps.loop().mode().isRunning());
        assertEquals(200, get("/api/v1/scheduler").statusCode());
    }

    @Test
    @DisplayName("Run, exclusive and pause switches")
    void schedulerSwitches() throws Exception {
        HttpResponse<String> run = post("/api/v1/scheduler/run", "", true);
        assertEquals(200, run.statusCode(), run.body());
        assertTrue(deps.loop().mode().isRunning());

        HttpResponse<String> exclusive = post("/api/v1/scheduler/exclusive", "{\"enabled\":true}", true);
        assertEquals(200, exclusive.statusCode(), exclusive.body());

        JsonNode status = MAPPER.readTree(get("/api/v1/scheduler").body());
        assertEquals("http-host", status.get("machineName").asText());
        assertTrue(status.get("running").asBoolean());
        assertTrue(status.get("exclusive").asBoolean());
        assertEquals(0, status.get("jobs").size());

        assertEquals(200, post("/api/v1/scheduler/pause", "", true).statusCode());
        assertFalse(deps.loop().mode().isRunning());
    }

    @Test
    void exclusiveRequiresBody() throws Exception {
        assertEquals(400, post("/api/v1/scheduler/exclusive", "", true).statusCode());
        assertEquals(400, post("/api/v1/scheduler/exclusive", "{}", true).statusCode());
    }

    @Test
    void triggerListPauseResume() throws Exception {
        Trigger trigger = TestTriggers.single("later", Instant.now().plusSeconds(3600)).build();
        deps.triggerRepository().save(trigger);

        JsonNode list = MAPPER.readTree(get("/api/v1/triggers").body());
        assertEquals(1, list.size());
        assertEquals("later", list.get(0).get("name").asText());
        assertEquals("SINGLE", list.get(0).get("type").asText());

        HttpResponse<String> pause = post("/api/v1/triggers/" + trigger.id() + "/pause", "", true);
        assertEquals(200, pause.statusCode(), pause.body());
        assertEquals("PAUSED", MAPPER.readTree(pause.body()).get("status").asText());
        assertEquals(409, post("/api/v1/triggers/" + trigger.id() + "/pause", "", true).statusCode());

        assertEquals(200, post("/api/v1/triggers/" + trigger.id() + "/resume", "", true).statusCode());
        assertEquals(TriggerStatus.IDLE, deps.triggerRepository().findById(trigger.id()).orElseThrow().status());

        assertEquals(404, post("/api/v1/triggers/missing/pause", "", true).statusCode());
    }

    @Test
    void killUnknownJob() throws Exception {
        assertEquals(404, post("/api/v1/jobs/not-running/kill", "", true).statusCode());
    }

    @Test
    void unknownPath() throws Exception {
        assertEquals(404, get("/api/v1/nothing-here").statusCode());
    }
}
