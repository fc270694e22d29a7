package runbroker.coordinator.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import runbroker.coordinator.config.CoordinatorConfig;
import runbroker.coordinator.server.CoordinatorNettyServer;
import org.junit.jupiter.api.*;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end flows through the HTTP API: a runner executes an orchestrator
 * and its child, the orchestrator is resumed with the child's result, and
 * stop and deregistration reach the runner through its poll.
 */
class FullFlowIntegrationTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int TEST_PORT = 18081;
    private static final String BASE_URL = "http://localhost:" + TEST_PORT;

    private HttpClient httpClient;

    @BeforeEach
    void setUp() throws Exception {
        if (CoordinatorNettyServer.isRunning()) {
            CoordinatorNettyServer.stop();
        }

        CoordinatorConfig config = CoordinatorConfig.defaults()
                .withMaxPollWait(Duration.ofSeconds(5))
                .withPollSlice(Duration.ofMillis(200))
                .withPollWorkerThreads(8);

        assertTrue(CoordinatorNettyServer.start(TEST_PORT, config));
        TimeUnit.MILLISECONDS.sleep(200);

        httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    @AfterEach
    void tearDown() {
        CoordinatorNettyServer.stop();
    }

    private HttpRequest getRequest(String path) {
        return HttpRequest.newBuilder().uri(URI.create(BASE_URL + path)).GET().build();
    }

    private JsonNode get(String path) throws Exception {
        HttpResponse<String> response = httpClient.send(getRequest(path), HttpResponse.BodyHandlers.ofString());
        assertEquals(200, response.statusCode(), path + " -> " + response.body());
        return MAPPER.readTree(response.body());
    }

    private JsonNode post(String path, String body) throws Exception {
        HttpResponse<String> response = httpClient.send(
                HttpRequest.newBuilder()
                        .uri(URI.create(BASE_URL + path))
                        .header("Content-Type", "application/json")
                        .POST(HttpRequest.BodyPublishers.ofString(body))
                        .build(),
                HttpResponse.BodyHandlers.ofString());
        assertTrue(response.statusCode() == 200 || response.statusCode() == 201,
                path + " -> " + response.statusCode() + " " + response.body());
        return MAPPER.readTree(response.body());
    }

    private JsonNode poll(String runnerId) throws Exception {
        return get("/internal/v1/runners/poll?runner_id=" + runnerId + "&max_wait=2");
    }

    private void report(String runId, String event, String runnerId, String extra) throws Exception {
        String body = "{\"runner_id\":\"" + runnerId + "\"" + (extra == null ? "" : "," + extra) + "}";
        post("/internal/v1/runs/" + runId + "/" + event, body);
    }

    @Test
    @DisplayName("Child result resumes the parent once the parent is idle")
    void orchestratorIsResumedWithChildResult() throws Exception {
        String runnerId = post("/internal/v1/runners/register", "{\"tags\":[\"python\"]}")
                .get("runner_id").asText();

        // 1. Orchestrator starts
        String parentRunId = post("/api/v1/runs", """
                {"session_name": "orchestrator", "kind": "start", "payload": "plan the work"}
                """).get("run_id").asText();
        JsonNode parentPoll = poll(runnerId);
        assertEquals(parentRunId, parentPoll.get("run").get("run_id").asText());
        report(parentRunId, "started", runnerId, null);

        // 2. It spawns a child that demands the runner's tag
        String childRunId = post("/api/v1/runs", """
                {"session_name": "worker", "kind": "start", "payload": "compute",
                 "parent_session_name": "orchestrator", "demand": {"tags": ["python"]}}
                """).get("run_id").asText();
        JsonNode childPoll = poll(runnerId);
        assertEquals(childRunId, childPoll.get("run").get("run_id").asText());
        report(childRunId, "started", runnerId, null);
        report(childRunId, "completed", runnerId, "\"result\":\"42\"");

        // 3. The orchestrator is still running, so the callback waits
        JsonNode parentSession = get("/api/v1/sessions/orchestrator");
        assertTrue(parentSession.get("busy").asBoolean());
        assertEquals("worker", parentSession.get("pending_notifications").get(0).asText());

        // 4. Orchestrator finishes its turn, the resume appears
        report(parentRunId, "completed", runnerId, null);
        JsonNode resumePoll = poll(runnerId);
        JsonNode resume = resumePoll.get("run");
        assertEquals("RESUME", resume.get("kind").asText());
        assertEquals("orchestrator", resume.get("session_name").asText());
        assertTrue(resume.get("payload").asText().contains("\"worker\" has completed"));
        assertTrue(resume.get("payload").asText().contains("42"));

        JsonNode childRun = get("/api/v1/runs/" + childRunId);
        assertEquals("completed", childRun.get("status").asText());
        assertEquals(runnerId, childRun.get("last_runner_id").asText());
        assertEquals("42", childRun.get("result").asText());
    }

    @Test
    @DisplayName("Parked poll picks up a run submitted while it waits")
    void parkedPollReceivesNewRun() throws Exception {
        String runnerId = post("/internal/v1/runners/register", "{}").get("runner_id").asText();

        CompletableFuture<HttpResponse<String>> pending = httpClient.sendAsync(
                getRequest("/internal/v1/runners/poll?runner_id=" + runnerId + "&max_wait=5"),
                HttpResponse.BodyHandlers.ofString());
        TimeUnit.MILLISECONDS.sleep(300);

        long submittedAt = System.nanoTime();
        String runId = post("/api/v1/runs", """
                {"session_name": "late", "kind": "start", "payload": "p"}
                """).get("run_id").asText();

        HttpResponse<String> response = pending.get(5, TimeUnit.SECONDS);
        long waitedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - submittedAt);

        assertEquals(200, response.statusCode());
        assertEquals(runId, MAPPER.readTree(response.body()).get("run").get("run_id").asText());
        assertTrue(waitedMs < 3000, "poll should return well before its timeout, took " + waitedMs + "ms");
    }

    @Test
    @DisplayName("Stop request is delivered through the runner's poll")
    void stopIsDeliveredThroughPoll() throws Exception {
        String runnerId = post("/internal/v1/runners/register", "{}").get("runner_id").asText();
        String runId = post("/api/v1/runs", """
                {"session_name": "long-job", "kind": "start", "payload": "p"}
                """).get("run_id").asText();
        poll(runnerId);
        report(runId, "started", runnerId, null);

        JsonNode stop = post("/api/v1/runs/" + runId + "/stop", "");
        assertEquals("stopping", stop.get("status").asText());

        JsonNode stopPoll = poll(runnerId);
        assertEquals(runId, stopPoll.get("stop_runs").get(0).asText());
        assertFalse(stopPoll.has("run"));

        report(runId, "stopped", runnerId, null);
        assertEquals("stopped", get("/api/v1/runs/" + runId).get("status").asText());
    }

    @Test
    @DisplayName("Deregistered runner is told so on its next poll")
    void deregistrationReachesRunner() throws Exception {
        String runnerId = post("/internal/v1/runners/register", "{}").get("runner_id").asText();

        post("/internal/v1/runners/deregister", "{\"runner_id\":\"" + runnerId + "\"}");

        JsonNode result = poll(runnerId);
        assertTrue(result.get("deregistered").asBoolean());

        JsonNode runners = get("/api/v1/runners").get("runners");
        assertEquals("DEREGISTERED", runners.get(0).get("status").asText());
    }
}
