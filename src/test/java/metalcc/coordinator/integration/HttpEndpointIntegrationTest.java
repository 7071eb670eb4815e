package metalcc.coordinator.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import metalcc.coordinator.config.CoordinatorConfig;
import metalcc.coordinator.server.CoordinatorServer;
import metalcc.coordinator.server.RouterHandler;
import metalcc.coordinator.testing.TestContext;
import org.junit.jupiter.api.*;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test that hits actual HTTP endpoints through the Netty server.
 */
class HttpEndpointIntegrationTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String ADMIN_KEY = "admin-key";
    private static final String NODE_KEY = "node-key";

    private TestContext ctx;
    private String baseUrl;
    private HttpClient httpClient;

    @BeforeEach
    void setUp() {
        CoordinatorConfig config = TestContext.baseConfig()
                .withAdminApiKey(ADMIN_KEY)
                .withNodeApiKey(NODE_KEY);
        ctx = TestContext.create(config);

        CoordinatorServer server = ctx.deps.server();
        server.start();
        baseUrl = "http://localhost:" + server.boundPort();

        httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    @AfterEach
    void tearDown() {
        ctx.close();
    }

    @Test
    @DisplayName("Full HTTP flow: account, tier, node, workload, events, metering, delete")
    void fullWorkloadLifecycle() throws Exception {
        // 1. Admin creates an account and a tier
        HttpResponse<String> accountResponse = send("POST", "/admin/v1/accounts",
                "{\"name\":\"acme\",\"credits\":5}", RouterHandler.ADMIN_KEY_HEADER, ADMIN_KEY);
        assertEquals(201, accountResponse.statusCode(), accountResponse.body());
        String apiToken = MAPPER.readTree(accountResponse.body()).get("apiToken").asText();

        HttpResponse<String> tierResponse = send("POST", "/admin/v1/tiers",
                "{\"name\":\"small\",\"cpus\":1,\"memoryMb\":1024,\"diskGb\":10,\"gpus\":0,\"cost\":1}",
                RouterHandler.ADMIN_KEY_HEADER, ADMIN_KEY);
        assertEquals(201, tierResponse.statusCode(), tierResponse.body());

        // 2. A node registers
        HttpResponse<String> registerResponse = send("POST", "/internal/v1/nodes/register", """
                {
                  "nodeId": "node-1",
                  "hostname": "metal-1",
                  "publicIp": "203.0.113.7",
                  "token": "agent-token",
                  "agentVersion": "0.4.2",
                  "cpus": {"total": 8, "reserved": 1},
                  "memoryMb": {"total": 16384, "reserved": 1024},
                  "diskGb": {"total": 200, "reserved": 10},
                  "gpus": 0
                }
                """, RouterHandler.NODE_KEY_HEADER, NODE_KEY);
        assertEquals(200, registerResponse.statusCode(), registerResponse.body());

        // 3. The tenant creates a workload
        HttpResponse<String> createResponse = send("POST", "/api/v1/workloads", """
                {
                  "name": "web",
                  "dockerCompose": "services: {}",
                  "publicContainerName": "api",
                  "publicContainerPort": 80,
                  "cpus": 1,
                  "memoryMb": 1024,
                  "diskGb": 10,
                  "gpus": 0
                }
                """, "X-Api-Key", apiToken);
        assertEquals(201, createResponse.statusCode(), createResponse.body());
        JsonNode workload = MAPPER.readTree(createResponse.body());
        String workloadId = workload.get("id").asText();
        assertEquals("node-1", workload.get("nodeId").asText());
        assertEquals("scheduled", workload.get("status").asText());
        assertEquals(1, workload.get("creditRate").asLong());

        // 4. The node reports progress
        HttpResponse<String> eventResponse = send("POST", "/internal/v1/workloads/events",
                "{\"nodeId\":\"node-1\",\"workloadId\":\"" + workloadId + "\",\"kind\":\"running\"}",
                RouterHandler.NODE_KEY_HEADER, NODE_KEY);
        assertEquals(200, eventResponse.statusCode(), eventResponse.body());
        assertEquals("running", MAPPER.readTree(eventResponse.body()).get("status").asText());

        JsonNode read = MAPPER.readTree(send("GET", "/api/v1/workloads/" + workloadId, null, "X-Api-Key", apiToken).body());
        assertEquals("running", read.get("status").asText());

        JsonNode events = MAPPER.readTree(
                send("GET", "/api/v1/workloads/" + workloadId + "/events", null, "X-Api-Key", apiToken).body());
        assertEquals(2, events.size());
        assertEquals("created", events.get(0).get("kind").asText());

        JsonNode account = MAPPER.readTree(send("GET", "/api/v1/account", null, "X-Api-Key", apiToken).body());
        assertEquals(1, account.get("creditRate").asLong());

        // 5. Metering drains the account and stops the workload
        for (int i = 0; i < 5; i++) {
            ctx.deps.scheduler().meteringTask().runOnce();
        }
        read = MAPPER.readTree(send("GET", "/api/v1/workloads/" + workloadId, null, "X-Api-Key", apiToken).body());
        assertEquals("stopped", read.get("status").asText());

        // 6. Delete
        HttpResponse<String> deleteResponse = send("DELETE", "/api/v1/workloads/" + workloadId, null,
                "X-Api-Key", apiToken);
        assertEquals(200, deleteResponse.statusCode(), deleteResponse.body());
        assertEquals(404, send("GET", "/api/v1/workloads/" + workloadId, null, "X-Api-Key", apiToken).statusCode());
    }

    @Test
    void healthIsPublic() throws Exception {
        HttpResponse<String> response = send("GET", "/api/v1/health", null, null, null);
        assertEquals(200, response.statusCode());
        assertEquals("healthy", MAPPER.readTree(response.body()).get("status").asText());
    }

    @Test
    void sharedKeysAreEnforced() throws Exception {
        HttpResponse<String> noAdminKey = send("GET", "/admin/v1/accounts", null, null, null);
        assertEquals(403, noAdminKey.statusCode());
        assertEquals("FORBIDDEN", MAPPER.readTree(noAdminKey.body()).get("error").asText());

        HttpResponse<String> wrongNodeKey = send("POST", "/internal/v1/nodes/heartbeat",
                "{\"nodeId\":\"node-1\"}", RouterHandler.NODE_KEY_HEADER, "wrong");
        assertEquals(403, wrongNodeKey.statusCode());
    }

    @Test
    void tenantsNeedValidApiKey() throws Exception {
        HttpResponse<String> missing = send("GET", "/api/v1/workloads", null, null, null);
        assertEquals(401, missing.statusCode());
        assertEquals("ACCESS_DENIED", MAPPER.readTree(missing.body()).get("error").asText());

        assertEquals(401, send("GET", "/api/v1/workloads", null, "X-Api-Key", "bogus").statusCode());
    }

    @Test
    void errorsMapToStatusCodes() throws Exception {
        HttpResponse<String> unknownNode = send("POST", "/internal/v1/nodes/heartbeat",
                "{\"nodeId\":\"ghost\"}", RouterHandler.NODE_KEY_HEADER, NODE_KEY);
        assertEquals(404, unknownNode.statusCode());
        assertEquals("NOT_FOUND", MAPPER.readTree(unknownNode.body()).get("error").asText());

        HttpResponse<String> malformed = send("POST", "/admin/v1/tiers", "{not json",
                RouterHandler.ADMIN_KEY_HEADER, ADMIN_KEY);
        assertEquals(400, malformed.statusCode());
        assertEquals("VALIDATION_ERROR", MAPPER.readTree(malformed.body()).get("error").asText());

        assertEquals(404, send("GET", "/api/v1/nope", null, null, null).statusCode());
    }

    @Test
    void workloadWithoutTierOrCapacity() throws Exception {
        HttpResponse<String> accountResponse = send("POST", "/admin/v1/accounts",
                "{\"name\":\"acme\",\"credits\":100}", RouterHandler.ADMIN_KEY_HEADER, ADMIN_KEY);
        String apiToken = MAPPER.readTree(accountResponse.body()).get("apiToken").asText();
        String body = """
                {"name":"web","dockerCompose":"services: {}","publicContainerName":"api",
                 "publicContainerPort":80,"cpus":1,"memoryMb":1024,"diskGb":10,"gpus":0}
                """;

        HttpResponse<String> noTier = send("POST", "/api/v1/workloads", body, "X-Api-Key", apiToken);
        assertEquals(400, noTier.statusCode());
        assertEquals("INVALID_TIER", MAPPER.readTree(noTier.body()).get("error").asText());

        send("POST", "/admin/v1/tiers",
                "{\"name\":\"small\",\"cpus\":1,\"memoryMb\":1024,\"diskGb\":10,\"gpus\":0,\"cost\":1}",
                RouterHandler.ADMIN_KEY_HEADER, ADMIN_KEY);
        HttpResponse<String> noNode = send("POST", "/api/v1/workloads", body, "X-Api-Key", apiToken);
        assertEquals(503, noNode.statusCode());
        assertEquals("NO_CAPACITY_AVAILABLE", MAPPER.readTree(noNode.body()).get("error").asText());
    }

    private HttpResponse<String> send(String method, String path, String body, String header, String value)
            throws Exception {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(Duration.ofSeconds(10))
                .header("Content-Type", "application/json")
                .method(method, body == null
                        ? HttpRequest.BodyPublishers.noBody()
                        : HttpRequest.BodyPublishers.ofString(body));
        if (header != null) {
            builder.header(header, value);
        }
        return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    }
}
