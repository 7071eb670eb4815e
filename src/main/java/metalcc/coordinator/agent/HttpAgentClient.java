package metalcc.coordinator.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import metalcc.coordinator.model.Node;
import metalcc.coordinator.model.Workload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * JSON-over-HTTP client for node agents.
 * A node is addressed as {@code <scheme>://<nodeId>.<nodesDomain>:<port>} and
 * authenticated with its bearer token.
 */
public class HttpAgentClient implements AgentClient {

    private static final Logger log = LoggerFactory.getLogger(HttpAgentClient.class);

    private static final TypeReference<List<Container>> CONTAINERS = new TypeReference<>() {
    };

    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final String scheme;
    private final String nodesDomain;
    private final int port;
    private final Duration timeout;

    public HttpAgentClient(ObjectMapper mapper, String scheme, String nodesDomain, int port, Duration timeout) {
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        this.mapper = mapper;
        this.scheme = scheme;
        this.nodesDomain = nodesDomain;
        this.port = port;
        this.timeout = timeout;
    }

    @Override
    public void createWorkload(Node node, Workload workload) {
        ObjectNode body = readPayload(workload);
        body.put("id", workload.id());
        body.put("cpus", workload.shape().cpus());
        body.put("memoryMb", workload.shape().memoryMb());
        body.put("diskSpaceGb", workload.shape().diskGb());
        body.put("gpus", workload.shape().gpus());
        body.put("domain", workload.domain());
        post(node, "/api/v1/workloads/create", body);
        log.info("Agent on node {} accepted workload {}", node.id(), workload.id());
    }

    @Override
    public void deleteWorkload(Node node, String workloadId) {
        try {
            post(node, "/api/v1/workloads/delete", Map.of("id", workloadId));
        } catch (AgentRequestException e) {
            if (e.statusCode() != 404) {
                throw e;
            }
            log.debug("Workload {} already gone from node {}", workloadId, node.id());
        }
    }

    @Override
    public void startWorkload(Node node, String workloadId) {
        post(node, "/api/v1/workloads/start", Map.of("id", workloadId));
    }

    @Override
    public void stopWorkload(Node node, String workloadId) {
        post(node, "/api/v1/workloads/stop", Map.of("id", workloadId));
    }

    @Override
    public void restartWorkload(Node node, String workloadId) {
        post(node, "/api/v1/workloads/restart", Map.of("id", workloadId));
    }

    @Override
    public List<Container> listContainers(Node node, String workloadId) {
        String body = get(node, "/api/v1/workloads/" + workloadId + "/containers/list");
        try {
            return mapper.readValue(body, CONTAINERS);
        } catch (JsonProcessingException e) {
            throw malformed(node, e);
        }
    }

    @Override
    public List<String> containerLogs(Node node, String workloadId, ContainerLogsRequest request) {
        String query = query(Map.of(
                "container", request.container(),
                "tail", String.valueOf(request.tail()),
                "stream", request.stream().name().toLowerCase(),
                "max_lines", String.valueOf(request.maxLines())));
        return readLines(node, get(node, "/api/v1/workloads/" + workloadId + "/containers/logs?" + query));
    }

    @Override
    public List<String> systemLogs(Node node, String workloadId, SystemLogsRequest request) {
        String query = query(Map.of(
                "source", "cvm-agent",
                "tail", String.valueOf(request.tail()),
                "max_lines", String.valueOf(request.maxLines())));
        return readLines(node, get(node, "/api/v1/workloads/" + workloadId + "/system/logs?" + query));
    }

    @Override
    public SystemStats systemStats(Node node, String workloadId) {
        String body = get(node, "/api/v1/workloads/" + workloadId + "/system/stats");
        try {
            return mapper.readValue(body, SystemStats.class);
        } catch (JsonProcessingException e) {
            throw malformed(node, e);
        }
    }

    // ---- transport ----

    private void post(Node node, String path, Object request) {
        String json;
        try {
            json = mapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize agent request", e);
        }
        HttpRequest httpRequest = baseRequest(node, path)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json))
                .build();
        send(node, httpRequest);
    }

    private String get(Node node, String path) {
        return send(node, baseRequest(node, path).GET().build());
    }

    private HttpRequest.Builder baseRequest(Node node, String path) {
        return HttpRequest.newBuilder()
                .uri(URI.create(baseUrl(node) + path))
                .timeout(timeout)
                .header("Authorization", "Bearer " + node.token())
                .header("Accept", "application/json");
    }

    String baseUrl(Node node) {
        return scheme + "://" + node.id() + "." + nodesDomain + ":" + port;
    }

    private String send(Node node, HttpRequest request) {
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new AgentRequestException(AgentRequestException.UNAVAILABLE, 0,
                    "node " + node.id() + " unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AgentRequestException(AgentRequestException.UNAVAILABLE, 0,
                    "interrupted calling node " + node.id(), e);
        }

        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            return response.body();
        }
        throw toError(status, response.body());
    }

    /**
     * Agent error bodies look like {@code {"message": "...", "error_code": "DomainExists"}}.
     */
    private AgentRequestException toError(int status, String body) {
        String kind = AgentRequestException.UNAVAILABLE;
        String message = "HTTP " + status;
        try {
            JsonNode node = mapper.readTree(body);
            if (node != null && node.hasNonNull("error_code")) {
                kind = node.get("error_code").asText();
            }
            if (node != null && node.hasNonNull("message")) {
                message = node.get("message").asText();
            }
        } catch (JsonProcessingException e) {
            log.debug("Agent returned non-JSON error body (HTTP {})", status);
        }
        return new AgentRequestException(kind, status, message);
    }

    private List<String> readLines(Node node, String body) {
        try {
            JsonNode root = mapper.readTree(body);
            JsonNode lines = root.has("lines") ? root.get("lines") : root;
            return mapper.convertValue(lines, new TypeReference<List<String>>() {
            });
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw malformed(node, e);
        }
    }

    private ObjectNode readPayload(Workload workload) {
        try {
            JsonNode payload = mapper.readTree(workload.payload());
            return payload instanceof ObjectNode object ? object.deepCopy() : mapper.createObjectNode();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored payload of workload " + workload.id() + " is not JSON", e);
        }
    }

    private static AgentRequestException malformed(Node node, Exception e) {
        return new AgentRequestException(AgentRequestException.UNAVAILABLE, 200,
                "malformed response from node " + node.id() + ": " + e.getMessage(), e);
    }

    private static String query(Map<String, String> params) {
        return params.entrySet().stream()
                .map(e -> e.getKey() + "=" + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
    }
}
