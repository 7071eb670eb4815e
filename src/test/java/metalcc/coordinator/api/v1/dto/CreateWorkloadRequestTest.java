package metalcc.coordinator.api.v1.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import metalcc.coordinator.model.ResourceShape;
import metalcc.coordinator.server.RouterHandler;
import metalcc.coordinator.service.WorkloadSpec;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CreateWorkloadRequestTest {

    private final ObjectMapper mapper = RouterHandler.mapper();

    @Test
    void deserializeAndConvert() throws Exception {
        String json = """
                {
                  "name": "web",
                  "dockerCompose": "services: {}",
                  "envVars": {"MODE": "prod"},
                  "files": {"cfg.txt": "aGVsbG8="},
                  "publicContainerName": "api",
                  "publicContainerPort": 8080,
                  "cpus": 2,
                  "memoryMb": 4096,
                  "diskGb": 40,
                  "gpus": 0
                }
                """;

        CreateWorkloadRequest req = mapper.readValue(json, CreateWorkloadRequest.class);
        assertDoesNotThrow(req::validate);
        assertEquals(new ResourceShape(2, 4096, 40, 0), req.shape());

        WorkloadSpec spec = req.toSpec(mapper);
        assertEquals("web", spec.name());
        assertNull(spec.customDomain());

        JsonNode payload = mapper.readTree(spec.payload());
        assertEquals("services: {}", payload.get("dockerCompose").asText());
        assertEquals("prod", payload.get("envVars").get("MODE").asText());
        assertEquals(8080, payload.get("publicContainerPort").asInt());
        assertTrue(payload.get("dockerCredentials").isArray());
    }

    @Test
    void validation() {
        assertThrows(IllegalArgumentException.class, request("", 8080, null, null)::validate);
        assertThrows(IllegalArgumentException.class, request("web", 0, null, null)::validate);
        assertThrows(IllegalArgumentException.class, request("web", 8080, "not a domain", null)::validate);
        assertThrows(IllegalArgumentException.class,
                request("web", 8080, null, Map.of("x", "!!not base64!!"))::validate);
        assertDoesNotThrow(request("web", 8080, "app.example.com", Map.of("x", "aGVsbG8="))::validate);
    }

    @Test
    void credentialsNeedUserAndPassword() {
        CreateWorkloadRequest req = new CreateWorkloadRequest("web", "services: {}", null, null,
                List.of(new CreateWorkloadRequest.DockerCredentials("ghcr.io", "me", null)),
                "api", 80, null, 1, 1024, 10, 0);
        assertThrows(IllegalArgumentException.class, req::validate);
    }

    private static CreateWorkloadRequest request(String name, int port, String domain, Map<String, String> files) {
        return new CreateWorkloadRequest(name, "services: {}", null, files, null, "api", port, domain, 1, 1024, 10, 0);
    }
}
