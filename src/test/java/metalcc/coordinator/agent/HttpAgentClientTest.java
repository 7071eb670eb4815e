package metalcc.coordinator.agent;

import metalcc.coordinator.model.Node;
import metalcc.coordinator.model.ResourceShape;
import metalcc.coordinator.server.RouterHandler;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class HttpAgentClientTest {

    private static final Node NODE = Node.builder()
            .id("node-1")
            .hostname("metal-1")
            .publicIp("203.0.113.7")
            .token("agent-token")
            .total(new ResourceShape(8, 16384, 200, 0))
            .reserved(ResourceShape.ZERO)
            .build();

    @Test
    void nodesAreAddressedByDomain() {
        HttpAgentClient client = new HttpAgentClient(RouterHandler.mapper(), "https", "agents.example.com", 443,
                Duration.ofSeconds(1));
        assertEquals("https://node-1.agents.example.com:443", client.baseUrl(NODE));
    }

    @Test
    void unreachableNodeIsUnavailable() {
        HttpAgentClient client = new HttpAgentClient(RouterHandler.mapper(), "http", "invalid", 9,
                Duration.ofSeconds(2));

        AgentRequestException e = assertThrows(AgentRequestException.class,
                () -> client.stopWorkload(NODE, "w-1"));
        assertEquals(AgentRequestException.UNAVAILABLE, e.errorKind());
        assertEquals(0, e.statusCode());
    }

    @Test
    void logRequestValidation() {
        assertDoesNotThrow(new ContainerLogsRequest("api", false, ContainerLogsRequest.OutputStream.STDERR, 1000)::validate);
        assertThrows(IllegalArgumentException.class,
                new ContainerLogsRequest(" ", false, ContainerLogsRequest.OutputStream.STDERR, 10)::validate);
        assertThrows(IllegalArgumentException.class,
                new SystemLogsRequest(SystemLogsRequest.Source.CVM_AGENT, true, 0)::validate);
    }
}
