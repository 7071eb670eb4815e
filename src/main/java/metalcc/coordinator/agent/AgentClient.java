package metalcc.coordinator.agent;

import metalcc.coordinator.model.Node;
import metalcc.coordinator.model.Workload;

import java.util.List;

/**
 * Remote agent running on each node. Every call is blocking I/O; failures are
 * reported as {@link AgentRequestException}.
 */
public interface AgentClient {

    /**
     * Provision the workload's VM and containers on the node.
     */
    void createWorkload(Node node, Workload workload);

    /**
     * Tear down the workload. An agent that doesn't know the workload counts as success.
     */
    void deleteWorkload(Node node, String workloadId);

    void startWorkload(Node node, String workloadId);

    void stopWorkload(Node node, String workloadId);

    void restartWorkload(Node node, String workloadId);

    List<Container> listContainers(Node node, String workloadId);

    List<String> containerLogs(Node node, String workloadId, ContainerLogsRequest request);

    List<String> systemLogs(Node node, String workloadId, SystemLogsRequest request);

    SystemStats systemStats(Node node, String workloadId);
}
