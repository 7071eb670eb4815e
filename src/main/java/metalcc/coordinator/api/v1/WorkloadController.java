package metalcc.coordinator.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import metalcc.coordinator.agent.ContainerLogsRequest;
import metalcc.coordinator.agent.SystemLogsRequest;
import metalcc.coordinator.api.Controller;
import metalcc.coordinator.api.internal.v1.dto.OperationResponse;
import metalcc.coordinator.api.v1.dto.CreateWorkloadRequest;
import metalcc.coordinator.api.v1.dto.LogLinesResponse;
import metalcc.coordinator.api.v1.dto.WorkloadEventResponse;
import metalcc.coordinator.api.v1.dto.WorkloadResponse;
import metalcc.coordinator.model.Account;
import metalcc.coordinator.model.Workload;
import metalcc.coordinator.server.RouterHandler;
import metalcc.coordinator.service.NodeCapacityRegistry;
import metalcc.coordinator.service.WorkloadService;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for tenant workloads (public API).
 *
 * POST   /api/v1/workloads                          - Create a workload
 * GET    /api/v1/workloads                          - List own workloads
 * GET    /api/v1/workloads/{id}                     - Read a workload
 * DELETE /api/v1/workloads/{id}                     - Delete a workload
 * POST   /api/v1/workloads/{id}/start|stop|restart  - Lifecycle actions
 * GET    /api/v1/workloads/{id}/events              - Event log
 * GET    /api/v1/workloads/{id}/containers          - Containers
 * GET    /api/v1/workloads/{id}/containers/logs     - Container logs
 * GET    /api/v1/workloads/{id}/system/logs         - System logs
 * GET    /api/v1/workloads/{id}/system/stats        - System stats
 */
public class WorkloadController implements Controller {

    private static final Pattern WORKLOADS_PATTERN = Pattern.compile("^/api/v1/workloads$");
    private static final Pattern WORKLOAD_BY_ID_PATTERN = Pattern.compile("^/api/v1/workloads/([^/]+)$");
    private static final Pattern ACTION_PATTERN = Pattern.compile("^/api/v1/workloads/([^/]+)/(start|stop|restart)$");
    private static final Pattern RESOURCE_PATTERN = Pattern.compile(
            "^/api/v1/workloads/([^/]+)/(events|containers|containers/logs|system/logs|system/stats)$");

    private final ApiKeyAuthenticator authenticator;
    private final WorkloadService workloadService;
    private final NodeCapacityRegistry registry;

    public WorkloadController(ApiKeyAuthenticator authenticator, WorkloadService workloadService,
            NodeCapacityRegistry registry) {
        this.authenticator = authenticator;
        this.workloadService = workloadService;
        this.registry = registry;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return WORKLOADS_PATTERN.matcher(path).matches() || ACTION_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.GET)) {
            return WORKLOADS_PATTERN.matcher(path).matches()
                    || WORKLOAD_BY_ID_PATTERN.matcher(path).matches()
                    || RESOURCE_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.DELETE)) {
            return WORKLOAD_BY_ID_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        Account account = authenticator.authenticate(req);
        HttpMethod method = req.method();

        if (WORKLOADS_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.POST)
                    ? handleCreate(req, account)
                    : ControllerResponse.ok(workloadService.list(account).stream().map(this::toResponse).toList());
        }

        Matcher actionMatcher = ACTION_PATTERN.matcher(path);
        if (actionMatcher.matches()) {
            String workloadId = actionMatcher.group(1);
            switch (actionMatcher.group(2)) {
                case "start" -> workloadService.start(account, workloadId);
                case "stop" -> workloadService.stop(account, workloadId);
                default -> workloadService.restart(account, workloadId);
            }
            return ControllerResponse.ok(OperationResponse.success());
        }

        Matcher resourceMatcher = RESOURCE_PATTERN.matcher(path);
        if (resourceMatcher.matches()) {
            return handleResource(req, account, resourceMatcher.group(1), resourceMatcher.group(2));
        }

        Matcher idMatcher = WORKLOAD_BY_ID_PATTERN.matcher(path);
        idMatcher.matches();
        String workloadId = idMatcher.group(1);
        if (method.equals(HttpMethod.DELETE)) {
            workloadService.delete(account, workloadId);
            return ControllerResponse.ok(OperationResponse.success());
        }
        return ControllerResponse.ok(toResponse(workloadService.read(account, workloadId)));
    }

    private ControllerResponse handleCreate(FullHttpRequest req, Account account) throws Exception {
        CreateWorkloadRequest request = readBody(req, CreateWorkloadRequest.class);
        request.validate();

        Workload workload = workloadService.create(account, request.toSpec(RouterHandler.mapper()));
        return ControllerResponse.created(toResponse(workload));
    }

    private ControllerResponse handleResource(FullHttpRequest req, Account account, String workloadId,
            String resource) throws Exception {
        return switch (resource) {
            case "events" -> ControllerResponse.ok(workloadService.listEvents(account, workloadId).stream()
                    .map(WorkloadEventResponse::from)
                    .toList());
            case "containers" -> ControllerResponse.ok(workloadService.containers(account, workloadId));
            case "containers/logs" -> ControllerResponse.ok(new LogLinesResponse(
                    workloadService.containerLogs(account, workloadId, containerLogsRequest(req))));
            case "system/logs" -> ControllerResponse.ok(new LogLinesResponse(
                    workloadService.systemLogs(account, workloadId, systemLogsRequest(req))));
            default -> ControllerResponse.ok(workloadService.systemStats(account, workloadId));
        };
    }

    private ContainerLogsRequest containerLogsRequest(FullHttpRequest req) {
        String stream = queryParam(req, "stream", "stdout");
        ContainerLogsRequest.OutputStream outputStream = switch (stream) {
            case "stdout" -> ContainerLogsRequest.OutputStream.STDOUT;
            case "stderr" -> ContainerLogsRequest.OutputStream.STDERR;
            default -> throw new IllegalArgumentException("stream must be stdout or stderr");
        };
        return new ContainerLogsRequest(
                queryParam(req, "container", null),
                Boolean.parseBoolean(queryParam(req, "tail", "true")),
                outputStream,
                parseMaxLines(req));
    }

    private SystemLogsRequest systemLogsRequest(FullHttpRequest req) {
        return new SystemLogsRequest(
                SystemLogsRequest.Source.CVM_AGENT,
                Boolean.parseBoolean(queryParam(req, "tail", "true")),
                parseMaxLines(req));
    }

    private int parseMaxLines(FullHttpRequest req) {
        String value = queryParam(req, "maxLines", String.valueOf(ContainerLogsRequest.MAX_LINES));
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("maxLines must be a number");
        }
    }

    private WorkloadResponse toResponse(Workload workload) {
        return WorkloadResponse.from(workload, registry.nodeDomain(workload.nodeId()));
    }
}
