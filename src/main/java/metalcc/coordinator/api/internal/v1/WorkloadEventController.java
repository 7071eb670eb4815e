package metalcc.coordinator.api.internal.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import metalcc.coordinator.api.Controller;
import metalcc.coordinator.api.internal.v1.dto.OperationResponse;
import metalcc.coordinator.api.internal.v1.dto.SubmitEventRequest;
import metalcc.coordinator.model.WorkloadStatus;
import metalcc.coordinator.service.WorkloadService;

/**
 * Workload events reported by node agents.
 * POST /internal/v1/workloads/events
 */
public class WorkloadEventController implements Controller {

    private final WorkloadService workloadService;

    public WorkloadEventController(WorkloadService workloadService) {
        this.workloadService = workloadService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.POST) && "/internal/v1/workloads/events".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        SubmitEventRequest request = readBody(req, SubmitEventRequest.class);
        request.validate();

        WorkloadStatus status = workloadService.submitEvent(
                request.nodeId(),
                request.workloadId(),
                request.eventKind(),
                request.detail(),
                request.timestamp());
        return ControllerResponse.ok(OperationResponse.withStatus(status.wireName()));
    }
}
