package metalcc.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import metalcc.coordinator.model.ResourceShape;
import metalcc.coordinator.service.WorkloadSpec;

import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Request DTO for creating a workload.
 * POST /api/v1/workloads
 */
public record CreateWorkloadRequest(
        @JsonProperty("name") String name,
        @JsonProperty("dockerCompose") String dockerCompose,
        @JsonProperty("envVars") Map<String, String> envVars,
        @JsonProperty("files") Map<String, String> files,
        @JsonProperty("dockerCredentials") List<DockerCredentials> dockerCredentials,
        @JsonProperty("publicContainerName") String publicContainerName,
        @JsonProperty("publicContainerPort") int publicContainerPort,
        @JsonProperty("domain") String domain,
        @JsonProperty("cpus") int cpus,
        @JsonProperty("memoryMb") int memoryMb,
        @JsonProperty("diskGb") int diskGb,
        @JsonProperty("gpus") int gpus) {

    private static final Pattern DOMAIN = Pattern.compile("^(?=.{1,253}$)([a-z0-9]([a-z0-9-]{0,61}[a-z0-9])?\\.)+[a-z]{2,63}$");

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record DockerCredentials(
            @JsonProperty("server") String server,
            @JsonProperty("username") String username,
            @JsonProperty("password") String password) {
    }

    public void validate() {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
        if (dockerCompose == null || dockerCompose.isBlank()) {
            throw new IllegalArgumentException("dockerCompose is required");
        }
        if (publicContainerName == null || publicContainerName.isBlank()) {
            throw new IllegalArgumentException("publicContainerName is required");
        }
        if (publicContainerPort <= 0 || publicContainerPort > 65535) {
            throw new IllegalArgumentException("publicContainerPort must be between 1 and 65535");
        }
        if (cpus <= 0 || memoryMb <= 0 || diskGb <= 0) {
            throw new IllegalArgumentException("cpus, memoryMb and diskGb must be positive");
        }
        if (gpus < 0) {
            throw new IllegalArgumentException("gpus must be non-negative");
        }
        if (domain != null && !DOMAIN.matcher(domain).matches()) {
            throw new IllegalArgumentException("invalid domain: " + domain);
        }
        if (files != null) {
            files.forEach((path, content) -> {
                try {
                    Base64.getDecoder().decode(content);
                } catch (IllegalArgumentException e) {
                    throw new IllegalArgumentException("file " + path + " is not valid base64");
                }
            });
        }
        if (dockerCredentials != null) {
            for (DockerCredentials credentials : dockerCredentials) {
                if (credentials.username() == null || credentials.password() == null) {
                    throw new IllegalArgumentException("docker credentials need a username and password");
                }
            }
        }
    }

    public ResourceShape shape() {
        return new ResourceShape(cpus, memoryMb, diskGb, gpus);
    }

    /**
     * The parts the control plane doesn't interpret go into the opaque payload.
     */
    public WorkloadSpec toSpec(ObjectMapper mapper) {
        ObjectNode payload = mapper.createObjectNode();
        payload.put("dockerCompose", dockerCompose);
        payload.set("envVars", mapper.valueToTree(envVars != null ? envVars : Map.of()));
        payload.set("files", mapper.valueToTree(files != null ? files : Map.of()));
        payload.set("dockerCredentials", mapper.valueToTree(dockerCredentials != null ? dockerCredentials : List.of()));
        payload.put("publicContainerName", publicContainerName);
        payload.put("publicContainerPort", publicContainerPort);
        return new WorkloadSpec(name, shape(), domain, payload.toString());
    }
}
