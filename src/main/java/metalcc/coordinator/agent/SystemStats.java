package metalcc.coordinator.agent;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Resource usage snapshot of a workload VM.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SystemStats(
        @JsonProperty("memory") Memory memory,
        @JsonProperty("cpus") List<Cpu> cpus,
        @JsonProperty("disks") List<Disk> disks) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Memory(
            @JsonProperty("total") long total,
            @JsonProperty("used") long used) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Cpu(
            @JsonProperty("name") String name,
            @JsonProperty("usage") double usage,
            @JsonProperty("frequency") long frequency) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Disk(
            @JsonProperty("name") String name,
            @JsonProperty("mountPoint") String mountPoint,
            @JsonProperty("filesystem") String filesystem,
            @JsonProperty("size") long size,
            @JsonProperty("used") long used) {
    }
}
