package metalcc.coordinator.agent;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A container running inside a workload.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Container(
        @JsonProperty("names") List<String> names,
        @JsonProperty("image") String image,
        @JsonProperty("image_id") String imageId,
        @JsonProperty("state") String state) {
}
