package metalcc.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record LogLinesResponse(@JsonProperty("lines") List<String> lines) {
}
