package openorchestrator.scheduler.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request body of on/off switches.
 * POST /api/v1/scheduler/exclusive
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ToggleRequest(
        @JsonProperty("enabled") Boolean enabled) {

    public void validate() {
        if (enabled == null) {
            throw new IllegalArgumentException("enabled is required");
        }
    }
}
