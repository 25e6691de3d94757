package openorchestrator.scheduler.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Generic response for operator actions.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationResponse(
        @JsonProperty("ok") boolean ok,
        @JsonProperty("status") String status,
        @JsonProperty("error") String error) {

    public static OperationResponse success() {
        return new OperationResponse(true, null, null);
    }

    /** Success, reporting the resulting status of the target */
    public static OperationResponse success(String status) {
        return new OperationResponse(true, status, null);
    }

    public static OperationResponse error(String error) {
        return new OperationResponse(false, null, error);
    }
}
