package io.drcontroller.api.models.responses;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Error body returned by the status and action endpoints.
 * {@code application} is set when the failure concerns one catalogued application.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ErrorResponse {
    public static final String APPLICATION_NOT_FOUND = "application_not_found";
    public static final String INCONSISTENT_DIRECTION = "inconsistent_direction";
    public static final String INVALID_REQUEST = "invalid_request";
    public static final String CONTROLLER_ERROR = "controller_error";

    private String error;
    private String reason;
    private Integer status;
    private String application;

    public static ErrorResponse applicationNotFound(String application) {
        return ErrorResponse.builder()
            .error(APPLICATION_NOT_FOUND)
            .reason("Application '" + application + "' not found")
            .status(404)
            .application(application)
            .build();
    }

    /**
     * Whole-application action refused because the volumes disagree on the replication direction.
     */
    public static ErrorResponse inconsistentDirection(String application, String reason) {
        return ErrorResponse.builder()
            .error(INCONSISTENT_DIRECTION)
            .reason(reason)
            .status(409)
            .application(application)
            .build();
    }

    public static ErrorResponse invalidRequest(String reason) {
        return ErrorResponse.builder()
            .error(INVALID_REQUEST)
            .reason(reason)
            .status(400)
            .build();
    }

    public static ErrorResponse controllerError(String application, String reason) {
        return ErrorResponse.builder()
            .error(CONTROLLER_ERROR)
            .reason(reason)
            .status(500)
            .application(application)
            .build();
    }
}
