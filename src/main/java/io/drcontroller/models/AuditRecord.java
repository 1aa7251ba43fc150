package io.drcontroller.models;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.ZonedDateTime;

/**
 * One confirmed operator action as written to the audit log.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditRecord {

    @JsonProperty("action")
    private String action;

    @JsonProperty("application")
    private String application;

    @JsonProperty("user")
    private String operator;

    @JsonProperty("timestamp")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "dd-MMM-yyyy hh:mm:ss a", locale = "en")
    private ZonedDateTime timestamp;

    @JsonProperty("outcome")
    private String outcome;
}
