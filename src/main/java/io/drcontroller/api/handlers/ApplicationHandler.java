package io.drcontroller.api.handlers;

import io.drcontroller.api.models.responses.ApplicationDetailsResponse;
import io.drcontroller.api.models.responses.ErrorResponse;
import io.drcontroller.audit.AuditLog;
import io.drcontroller.catalog.ApplicationNotFoundException;
import io.drcontroller.config.Constants;
import io.drcontroller.models.ApplicationStatus;
import io.drcontroller.models.AuditRecord;
import io.drcontroller.orchestration.DrOrchestrator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST API handler for application status, details and audit history.
 *
 * Supported operations:
 * - GET /applications - Replication status overview of every application
 * - GET /applications/{app} - Clusters, vservers, replication paths, qtrees and shares
 * - GET /applications/{app}/status - Live relationship status and resolved direction
 * - GET /applications/{app}/audit - Most recent confirmed actions
 */
@Slf4j
@RestController
@RequestMapping("/applications")
public class ApplicationHandler {

    private final DrOrchestrator orchestrator;
    private final AuditLog auditLog;

    public ApplicationHandler(DrOrchestrator orchestrator, AuditLog auditLog) {
        this.orchestrator = orchestrator;
        this.auditLog = auditLog;
    }

    @GetMapping
    public ResponseEntity<Object> getOverview() {
        try {
            log.info("Getting status overview of all applications");
            List<ApplicationStatus> statuses = orchestrator.statusAll();
            return ResponseEntity.ok(statuses);
        } catch (Exception e) {
            log.error("Error getting status overview: {}", e.getMessage(), e);
            return ResponseEntity.status(500).body(ErrorResponse.controllerError(null, e.getMessage()));
        }
    }

    @GetMapping("/{app}")
    public ResponseEntity<Object> getDetails(@PathVariable String app) {
        try {
            log.info("Getting details of application '{}'", app);
            return ResponseEntity.ok(ApplicationDetailsResponse.from(orchestrator.getApplication(app)));
        } catch (ApplicationNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.applicationNotFound(e.getApplicationName()));
        } catch (Exception e) {
            log.error("Error getting details of application '{}': {}", app, e.getMessage(), e);
            return ResponseEntity.status(500).body(ErrorResponse.controllerError(app, e.getMessage()));
        }
    }

    @GetMapping("/{app}/status")
    public ResponseEntity<Object> getStatus(@PathVariable String app) {
        try {
            log.info("Getting status of application '{}'", app);
            return ResponseEntity.ok(orchestrator.status(app));
        } catch (ApplicationNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.applicationNotFound(e.getApplicationName()));
        } catch (Exception e) {
            log.error("Error getting status of application '{}': {}", app, e.getMessage(), e);
            return ResponseEntity.status(500).body(ErrorResponse.controllerError(app, e.getMessage()));
        }
    }

    @GetMapping("/{app}/audit")
    public ResponseEntity<Object> getAudit(@PathVariable String app,
                                           @RequestParam(value = "limit", required = false) Integer limit) {
        try {
            orchestrator.getApplication(app);
            int effectiveLimit = limit != null ? limit : Constants.DEFAULT_AUDIT_READ_LIMIT;
            if (effectiveLimit < 1) {
                return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                    .body(ErrorResponse.invalidRequest("limit must be positive"));
            }
            List<AuditRecord> records = auditLog.readRecent(app, effectiveLimit);
            return ResponseEntity.ok(records);
        } catch (ApplicationNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.applicationNotFound(e.getApplicationName()));
        } catch (Exception e) {
            log.error("Error reading audit log of application '{}': {}", app, e.getMessage(), e);
            return ResponseEntity.status(500).body(ErrorResponse.controllerError(app, e.getMessage()));
        }
    }
}
