package io.drcontroller.api.handlers;

import io.drcontroller.actions.InconsistentDirectionException;
import io.drcontroller.api.models.requests.ActionRequestBody;
import io.drcontroller.api.models.responses.ErrorResponse;
import io.drcontroller.catalog.ApplicationNotFoundException;
import io.drcontroller.config.DrControllerConfig;
import io.drcontroller.enums.DrAction;
import io.drcontroller.enums.ExecutionPolicy;
import io.drcontroller.enums.RestorationPath;
import io.drcontroller.models.ActionRequest;
import io.drcontroller.orchestration.ActionPreview;
import io.drcontroller.orchestration.ApplyOutcome;
import io.drcontroller.orchestration.DrOrchestrator;
import io.drcontroller.orchestration.OperatorConfirmation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;

import static io.drcontroller.config.Constants.HEADER_OPERATOR;

/**
 * REST API handler for DR actions.
 *
 * Supported operations:
 * - POST /applications/{app}/actions/{action}/_preview - Plan without touching any cluster
 * - POST /applications/{app}/actions/{action}/_apply - Run the action once confirmed
 *
 * Actions: update, quiesce, break, resync, recovery, recovery-extended,
 * restoration-extended, restoration-flip-flop, restoration-post-tvt
 */
@Slf4j
@RestController
@RequestMapping("/applications/{app}/actions/{action}")
public class ActionHandler {

    private final DrOrchestrator orchestrator;
    private final DrControllerConfig config;

    public ActionHandler(DrOrchestrator orchestrator, DrControllerConfig config) {
        this.orchestrator = orchestrator;
        this.config = config;
    }

    @PostMapping("/_preview")
    public ResponseEntity<Object> preview(
            @PathVariable String app,
            @PathVariable String action,
            @RequestHeader(value = HEADER_OPERATOR, required = false) String operator,
            @RequestBody(required = false) ActionRequestBody body) {
        try {
            ActionRequest request = toRequest(action, operator, body);
            log.info("Previewing {} on application '{}' for {}", action, app, request.getOperator());
            ActionPreview preview = orchestrator.preview(app, request);
            return ResponseEntity.ok(preview);
        } catch (ApplicationNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.applicationNotFound(e.getApplicationName()));
        } catch (InconsistentDirectionException e) {
            log.warn("Refused {} on application '{}': {}", action, app, e.getMessage());
            return ResponseEntity.status(HttpStatus.CONFLICT).body(ErrorResponse.inconsistentDirection(app, e.getMessage()));
        } catch (IllegalArgumentException e) {
            log.error("Invalid {} request for application '{}': {}", action, app, e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ErrorResponse.invalidRequest(e.getMessage()));
        } catch (Exception e) {
            log.error("Error previewing {} on application '{}': {}", action, app, e.getMessage(), e);
            return ResponseEntity.status(500).body(ErrorResponse.controllerError(app, e.getMessage()));
        }
    }

    @PostMapping("/_apply")
    public ResponseEntity<Object> apply(
            @PathVariable String app,
            @PathVariable String action,
            @RequestHeader(value = HEADER_OPERATOR, required = false) String operator,
            @RequestBody(required = false) ActionRequestBody body) {
        try {
            ActionRequest request = toRequest(action, operator, body);
            boolean confirmed = body != null && body.isConfirmed();
            boolean acceptPartial = body != null && body.isAcceptPartialOutcome();
            log.info("Applying {} on application '{}' for {} (confirmed: {}, dry run: {})",
                action, app, request.getOperator(), confirmed, request.isDryRun());
            ApplyOutcome outcome = orchestrator.apply(app, request, OperatorConfirmation.of(confirmed, acceptPartial));
            return ResponseEntity.ok(outcome);
        } catch (ApplicationNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.applicationNotFound(e.getApplicationName()));
        } catch (InconsistentDirectionException e) {
            log.warn("Refused {} on application '{}': {}", action, app, e.getMessage());
            return ResponseEntity.status(HttpStatus.CONFLICT).body(ErrorResponse.inconsistentDirection(app, e.getMessage()));
        } catch (IllegalArgumentException e) {
            log.error("Invalid {} request for application '{}': {}", action, app, e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ErrorResponse.invalidRequest(e.getMessage()));
        } catch (Exception e) {
            log.error("Error applying {} on application '{}': {}", action, app, e.getMessage(), e);
            return ResponseEntity.status(500).body(ErrorResponse.controllerError(app, e.getMessage()));
        }
    }

    private ActionRequest toRequest(String actionName, String operator, ActionRequestBody body) {
        DrAction action = DrAction.fromString(actionName);
        if (action == null) {
            throw new IllegalArgumentException("Unknown action '" + actionName + "'");
        }
        ActionRequestBody effective = body != null ? body : new ActionRequestBody();

        ExecutionPolicy policy = ExecutionPolicy.SEQUENTIAL;
        if (effective.getPolicy() != null && !effective.getPolicy().isBlank()) {
            policy = ExecutionPolicy.fromString(effective.getPolicy());
            if (policy == null) {
                throw new IllegalArgumentException("Unknown policy '" + effective.getPolicy() + "'");
            }
        }
        RestorationPath path = null;
        if (effective.getRestorationPath() != null && !effective.getRestorationPath().isBlank()) {
            path = RestorationPath.fromString(effective.getRestorationPath());
            if (path == null) {
                throw new IllegalArgumentException("Unknown restoration path '" + effective.getRestorationPath() + "'");
            }
        }

        return ActionRequest.builder()
            .action(action)
            .targets(effective.getTargets() != null ? effective.getTargets() : new ArrayList<>())
            .policy(policy)
            .restorationPath(path)
            .dryRun(effective.isDryRun())
            .operator(operator != null && !operator.isBlank() ? operator.trim() : config.getDefaultOperator())
            .build();
    }
}
