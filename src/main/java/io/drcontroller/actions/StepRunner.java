package io.drcontroller.actions;

import io.drcontroller.concurrent.CancellationSignal;
import io.drcontroller.enums.ActionOutcome;
import io.drcontroller.enums.FailureKind;
import io.drcontroller.enums.RelationshipState;
import io.drcontroller.executor.ClusterSession;
import io.drcontroller.executor.ClusterSessions;
import io.drcontroller.executor.CommandOutput;
import io.drcontroller.executor.ConnectionException;
import io.drcontroller.executor.OntapCommands;
import io.drcontroller.models.ActionResult;
import io.drcontroller.models.Application;
import io.drcontroller.models.Relationship;
import io.drcontroller.models.RelationshipPlan;
import io.drcontroller.models.RemoteStep;
import io.drcontroller.status.SnapMirrorStatusParser;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the planned steps of one relationship in order. The first failing step stops the
 * relationship; siblings are not affected.
 */
@Slf4j
public class StepRunner {

    private static final String RESYNC_WARNING = "Warning: All data newer than Snapshot copy";
    private static final String DOES_NOT_EXIST = "does not exist";

    private final SnapMirrorStatusParser parser;
    private final Duration pollInterval;
    private final Duration pollTimeout;

    public StepRunner(SnapMirrorStatusParser parser, Duration pollInterval, Duration pollTimeout) {
        this.parser = parser;
        this.pollInterval = pollInterval;
        this.pollTimeout = pollTimeout;
    }

    public ActionResult run(Application application, RelationshipPlan plan, ClusterSessions sessions,
                            CancellationSignal signal) {
        Execution execution = new Execution(application, plan, sessions, signal);
        return execution.run();
    }

    private class Execution {
        private final Application application;
        private final RelationshipPlan plan;
        private final ClusterSessions sessions;
        private final CancellationSignal signal;
        private final List<String> executed = new ArrayList<>();
        private boolean mutated;

        Execution(Application application, RelationshipPlan plan, ClusterSessions sessions, CancellationSignal signal) {
            this.application = application;
            this.plan = plan;
            this.sessions = sessions;
            this.signal = signal;
        }

        ActionResult run() {
            String app = application.getName();
            for (RemoteStep step : plan.getSteps()) {
                if (signal.isCancelled()) {
                    log.info("[App: {}] {} cancelled before '{}'", app, plan.getVolumeName(), step.getCommand());
                    return result(ActionOutcome.CANCELLED, null, null);
                }
                try {
                    String failure = runStep(step);
                    if (failure != null) {
                        log.error("[App: {}] {} step '{}' failed on {}: {}", app, plan.getVolumeName(),
                            step.getCommand(), step.getCluster(), failure);
                        return result(ActionOutcome.FAILED, FailureKind.REMOTE_COMMAND, failure);
                    }
                } catch (ConnectionException e) {
                    log.error("[App: {}] {} lost connection to {}: {}", app, plan.getVolumeName(),
                        step.getCluster(), e.getMessage());
                    return result(ActionOutcome.FAILED, FailureKind.CONNECTION, e.getMessage());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    signal.cancel();
                    return result(ActionOutcome.CANCELLED, null, null);
                }
            }
            log.info("[App: {}] {} {} completed: {} -> {}", app, plan.getVolumeName(), plan.getLink(),
                plan.getFromState(), plan.getToState());
            return result(ActionOutcome.SUCCEEDED, null, null);
        }

        /**
         * @return failure detail, or null when the step succeeded
         */
        private String runStep(RemoteStep step) throws ConnectionException, InterruptedException {
            switch (step.getKind()) {
                case COMMAND:
                    return checked(send(step.getCluster(), step.getCommand()));
                case AWAIT:
                    return await(step);
                case ENSURE_SHARE:
                    return ensureShare(step);
                case DELETE_SHARE:
                    return deleteShare(step);
                case CREATE_LINK_IF_ABSENT:
                    return createLinkIfAbsent(step);
                default:
                    throw new IllegalStateException("Unsupported step kind " + step.getKind());
            }
        }

        private CommandOutput send(String cluster, String command) throws ConnectionException {
            executed.add(command);
            ClusterSession session = sessions.forCluster(cluster);
            // Counts as mutating once sent, even if the reply is lost
            if (!command.startsWith("snapmirror show") && !command.startsWith("cifs share show")) {
                mutated = true;
            }
            CommandOutput output = session.execute(command);
            if (output.outputOrEmpty().contains(RESYNC_WARNING)) {
                log.warn("[App: {}] {} on {}: {}", application.getName(), command, cluster,
                    output.outputOrEmpty().trim());
            }
            return output;
        }

        private String checked(CommandOutput output) {
            return output.isFailed() ? output.errorDetail() : null;
        }

        private String await(RemoteStep step) throws ConnectionException, InterruptedException {
            long deadline = System.nanoTime() + pollTimeout.toNanos();
            boolean first = true;
            Relationship relationship;
            while (true) {
                if (first) {
                    executed.add(step.getCommand());
                    first = false;
                }
                relationship = query(step);
                if (step.getAwait().isSatisfiedBy(relationship)) {
                    log.debug("[App: {}] {} reached {}", application.getName(), relationship.getDestinationPath(),
                        step.getAwait());
                    return null;
                }
                if (relationship.getError() != null) {
                    return relationship.getError();
                }
                if (System.nanoTime() >= deadline) {
                    return "timed out after " + pollTimeout.toSeconds() + "s waiting for "
                        + relationship.getDestinationPath() + " to become " + step.getAwait().name().toLowerCase()
                        + " (state " + relationship.getState() + ", status " + relationship.getStatus() + ")";
                }
                if (signal.isCancelled()) {
                    throw new InterruptedException("cancelled while waiting");
                }
                Thread.sleep(pollInterval.toMillis());
            }
        }

        private Relationship query(RemoteStep step) throws ConnectionException {
            CommandOutput output = sessions.execute(step.getCluster(), step.getCommand());
            return parser.parse(plan.getVolumeName(), step.getLink(),
                application.sourcePath(step.getLink(), plan.getVolumeName()),
                application.destinationPath(step.getLink(), plan.getVolumeName()),
                output);
        }

        private String ensureShare(RemoteStep step) throws ConnectionException {
            CommandOutput show = send(step.getCluster(), step.getCommand());
            String text = show.outputOrEmpty();
            boolean missing = text.isBlank() || text.contains(OntapCommands.NO_ENTRIES)
                || (show.isFailed() && isMissing(show.errorDetail()));
            if (!missing) {
                if (show.isFailed()) {
                    return show.errorDetail();
                }
                log.info("[App: {}] Share already exists: {}", application.getName(), step.getCommand());
                return null;
            }
            return checked(send(step.getCluster(), step.getConditionalCommand()));
        }

        private String deleteShare(RemoteStep step) throws ConnectionException {
            CommandOutput output = send(step.getCluster(), step.getCommand());
            if (output.isFailed() && isMissing(output.errorDetail())) {
                log.info("[App: {}] Share already absent: {}", application.getName(), step.getCommand());
                return null;
            }
            return checked(output);
        }

        private String createLinkIfAbsent(RemoteStep step) throws ConnectionException {
            executed.add(step.getCommand());
            Relationship relationship = query(step);
            if (relationship.isPresent() && relationship.getState() != RelationshipState.UNKNOWN) {
                log.info("[App: {}] Relationship {} already exists ({})", application.getName(),
                    relationship.getDestinationPath(), relationship.getState());
                return null;
            }
            if (relationship.getError() != null) {
                return relationship.getError();
            }
            return checked(send(step.getCluster(), step.getConditionalCommand()));
        }

        private boolean isMissing(String detail) {
            return detail.contains(DOES_NOT_EXIST) || detail.contains(OntapCommands.NO_ENTRIES);
        }

        private ActionResult result(ActionOutcome outcome, FailureKind kind, String error) {
            RelationshipState resulting;
            if (outcome == ActionOutcome.SUCCEEDED) {
                resulting = plan.getToState();
            } else {
                resulting = mutated ? RelationshipState.UNKNOWN : plan.getFromState();
            }
            return ActionResult.builder()
                .volumeName(plan.getVolumeName())
                .link(plan.getLink())
                .outcome(outcome)
                .failureKind(kind)
                .error(error)
                .resultingState(resulting)
                .executedCommands(new ArrayList<>(executed))
                .build();
        }
    }
}
