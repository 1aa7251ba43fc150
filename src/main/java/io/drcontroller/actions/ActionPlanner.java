package io.drcontroller.actions;

import io.drcontroller.enums.AwaitCondition;
import io.drcontroller.enums.DrAction;
import io.drcontroller.enums.ExecutionPolicy;
import io.drcontroller.enums.RelationshipState;
import io.drcontroller.enums.ReplicationDirection;
import io.drcontroller.enums.ReplicationLink;
import io.drcontroller.enums.Site;
import io.drcontroller.enums.StepKind;
import io.drcontroller.models.ActionPlan;
import io.drcontroller.models.ActionRequest;
import io.drcontroller.models.Application;
import io.drcontroller.models.ApplicationStatus;
import io.drcontroller.models.Relationship;
import io.drcontroller.models.RelationshipPlan;
import io.drcontroller.models.RemoteStep;
import io.drcontroller.models.Share;
import io.drcontroller.models.Volume;
import io.drcontroller.models.VolumeStatus;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

import static io.drcontroller.executor.OntapCommands.cifsShareCreate;
import static io.drcontroller.executor.OntapCommands.cifsShareDelete;
import static io.drcontroller.executor.OntapCommands.cifsShareShow;
import static io.drcontroller.executor.OntapCommands.snapmirrorBreak;
import static io.drcontroller.executor.OntapCommands.snapmirrorCreate;
import static io.drcontroller.executor.OntapCommands.snapmirrorDelete;
import static io.drcontroller.executor.OntapCommands.snapmirrorQuiesce;
import static io.drcontroller.executor.OntapCommands.snapmirrorResync;
import static io.drcontroller.executor.OntapCommands.snapmirrorShow;
import static io.drcontroller.executor.OntapCommands.snapmirrorUpdate;
import static io.drcontroller.executor.OntapCommands.volumeMount;
import static io.drcontroller.executor.OntapCommands.volumeOffline;
import static io.drcontroller.executor.OntapCommands.volumeOnline;
import static io.drcontroller.executor.OntapCommands.volumeUnmount;

/**
 * Turns an action request and a fresh status snapshot into a per-relationship plan.
 * Planning never talks to a cluster.
 */
@Slf4j
public class ActionPlanner {

    public ActionPlan plan(Application application, ActionRequest request, ApplicationStatus status) {
        DrAction action = request.getAction();
        if (action == null) {
            throw new IllegalArgumentException("Action is required");
        }
        ExecutionPolicy policy = request.getPolicy() != null ? request.getPolicy() : ExecutionPolicy.SEQUENTIAL;
        if (policy == ExecutionPolicy.PARALLEL && action.isOrderSensitive()) {
            throw new IllegalArgumentException(action.getValue() + " must run with the SEQUENTIAL policy");
        }

        List<Volume> targets = resolveTargets(application, request);
        if (request.isWholeApplication() && status.getDirection() == ReplicationDirection.INCONSISTENT) {
            throw new InconsistentDirectionException("Replication direction of application '" + application.getName()
                + "' is inconsistent; name the target volumes explicitly");
        }

        List<RelationshipPlan> relationships = new ArrayList<>();
        for (Volume volume : targets) {
            VolumeStatus volumeStatus = status.findVolume(volume.getName())
                .orElseThrow(() -> new IllegalStateException("No status collected for volume " + volume.getName()));
            relationships.add(planVolume(application, volume, volumeStatus, request));
        }

        long eligible = relationships.stream().filter(RelationshipPlan::isEligible).count();
        log.info("[App: {}] Planned {}: {} of {} relationships eligible", application.getName(),
            action.getValue(), eligible, relationships.size());

        return ActionPlan.builder()
            .application(application.getName())
            .action(action)
            .direction(status.getDirection())
            .policy(policy)
            .restorationPath(request.getRestorationPath())
            .dryRun(request.isDryRun())
            .relationships(relationships)
            .build();
    }

    private List<Volume> resolveTargets(Application application, ActionRequest request) {
        if (request.isWholeApplication()) {
            return application.getVolumes();
        }
        List<Volume> targets = new ArrayList<>();
        List<String> unknown = new ArrayList<>();
        for (String name : request.getTargets()) {
            application.findVolume(name).ifPresentOrElse(targets::add, () -> unknown.add(name));
        }
        if (!unknown.isEmpty()) {
            throw new IllegalArgumentException("Unknown volumes for application '" + application.getName()
                + "': " + unknown);
        }
        return targets;
    }

    private RelationshipPlan planVolume(Application application, Volume volume, VolumeStatus status,
                                        ActionRequest request) {
        DrAction action = request.getAction();
        try {
            ReplicationLink link = ActionRules.verify(action, status, request.getRestorationPath());
            Relationship acted = status.relationship(link);
            RelationshipState fromState = acted != null && acted.isPresent() ? acted.getState() : null;
            RelationshipState resultState = ActionRules.ruleFor(action).getResultState();
            return RelationshipPlan.builder()
                .volumeName(volume.getName())
                .link(link)
                .fromState(fromState)
                .toState(resultState != null ? resultState : fromState)
                .steps(new StepBuilder(application, volume, status).build(action, link))
                .build();
        } catch (PreconditionException e) {
            log.info("[App: {}] {} not eligible for {}: {}", application.getName(), volume.getName(),
                action.getValue(), e.getMessage());
            ReplicationLink reported = defaultLink(action, status);
            Relationship acted = status.relationship(reported);
            return RelationshipPlan.builder()
                .volumeName(volume.getName())
                .link(reported)
                .fromState(acted != null && acted.isPresent() ? acted.getState() : null)
                .violation(e.getMessage())
                .build();
        }
    }

    private static ReplicationLink defaultLink(DrAction action, VolumeStatus status) {
        switch (ActionRules.ruleFor(action).getActedLink()) {
            case DR_TO_PROD:
                return ReplicationLink.DR_TO_PROD;
            case PROD_TO_DR:
                return ReplicationLink.PROD_TO_DR;
            default:
                return status.getWorkingLink();
        }
    }

    /**
     * Builds the ordered remote steps of one volume's workflow.
     */
    private static class StepBuilder {
        private final Application application;
        private final Volume volume;
        private final VolumeStatus status;
        private final List<RemoteStep> steps = new ArrayList<>();

        StepBuilder(Application application, Volume volume, VolumeStatus status) {
            this.application = application;
            this.volume = volume;
            this.status = status;
        }

        List<RemoteStep> build(DrAction action, ReplicationLink link) {
            switch (action) {
                case UPDATE:
                    command(link.getDestinationSite(), snapmirrorUpdate(destination(link)));
                    break;
                case QUIESCE:
                    command(link.getDestinationSite(), snapmirrorQuiesce(destination(link)));
                    break;
                case BREAK:
                    command(link.getDestinationSite(), snapmirrorBreak(destination(link)));
                    break;
                case RESYNC:
                    command(link.getDestinationSite(), snapmirrorResync(destination(link)));
                    await(link, AwaitCondition.MIRRORED);
                    break;
                case RECOVERY:
                    recovery();
                    break;
                case RECOVERY_EXTENDED:
                    recoveryExtended();
                    break;
                case RESTORATION_EXTENDED:
                    restorationExtended();
                    break;
                case RESTORATION_FLIP_FLOP:
                    restorationFlipFlop();
                    break;
                case RESTORATION_POST_TVT:
                    restorationPostTvt();
                    break;
                default:
                    throw new IllegalArgumentException("Unsupported action " + action);
            }
            return steps;
        }

        private void recovery() {
            ReplicationLink link = ReplicationLink.PROD_TO_DR;
            quiesceAndBreak(link);
            command(Site.PROD, volumeUnmount(vserver(Site.PROD), volume.getName()));
            command(Site.PROD, volumeOffline(vserver(Site.PROD), volume.getName()));
            command(Site.DR, volumeMount(vserver(Site.DR), volume.getName()));
            volume.getShares().forEach(share -> ensureShare(Site.DR, share));
        }

        private void recoveryExtended() {
            ReplicationLink link = ReplicationLink.DR_TO_PROD;
            String[] policySchedule = policyAndSchedule(ReplicationLink.PROD_TO_DR, ReplicationLink.DR_TO_PROD);
            command(Site.PROD, volumeOnline(vserver(Site.PROD), volume.getName()));
            command(Site.PROD, snapmirrorCreate(source(link), destination(link), policySchedule[0], policySchedule[1]));
            command(Site.PROD, snapmirrorResync(destination(link)));
            await(link, AwaitCondition.MIRRORED);
        }

        private void restorationExtended() {
            ReplicationLink reverse = ReplicationLink.DR_TO_PROD;
            ReplicationLink forward = ReplicationLink.PROD_TO_DR;
            volume.getShares().forEach(share -> deleteShare(Site.DR, share));
            quiesceAndBreak(reverse);
            command(Site.PROD, volumeMount(vserver(Site.PROD), volume.getName()));
            volume.getShares().forEach(share -> ensureShare(Site.PROD, share));
            if (!isPresent(forward)) {
                String[] policySchedule = policyAndSchedule(forward, reverse);
                createLinkIfAbsent(forward, policySchedule);
            }
            command(Site.PROD, snapmirrorDelete(destination(reverse)));
            command(Site.DR, volumeUnmount(vserver(Site.DR), volume.getName()));
            command(Site.DR, volumeOffline(vserver(Site.DR), volume.getName()));
        }

        private void restorationFlipFlop() {
            command(Site.PROD, volumeOnline(vserver(Site.PROD), volume.getName()));
            command(Site.PROD, volumeMount(vserver(Site.PROD), volume.getName()));
            volume.getShares().forEach(share -> ensureShare(Site.PROD, share));
            command(Site.DR, volumeUnmount(vserver(Site.DR), volume.getName()));
            command(Site.DR, volumeOffline(vserver(Site.DR), volume.getName()));
        }

        private void restorationPostTvt() {
            ReplicationLink forward = ReplicationLink.PROD_TO_DR;
            command(Site.DR, volumeOnline(vserver(Site.DR), volume.getName()));
            if (!isPresent(forward)) {
                createLinkIfAbsent(forward, policyAndSchedule(forward, ReplicationLink.DR_TO_PROD));
            }
            volume.getShares().forEach(share -> deleteShare(Site.DR, share));
            command(Site.DR, snapmirrorResync(destination(forward)));
            await(forward, AwaitCondition.MIRRORED);
        }

        // update + wait idle when mirrored, quiesce + wait quiesced when not yet quiesced, then break
        private void quiesceAndBreak(ReplicationLink link) {
            Site site = link.getDestinationSite();
            Relationship relationship = status.relationship(link);
            if (relationship.getState() == RelationshipState.MIRRORED) {
                command(site, snapmirrorUpdate(destination(link)));
                await(link, AwaitCondition.IDLE);
                command(site, snapmirrorQuiesce(destination(link)));
                await(link, AwaitCondition.QUIESCED);
            }
            command(site, snapmirrorBreak(destination(link)));
        }

        private String[] policyAndSchedule(ReplicationLink preferred, ReplicationLink fallback) {
            String policy = null;
            String schedule = null;
            for (ReplicationLink link : new ReplicationLink[]{preferred, fallback}) {
                Relationship relationship = status.relationship(link);
                if (relationship == null || !relationship.isPresent()) {
                    continue;
                }
                if (policy == null) {
                    policy = relationship.getPolicy();
                }
                if (schedule == null) {
                    schedule = relationship.getSchedule();
                }
            }
            if (policy == null || schedule == null) {
                throw new PreconditionException("no policy/schedule known to create a link for volume "
                    + volume.getName());
            }
            return new String[]{policy, schedule};
        }

        private boolean isPresent(ReplicationLink link) {
            Relationship relationship = status.relationship(link);
            return relationship != null && relationship.isPresent();
        }

        private void command(Site site, String command) {
            steps.add(RemoteStep.builder()
                .site(site)
                .cluster(application.clusterAt(site))
                .kind(StepKind.COMMAND)
                .command(command)
                .build());
        }

        private void await(ReplicationLink link, AwaitCondition condition) {
            Site site = link.getDestinationSite();
            steps.add(RemoteStep.builder()
                .site(site)
                .cluster(application.clusterAt(site))
                .kind(StepKind.AWAIT)
                .command(snapmirrorShow(destination(link)))
                .await(condition)
                .link(link)
                .build());
        }

        private void ensureShare(Site site, Share share) {
            steps.add(RemoteStep.builder()
                .site(site)
                .cluster(application.clusterAt(site))
                .kind(StepKind.ENSURE_SHARE)
                .command(cifsShareShow(vserver(site), share.getName()))
                .conditionalCommand(cifsShareCreate(vserver(site), share.getName(), share.getPath()))
                .build());
        }

        private void deleteShare(Site site, Share share) {
            steps.add(RemoteStep.builder()
                .site(site)
                .cluster(application.clusterAt(site))
                .kind(StepKind.DELETE_SHARE)
                .command(cifsShareDelete(vserver(site), share.getName()))
                .build());
        }

        private void createLinkIfAbsent(ReplicationLink link, String[] policySchedule) {
            Site site = link.getDestinationSite();
            steps.add(RemoteStep.builder()
                .site(site)
                .cluster(application.clusterAt(site))
                .kind(StepKind.CREATE_LINK_IF_ABSENT)
                .command(snapmirrorShow(destination(link)))
                .conditionalCommand(snapmirrorCreate(source(link), destination(link), policySchedule[0], policySchedule[1]))
                .link(link)
                .build());
        }

        private String vserver(Site site) {
            return application.vserverAt(site);
        }

        private String source(ReplicationLink link) {
            return application.sourcePath(link, volume.getName());
        }

        private String destination(ReplicationLink link) {
            return application.destinationPath(link, volume.getName());
        }
    }
}
