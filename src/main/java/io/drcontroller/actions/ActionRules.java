package io.drcontroller.actions;

import io.drcontroller.enums.DrAction;
import io.drcontroller.enums.RelationshipState;
import io.drcontroller.enums.ReplicationLink;
import io.drcontroller.enums.RestorationPath;
import io.drcontroller.enums.Site;
import io.drcontroller.models.Relationship;
import io.drcontroller.models.VolumeStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Legality table of the DR actions: which site must be writable, which link is acted on,
 * which states each link must be in, and what the acted link ends up as.
 */
public final class ActionRules {

    /**
     * Which link an action operates on.
     */
    public enum LinkSelector {
        WORKING,
        PROD_TO_DR,
        DR_TO_PROD;

        ReplicationLink select(VolumeStatus volume) {
            switch (this) {
                case PROD_TO_DR:
                    return ReplicationLink.PROD_TO_DR;
                case DR_TO_PROD:
                    return ReplicationLink.DR_TO_PROD;
                default:
                    return volume.getWorkingLink();
            }
        }
    }

    /**
     * Required state of one link. An empty state set with absentAllowed means the link must not exist.
     */
    @Getter
    @AllArgsConstructor
    public static class LinkRequirement {
        private final LinkSelector link;
        private final Set<RelationshipState> allowedStates;
        private final boolean absentAllowed;
    }

    @Getter
    @Builder
    public static class Rule {
        private final DrAction action;
        private final Set<Site> writableSites;
        private final LinkSelector actedLink;
        @Singular
        private final List<LinkRequirement> requirements;
        private final RelationshipState resultState; // null: unchanged
        private final RestorationPath requiredPath;
        private final boolean pathAssertionRequired;
    }

    private static final Set<Site> ANY_SITE = EnumSet.allOf(Site.class);
    private static final Map<DrAction, Rule> RULES = new EnumMap<>(DrAction.class);

    static {
        register(Rule.builder().action(DrAction.UPDATE)
            .writableSites(ANY_SITE)
            .actedLink(LinkSelector.WORKING)
            .requirement(present(LinkSelector.WORKING, RelationshipState.MIRRORED, RelationshipState.QUIESCED))
            .build());
        register(Rule.builder().action(DrAction.QUIESCE)
            .writableSites(ANY_SITE)
            .actedLink(LinkSelector.WORKING)
            .requirement(present(LinkSelector.WORKING, RelationshipState.MIRRORED))
            .resultState(RelationshipState.QUIESCED)
            .build());
        register(Rule.builder().action(DrAction.BREAK)
            .writableSites(ANY_SITE)
            .actedLink(LinkSelector.WORKING)
            .requirement(present(LinkSelector.WORKING, RelationshipState.QUIESCED))
            .resultState(RelationshipState.BROKEN_OFF)
            .build());
        register(Rule.builder().action(DrAction.RESYNC)
            .writableSites(ANY_SITE)
            .actedLink(LinkSelector.WORKING)
            .requirement(present(LinkSelector.WORKING, RelationshipState.BROKEN_OFF))
            .resultState(RelationshipState.MIRRORED)
            .build());
        register(Rule.builder().action(DrAction.RECOVERY)
            .writableSites(EnumSet.of(Site.PROD))
            .actedLink(LinkSelector.PROD_TO_DR)
            .requirement(present(LinkSelector.PROD_TO_DR, RelationshipState.MIRRORED, RelationshipState.QUIESCED))
            .resultState(RelationshipState.BROKEN_OFF)
            .build());
        register(Rule.builder().action(DrAction.RECOVERY_EXTENDED)
            .writableSites(EnumSet.of(Site.DR))
            .actedLink(LinkSelector.DR_TO_PROD)
            .requirement(present(LinkSelector.PROD_TO_DR, RelationshipState.BROKEN_OFF))
            .requirement(absent(LinkSelector.DR_TO_PROD))
            .resultState(RelationshipState.MIRRORED)
            .requiredPath(RestorationPath.EXTENDED)
            .pathAssertionRequired(true)
            .build());
        register(Rule.builder().action(DrAction.RESTORATION_EXTENDED)
            .writableSites(EnumSet.of(Site.DR))
            .actedLink(LinkSelector.PROD_TO_DR)
            .requirement(present(LinkSelector.DR_TO_PROD, RelationshipState.MIRRORED, RelationshipState.QUIESCED))
            .resultState(RelationshipState.BROKEN_OFF)
            .requiredPath(RestorationPath.EXTENDED)
            .pathAssertionRequired(true)
            .build());
        register(Rule.builder().action(DrAction.RESTORATION_FLIP_FLOP)
            .writableSites(EnumSet.of(Site.DR))
            .actedLink(LinkSelector.PROD_TO_DR)
            .requirement(present(LinkSelector.PROD_TO_DR, RelationshipState.BROKEN_OFF))
            .requirement(absent(LinkSelector.DR_TO_PROD))
            .resultState(RelationshipState.BROKEN_OFF)
            .requiredPath(RestorationPath.FLIP_FLOP)
            .pathAssertionRequired(true)
            .build());
        register(Rule.builder().action(DrAction.RESTORATION_POST_TVT)
            .writableSites(ANY_SITE)
            .actedLink(LinkSelector.PROD_TO_DR)
            .requirement(presentOrAbsent(LinkSelector.PROD_TO_DR, RelationshipState.BROKEN_OFF))
            .requirement(presentOrAbsent(LinkSelector.DR_TO_PROD, RelationshipState.BROKEN_OFF))
            .resultState(RelationshipState.MIRRORED)
            .pathAssertionRequired(true)
            .build());
    }

    private ActionRules() {
        // Utility class - prevent instantiation
    }

    public static Rule ruleFor(DrAction action) {
        Rule rule = RULES.get(action);
        if (rule == null) {
            throw new IllegalArgumentException("No rule for action " + action);
        }
        return rule;
    }

    /**
     * Check that the action may run against the given volume.
     *
     * @return the link the action operates on
     * @throws PreconditionException naming the expected and actual state when it may not
     */
    public static ReplicationLink verify(DrAction action, VolumeStatus volume, RestorationPath assertedPath) {
        Rule rule = ruleFor(action);

        if (rule.isPathAssertionRequired() && assertedPath == null) {
            throw new PreconditionException(action.getValue() + " requires an asserted restoration path");
        }
        if (rule.getRequiredPath() != null && rule.getRequiredPath() != assertedPath) {
            throw new PreconditionException(action.getValue() + " requires restoration path "
                + rule.getRequiredPath() + " but " + assertedPath + " was asserted");
        }

        Site writable = volume.getWritableSite();
        if (writable == null) {
            throw new PreconditionException("writable site of volume " + volume.getVolumeName() + " is undetermined",
                RelationshipState.UNKNOWN);
        }
        if (!rule.getWritableSites().contains(writable)) {
            throw new PreconditionException("expected " + rule.getWritableSites() + " writable but "
                + writable + " is writable");
        }

        for (LinkRequirement requirement : rule.getRequirements()) {
            ReplicationLink link = requirement.getLink().select(volume);
            Relationship relationship = volume.relationship(link);
            boolean present = relationship != null && relationship.isPresent();
            if (!present) {
                if (!requirement.isAbsentAllowed()) {
                    throw new PreconditionException("expected " + link + " in " + requirement.getAllowedStates()
                        + " but it does not exist");
                }
                continue;
            }
            RelationshipState actual = relationship.getState();
            if (!requirement.getAllowedStates().contains(actual)) {
                String expected = requirement.getAllowedStates().isEmpty()
                    ? "absent" : "in " + requirement.getAllowedStates();
                throw new PreconditionException("expected " + link + " " + expected + " but was " + actual, actual);
            }
        }
        return rule.getActedLink().select(volume);
    }

    private static void register(Rule rule) {
        RULES.put(rule.getAction(), rule);
    }

    private static LinkRequirement present(LinkSelector link, RelationshipState... states) {
        return new LinkRequirement(link, EnumSet.of(states[0], states), false);
    }

    private static LinkRequirement presentOrAbsent(LinkSelector link, RelationshipState... states) {
        return new LinkRequirement(link, EnumSet.of(states[0], states), true);
    }

    private static LinkRequirement absent(LinkSelector link) {
        return new LinkRequirement(link, EnumSet.noneOf(RelationshipState.class), true);
    }
}
