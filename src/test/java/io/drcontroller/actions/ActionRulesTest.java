package io.drcontroller.actions;

import io.drcontroller.enums.DrAction;
import io.drcontroller.enums.RelationshipState;
import io.drcontroller.enums.ReplicationLink;
import io.drcontroller.enums.RestorationPath;
import io.drcontroller.models.Relationship;
import io.drcontroller.models.VolumeStatus;
import io.drcontroller.status.DirectionResolver;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ActionRulesTest {

    private final DirectionResolver resolver = new DirectionResolver();

    /**
     * Volume with the given link states; null means the link does not exist.
     */
    private VolumeStatus volume(RelationshipState prodToDr, RelationshipState drToProd) {
        Relationship forward = prodToDr == null
            ? Relationship.absent("vol1", ReplicationLink.PROD_TO_DR, "prod_svm:vol1", "dr_svm:vol1")
            : Relationship.builder().volumeName("vol1").link(ReplicationLink.PROD_TO_DR).state(prodToDr).present(true).build();
        Relationship reverse = drToProd == null
            ? Relationship.absent("vol1", ReplicationLink.DR_TO_PROD, "dr_svm:vol1", "prod_svm:vol1")
            : Relationship.builder().volumeName("vol1").link(ReplicationLink.DR_TO_PROD).state(drToProd).present(true).build();
        return VolumeStatus.builder()
            .volumeName("vol1")
            .prodToDr(forward)
            .drToProd(reverse)
            .writableSite(resolver.writableSite(forward, reverse))
            .build();
    }

    @Test
    void testUpdate_AllowedOnMirroredAndQuiesced() {
        assertThat(ActionRules.verify(DrAction.UPDATE, volume(RelationshipState.MIRRORED, null), null))
            .isEqualTo(ReplicationLink.PROD_TO_DR);
        assertThat(ActionRules.verify(DrAction.UPDATE, volume(RelationshipState.QUIESCED, null), null))
            .isEqualTo(ReplicationLink.PROD_TO_DR);
    }

    @Test
    void testUpdate_RejectedOnBrokenOff() {
        assertThatThrownBy(() -> ActionRules.verify(DrAction.UPDATE, volume(RelationshipState.BROKEN_OFF, null), null))
            .isInstanceOf(PreconditionException.class)
            .hasMessageContaining("but was BROKEN_OFF");
    }

    @Test
    void testQuiesce_RequiresMirrored() {
        assertThat(ActionRules.verify(DrAction.QUIESCE, volume(RelationshipState.MIRRORED, null), null))
            .isEqualTo(ReplicationLink.PROD_TO_DR);
        assertThatThrownBy(() -> ActionRules.verify(DrAction.QUIESCE, volume(RelationshipState.QUIESCED, null), null))
            .isInstanceOf(PreconditionException.class)
            .hasMessageContaining("[MIRRORED]");
    }

    @Test
    void testBreak_RequiresQuiesced() {
        assertThat(ActionRules.verify(DrAction.BREAK, volume(RelationshipState.QUIESCED, null), null))
            .isEqualTo(ReplicationLink.PROD_TO_DR);
        assertThatThrownBy(() -> ActionRules.verify(DrAction.BREAK, volume(RelationshipState.MIRRORED, null), null))
            .isInstanceOf(PreconditionException.class)
            .hasMessageContaining("expected PROD_TO_DR in [QUIESCED] but was MIRRORED");
    }

    @Test
    void testResync_RequiresBrokenOff() {
        assertThat(ActionRules.verify(DrAction.RESYNC, volume(RelationshipState.BROKEN_OFF, null), null))
            .isEqualTo(ReplicationLink.PROD_TO_DR);
        assertThatThrownBy(() -> ActionRules.verify(DrAction.RESYNC, volume(RelationshipState.MIRRORED, null), null))
            .isInstanceOf(PreconditionException.class);
    }

    @Test
    void testWorkingLink_FollowsReverseRelationship() {
        // DR->PROD exists and PROD->DR is broken: daily operations act on DR->PROD
        VolumeStatus reversed = volume(RelationshipState.BROKEN_OFF, RelationshipState.MIRRORED);
        assertThat(ActionRules.verify(DrAction.QUIESCE, reversed, null)).isEqualTo(ReplicationLink.DR_TO_PROD);
    }

    @Test
    void testRecovery_RequiresProdWritable() {
        assertThat(ActionRules.verify(DrAction.RECOVERY, volume(RelationshipState.MIRRORED, null), null))
            .isEqualTo(ReplicationLink.PROD_TO_DR);
        assertThat(ActionRules.verify(DrAction.RECOVERY, volume(RelationshipState.QUIESCED, null), null))
            .isEqualTo(ReplicationLink.PROD_TO_DR);
        assertThatThrownBy(() -> ActionRules.verify(DrAction.RECOVERY, volume(RelationshipState.BROKEN_OFF, null), null))
            .isInstanceOf(PreconditionException.class)
            .hasMessageContaining("DR is writable");
    }

    @Test
    void testRecoveryExtended() {
        VolumeStatus afterRecovery = volume(RelationshipState.BROKEN_OFF, null);
        assertThat(ActionRules.verify(DrAction.RECOVERY_EXTENDED, afterRecovery, RestorationPath.EXTENDED))
            .isEqualTo(ReplicationLink.DR_TO_PROD);
        assertThatThrownBy(() -> ActionRules.verify(DrAction.RECOVERY_EXTENDED, afterRecovery, RestorationPath.FLIP_FLOP))
            .isInstanceOf(PreconditionException.class)
            .hasMessageContaining("requires restoration path EXTENDED");
        assertThatThrownBy(() -> ActionRules.verify(DrAction.RECOVERY_EXTENDED, afterRecovery, null))
            .isInstanceOf(PreconditionException.class)
            .hasMessageContaining("requires an asserted restoration path");
        assertThatThrownBy(() -> ActionRules.verify(DrAction.RECOVERY_EXTENDED,
            volume(RelationshipState.BROKEN_OFF, RelationshipState.MIRRORED), RestorationPath.EXTENDED))
            .isInstanceOf(PreconditionException.class)
            .hasMessageContaining("expected DR_TO_PROD absent but was MIRRORED");
    }

    @Test
    void testRestorationExtended() {
        VolumeStatus afterRecoveryExtended = volume(RelationshipState.BROKEN_OFF, RelationshipState.MIRRORED);
        assertThat(ActionRules.verify(DrAction.RESTORATION_EXTENDED, afterRecoveryExtended, RestorationPath.EXTENDED))
            .isEqualTo(ReplicationLink.PROD_TO_DR);
        assertThatThrownBy(() -> ActionRules.verify(DrAction.RESTORATION_EXTENDED,
            volume(RelationshipState.BROKEN_OFF, null), RestorationPath.EXTENDED))
            .isInstanceOf(PreconditionException.class)
            .hasMessageContaining("does not exist");
    }

    @Test
    void testRestorationFlipFlop() {
        VolumeStatus afterRecovery = volume(RelationshipState.BROKEN_OFF, null);
        assertThat(ActionRules.verify(DrAction.RESTORATION_FLIP_FLOP, afterRecovery, RestorationPath.FLIP_FLOP))
            .isEqualTo(ReplicationLink.PROD_TO_DR);
        assertThatThrownBy(() -> ActionRules.verify(DrAction.RESTORATION_FLIP_FLOP, afterRecovery, RestorationPath.EXTENDED))
            .isInstanceOf(PreconditionException.class);
        assertThatThrownBy(() -> ActionRules.verify(DrAction.RESTORATION_FLIP_FLOP,
            volume(RelationshipState.MIRRORED, null), RestorationPath.FLIP_FLOP))
            .isInstanceOf(PreconditionException.class);
    }

    @Test
    void testRestorationPostTvt() {
        assertThat(ActionRules.verify(DrAction.RESTORATION_POST_TVT,
            volume(RelationshipState.BROKEN_OFF, null), RestorationPath.FLIP_FLOP))
            .isEqualTo(ReplicationLink.PROD_TO_DR);
        assertThat(ActionRules.verify(DrAction.RESTORATION_POST_TVT,
            volume(RelationshipState.BROKEN_OFF, null), RestorationPath.EXTENDED))
            .isEqualTo(ReplicationLink.PROD_TO_DR);
        assertThatThrownBy(() -> ActionRules.verify(DrAction.RESTORATION_POST_TVT,
            volume(RelationshipState.MIRRORED, null), RestorationPath.EXTENDED))
            .isInstanceOf(PreconditionException.class);
    }

    @Test
    void testUndeterminedSiteIsAlwaysRejected() {
        VolumeStatus unknown = volume(RelationshipState.UNKNOWN, null);
        assertThatThrownBy(() -> ActionRules.verify(DrAction.UPDATE, unknown, null))
            .isInstanceOf(PreconditionException.class)
            .hasMessageContaining("undetermined");
    }

    @ParameterizedTest
    @EnumSource(DrAction.class)
    void testEveryActionHasARule(DrAction action) {
        ActionRules.Rule rule = ActionRules.ruleFor(action);
        assertThat(rule.getAction()).isEqualTo(action);
        assertThat(rule.getRequirements()).isNotEmpty();
        assertThat(rule.getWritableSites()).isNotEmpty();
    }
}
