package io.drcontroller.status;

import io.drcontroller.enums.RelationshipState;
import io.drcontroller.enums.ReplicationDirection;
import io.drcontroller.enums.ReplicationLink;
import io.drcontroller.enums.Site;
import io.drcontroller.models.Relationship;
import io.drcontroller.models.VolumeStatus;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DirectionResolverTest {

    private final DirectionResolver resolver = new DirectionResolver();

    private static Relationship rel(ReplicationLink link, RelationshipState state) {
        return Relationship.builder().volumeName("v").link(link).state(state).present(true).build();
    }

    private static Relationship absent(ReplicationLink link) {
        return Relationship.absent("v", link, "a:v", "b:v");
    }

    private static VolumeStatus volume(String name, Site site) {
        return VolumeStatus.builder().volumeName(name).writableSite(site).build();
    }

    @Test
    void testWritableSite_ProdToDrLink() {
        assertThat(resolver.writableSite(rel(ReplicationLink.PROD_TO_DR, RelationshipState.MIRRORED))).isEqualTo(Site.PROD);
        assertThat(resolver.writableSite(rel(ReplicationLink.PROD_TO_DR, RelationshipState.QUIESCED))).isEqualTo(Site.PROD);
        assertThat(resolver.writableSite(rel(ReplicationLink.PROD_TO_DR, RelationshipState.RESYNCING))).isEqualTo(Site.PROD);
        assertThat(resolver.writableSite(rel(ReplicationLink.PROD_TO_DR, RelationshipState.BROKEN_OFF))).isEqualTo(Site.DR);
    }

    @Test
    void testWritableSite_DrToProdLinkIsMirrorImage() {
        assertThat(resolver.writableSite(rel(ReplicationLink.DR_TO_PROD, RelationshipState.MIRRORED))).isEqualTo(Site.DR);
        assertThat(resolver.writableSite(rel(ReplicationLink.DR_TO_PROD, RelationshipState.BROKEN_OFF))).isEqualTo(Site.PROD);
    }

    @Test
    void testWritableSite_UnknownAndCancelledAreUndetermined() {
        assertThat(resolver.writableSite(rel(ReplicationLink.PROD_TO_DR, RelationshipState.UNKNOWN))).isNull();
        assertThat(resolver.writableSite(rel(ReplicationLink.PROD_TO_DR, RelationshipState.CANCELLED))).isNull();
        assertThat(resolver.writableSite(absent(ReplicationLink.PROD_TO_DR))).isNull();
    }

    @Test
    void testVolumeSite_OnlyOneLinkPresent() {
        assertThat(resolver.writableSite(rel(ReplicationLink.PROD_TO_DR, RelationshipState.MIRRORED),
            absent(ReplicationLink.DR_TO_PROD))).isEqualTo(Site.PROD);
    }

    @Test
    void testVolumeSite_LinksAgree() {
        // after recovery-extended: PROD->DR broken, DR->PROD mirrored, both say DR
        assertThat(resolver.writableSite(rel(ReplicationLink.PROD_TO_DR, RelationshipState.BROKEN_OFF),
            rel(ReplicationLink.DR_TO_PROD, RelationshipState.MIRRORED))).isEqualTo(Site.DR);
    }

    @Test
    void testVolumeSite_LinksDisagree() {
        assertThat(resolver.writableSite(rel(ReplicationLink.PROD_TO_DR, RelationshipState.MIRRORED),
            rel(ReplicationLink.DR_TO_PROD, RelationshipState.MIRRORED))).isNull();
    }

    @Test
    void testVolumeSite_AnyUndeterminedLink() {
        assertThat(resolver.writableSite(rel(ReplicationLink.PROD_TO_DR, RelationshipState.MIRRORED),
            rel(ReplicationLink.DR_TO_PROD, RelationshipState.UNKNOWN))).isNull();
    }

    @Test
    void testVolumeSite_NoLinks() {
        assertThat(resolver.writableSite(absent(ReplicationLink.PROD_TO_DR), absent(ReplicationLink.DR_TO_PROD))).isNull();
    }

    @Test
    void testResolve_Unanimous() {
        assertThat(resolver.resolve(List.of(volume("a", Site.PROD), volume("b", Site.PROD))))
            .isEqualTo(ReplicationDirection.PROD_TO_DR);
        assertThat(resolver.resolve(List.of(volume("a", Site.DR), volume("b", Site.DR))))
            .isEqualTo(ReplicationDirection.DR_TO_PROD);
    }

    @Test
    void testResolve_MixedIsInconsistent() {
        assertThat(resolver.resolve(List.of(volume("a", Site.PROD), volume("b", Site.DR), volume("c", Site.PROD))))
            .isEqualTo(ReplicationDirection.INCONSISTENT);
    }

    @Test
    void testResolve_SingleUndeterminedVolumeIsInconsistent() {
        assertThat(resolver.resolve(List.of(volume("a", Site.PROD), volume("b", null))))
            .isEqualTo(ReplicationDirection.INCONSISTENT);
    }

    @Test
    void testResolve_NoVolumesIsInconsistent() {
        assertThat(resolver.resolve(List.of())).isEqualTo(ReplicationDirection.INCONSISTENT);
    }
}
