package io.drcontroller.status;

import io.drcontroller.enums.RelationshipState;
import io.drcontroller.enums.ReplicationLink;
import io.drcontroller.executor.CommandOutput;
import io.drcontroller.executor.FakeOntapClusters;
import io.drcontroller.models.Relationship;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class SnapMirrorStatusParserTest {

    private static final String SOURCE = "prod_svm:app1_vol1";
    private static final String DESTINATION = "dr_svm:app1_vol1";

    private final SnapMirrorStatusParser parser = new SnapMirrorStatusParser();

    private Relationship parse(String output) {
        return parser.parse("app1_vol1", ReplicationLink.PROD_TO_DR, SOURCE, DESTINATION, CommandOutput.of(output));
    }

    @Test
    void testParse_TabularOutput() {
        // Given
        String output = FakeOntapClusters.showTable(SOURCE, DESTINATION, "Snapmirrored", "Idle",
            "hourly", "MirrorAllSnapshots", "0:5:12");

        // When
        Relationship relationship = parse(output);

        // Then
        assertThat(relationship.isPresent()).isTrue();
        assertThat(relationship.getState()).isEqualTo(RelationshipState.MIRRORED);
        assertThat(relationship.getMirrorState()).isEqualTo("Snapmirrored");
        assertThat(relationship.getStatus()).isEqualTo("Idle");
        assertThat(relationship.getSchedule()).isEqualTo("hourly");
        assertThat(relationship.getPolicy()).isEqualTo("MirrorAllSnapshots");
        assertThat(relationship.getLagTime()).isEqualTo("0:5:12");
        assertThat(relationship.getLastTransferTimestamp()).isEqualTo("10/17 11:02:33");
        assertThat(relationship.getSourcePath()).isEqualTo(SOURCE);
        assertThat(relationship.getError()).isNull();
    }

    @Test
    void testParse_PositionalOutputWithoutHeader() {
        // Given
        String output = SOURCE + " " + DESTINATION + " daily MirrorAndVault Broken-off Idle 1:02:03\n";

        // When
        Relationship relationship = parse(output);

        // Then
        assertThat(relationship.getState()).isEqualTo(RelationshipState.BROKEN_OFF);
        assertThat(relationship.getSchedule()).isEqualTo("daily");
        assertThat(relationship.getPolicy()).isEqualTo("MirrorAndVault");
        assertThat(relationship.getLagTime()).isEqualTo("1:02:03");
    }

    @Test
    void testParse_NoEntries() {
        Relationship relationship = parse("There are no entries matching your query.\n");

        assertThat(relationship.isPresent()).isFalse();
        assertThat(relationship.getState()).isNull();
        assertThat(relationship.getError()).isNull();
    }

    @Test
    void testParse_UnexpectedStatusText_IsUnknown() {
        // Given
        String output = FakeOntapClusters.showTable(SOURCE, DESTINATION, "Snapmirrored", "Wobbling",
            "hourly", "MirrorAllSnapshots", "-");

        // When
        Relationship relationship = parse(output);

        // Then
        assertThat(relationship.isPresent()).isTrue();
        assertThat(relationship.getState()).isEqualTo(RelationshipState.UNKNOWN);
        assertThat(relationship.getStatus()).isEqualTo("Wobbling");
        assertThat(relationship.getLagTime()).isNull();
    }

    @Test
    void testParse_Garbage_IsUnknown() {
        Relationship relationship = parse("%%% something went sideways %%%");

        assertThat(relationship.getState()).isEqualTo(RelationshipState.UNKNOWN);
        assertThat(relationship.getError()).contains(DESTINATION);
    }

    @Test
    void testParse_EmptyOutput_IsUnknown() {
        assertThat(parse("").getState()).isEqualTo(RelationshipState.UNKNOWN);
    }

    @Test
    void testParse_ErrorStream_IsUnknownWithError() {
        // When
        Relationship relationship = parser.parse("app1_vol1", ReplicationLink.PROD_TO_DR, SOURCE, DESTINATION,
            new CommandOutput("", "Error: command failed: permission denied"));

        // Then
        assertThat(relationship.getState()).isEqualTo(RelationshipState.UNKNOWN);
        assertThat(relationship.getError()).isEqualTo("Error: command failed: permission denied");
    }

    @ParameterizedTest
    @CsvSource({
        "Snapmirrored, Idle, MIRRORED",
        "Snapmirrored, Transferring, TRANSFERRING",
        "Snapmirrored, Finalizing, TRANSFERRING",
        "Snapmirrored, Quiesced, QUIESCED",
        "Snapmirrored, Quiescing, QUIESCED",
        "Broken-off, Idle, BROKEN_OFF",
        "Broken-off, Transferring, RESYNCING",
        "Uninitialized, Idle, UNINITIALIZED",
        "snapmirrored, idle, MIRRORED",
        "Snapmirrored, Aborting, UNKNOWN",
        "Broken-off, Checking, UNKNOWN",
        "In-sync, Idle, UNKNOWN",
        "Error, Error, UNKNOWN"
    })
    void testToState(String mirrorState, String status, RelationshipState expected) {
        assertThat(SnapMirrorStatusParser.toState(mirrorState, status)).isEqualTo(expected);
    }

    @Test
    void testToState_MissingMirrorState() {
        assertThat(SnapMirrorStatusParser.toState(null, "Idle")).isEqualTo(RelationshipState.UNKNOWN);
    }
}
