package io.drcontroller.audit;

import io.drcontroller.models.AuditRecord;
import org.junit.jupiter.api.Test;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class AuditLineFormatTest {

    private static final ZoneId ZONE = ZoneId.of("UTC");

    private final AuditLineFormat format = new AuditLineFormat(ZONE);

    private static AuditRecord record(String action, String operator, String outcome) {
        return AuditRecord.builder()
            .action(action)
            .application("APP1")
            .operator(operator)
            .outcome(outcome)
            .timestamp(ZonedDateTime.of(2026, 10, 17, 14, 15, 4, 0, ZONE))
            .build();
    }

    @Test
    void testFormat_Line() {
        // When
        String line = format.format(record("quiesce", "jdoe", "succeeded 2/2"));

        // Then
        assertThat(line).isEqualTo("17-Oct-2026 02:15:04 PM | action=quiesce | app=APP1 | user=jdoe | outcome=succeeded 2/2");
    }

    @Test
    void testFormat_ConvertsToConfiguredZone() {
        // Given
        AuditLineFormat paris = new AuditLineFormat(ZoneId.of("Europe/Paris"));

        // When
        String line = paris.format(record("update", "jdoe", "succeeded 1/1"));

        // Then
        assertThat(line).startsWith("17-Oct-2026 04:15:04 PM |");
    }

    @Test
    void testFormat_SeparatorAndNewlinesNeutralised() {
        // When
        String line = format.format(record("update", "evil | user=root\nnext", "succeeded 1/1"));

        // Then
        assertThat(line).doesNotContain("\n");
        assertThat(line.split(" \\| ")).hasSize(5);
        assertThat(format.parse(line)).map(AuditRecord::getOperator).contains("evil / user=root next");
    }

    @Test
    void testParse_FormattedLine() {
        // Given
        AuditRecord original = record("recovery", "ops", "partial 1/2, failed 1");

        // When
        Optional<AuditRecord> parsed = format.parse(format.format(original));

        // Then
        assertThat(parsed).isPresent();
        assertThat(parsed.get().getAction()).isEqualTo("recovery");
        assertThat(parsed.get().getOutcome()).isEqualTo("partial 1/2, failed 1");
        assertThat(parsed.get().getTimestamp().toInstant()).isEqualTo(original.getTimestamp().toInstant());
    }

    @Test
    void testParse_MalformedLines() {
        assertThat(format.parse("")).isEmpty();
        assertThat(format.parse("not an audit line")).isEmpty();
        assertThat(format.parse("yesterday | action=a | app=b | user=c | outcome=d")).isEmpty();
        assertThat(format.parse("17-Oct-2026 02:15:04 PM | action=a | app=b | user=c")).isEmpty();
        assertThat(format.parse("17-Oct-2026 02:15:04 PM | action=a | app=b | who=c | outcome=d")).isEmpty();
    }
}
