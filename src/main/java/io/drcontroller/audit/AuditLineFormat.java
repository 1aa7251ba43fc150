package io.drcontroller.audit;

import io.drcontroller.models.AuditRecord;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Single-line text form of an audit record:
 * {@code 17-Oct-2026 02:15:04 PM | action=quiesce | app=APP1 | user=jdoe | outcome=succeeded 2/2}
 */
public class AuditLineFormat {

    public static final DateTimeFormatter TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("dd-MMM-yyyy hh:mm:ss a", Locale.ENGLISH);

    private static final String SEPARATOR = " | ";

    private final ZoneId zone;

    public AuditLineFormat(ZoneId zone) {
        this.zone = zone;
    }

    public ZoneId getZone() {
        return zone;
    }

    public String format(AuditRecord record) {
        return TIMESTAMP_FORMAT.format(record.getTimestamp().withZoneSameInstant(zone))
            + SEPARATOR + "action=" + sanitize(record.getAction())
            + SEPARATOR + "app=" + sanitize(record.getApplication())
            + SEPARATOR + "user=" + sanitize(record.getOperator())
            + SEPARATOR + "outcome=" + sanitize(record.getOutcome());
    }

    /**
     * Parse a line written by {@link #format}. Empty for malformed lines.
     */
    public Optional<AuditRecord> parse(String line) {
        if (line == null || line.isBlank()) {
            return Optional.empty();
        }
        String[] parts = line.split(" \\| ");
        if (parts.length != 5) {
            return Optional.empty();
        }
        Map<String, String> values = new HashMap<>();
        for (int i = 1; i < parts.length; i++) {
            int eq = parts[i].indexOf('=');
            if (eq <= 0) {
                return Optional.empty();
            }
            values.put(parts[i].substring(0, eq), parts[i].substring(eq + 1));
        }
        if (!values.keySet().containsAll(List.of("action", "app", "user", "outcome"))) {
            return Optional.empty();
        }
        try {
            LocalDateTime timestamp = LocalDateTime.parse(parts[0].trim(), TIMESTAMP_FORMAT);
            return Optional.of(AuditRecord.builder()
                .timestamp(timestamp.atZone(zone))
                .action(values.get("action"))
                .application(values.get("app"))
                .operator(values.get("user"))
                .outcome(values.get("outcome"))
                .build());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    // keep a record on one line and keep the field separator unambiguous
    private static String sanitize(String value) {
        if (value == null) {
            return "";
        }
        return value.replace('\n', ' ').replace('\r', ' ').replace("|", "/");
    }
}
