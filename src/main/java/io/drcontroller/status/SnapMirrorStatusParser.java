package io.drcontroller.status;

import io.drcontroller.enums.RelationshipState;
import io.drcontroller.enums.ReplicationLink;
import io.drcontroller.executor.CommandOutput;
import io.drcontroller.executor.OntapCommands;
import io.drcontroller.models.Relationship;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Parses {@code snapmirror show -fields ...} output into a {@link Relationship}.
 *
 * Column boundaries are taken from the dashed separator line below the header so values
 * containing spaces (transfer timestamps) survive. Output without a header is read
 * positionally from the end of the row: schedule, policy, state, status, lag-time.
 *
 * Anything that cannot be read maps to {@link RelationshipState#UNKNOWN}.
 */
@Slf4j
public class SnapMirrorStatusParser {

    static final String FIELD_STATE = "state";
    static final String FIELD_STATUS = "status";
    static final String FIELD_LAG_TIME = "lag-time";
    static final String FIELD_SCHEDULE = "schedule";
    static final String FIELD_POLICY = "policy";
    static final String FIELD_LAST_TRANSFER = "last-transfer-end-timestamp";

    public Relationship parse(String volumeName, ReplicationLink link, String sourcePath,
                              String destinationPath, CommandOutput commandOutput) {
        if (commandOutput.isFailed()) {
            return Relationship.unknown(volumeName, link, sourcePath, destinationPath, commandOutput.errorDetail());
        }
        String output = commandOutput.outputOrEmpty();
        if (output.contains(OntapCommands.NO_ENTRIES)) {
            return Relationship.absent(volumeName, link, sourcePath, destinationPath);
        }

        List<String> lines = output.lines().collect(Collectors.toList());
        Map<String, String> fields = readTabular(lines, destinationPath);
        if (fields == null) {
            fields = readPositional(lines, destinationPath);
        }
        if (fields == null) {
            log.debug("No row for {} in snapmirror output: {}", destinationPath, output);
            return Relationship.unknown(volumeName, link, sourcePath, destinationPath,
                "Unrecognized snapmirror show output for " + destinationPath);
        }

        String mirrorState = emptyToNull(fields.get(FIELD_STATE));
        String status = emptyToNull(fields.get(FIELD_STATUS));
        RelationshipState state = toState(mirrorState, status);
        if (state == RelationshipState.UNKNOWN) {
            log.warn("Unrecognized relationship state '{}' / status '{}' for {}", mirrorState, status, destinationPath);
        }

        String source = emptyToNull(fields.get("source-path"));
        return Relationship.builder()
            .volumeName(volumeName)
            .link(link)
            .sourcePath(source != null ? source : sourcePath)
            .destinationPath(destinationPath)
            .state(state)
            .mirrorState(mirrorState)
            .status(status)
            .lagTime(emptyToNull(fields.get(FIELD_LAG_TIME)))
            .lastTransferTimestamp(emptyToNull(fields.get(FIELD_LAST_TRANSFER)))
            .schedule(emptyToNull(fields.get(FIELD_SCHEDULE)))
            .policy(emptyToNull(fields.get(FIELD_POLICY)))
            .present(true)
            .build();
    }

    /**
     * Map the raw mirror state and relationship status columns onto the lifecycle state.
     */
    public static RelationshipState toState(String mirrorState, String status) {
        if (mirrorState == null) {
            return RelationshipState.UNKNOWN;
        }
        String m = mirrorState.trim().toLowerCase(Locale.ROOT);
        String s = status == null ? "" : status.trim().toLowerCase(Locale.ROOT);

        switch (m) {
            case "uninitialized":
                return RelationshipState.UNINITIALIZED;
            case "snapmirrored":
                switch (s) {
                    case "idle":
                        return RelationshipState.MIRRORED;
                    case "transferring":
                    case "preparing":
                    case "finalizing":
                        return RelationshipState.TRANSFERRING;
                    case "quiescing":
                    case "quiesced":
                    case "breaking":
                        return RelationshipState.QUIESCED;
                    default:
                        return RelationshipState.UNKNOWN;
                }
            case "broken-off":
                switch (s) {
                    case "idle":
                    case "quiesced":
                        return RelationshipState.BROKEN_OFF;
                    case "transferring":
                    case "preparing":
                    case "finalizing":
                        return RelationshipState.RESYNCING;
                    default:
                        return RelationshipState.UNKNOWN;
                }
            default:
                return RelationshipState.UNKNOWN;
        }
    }

    private Map<String, String> readTabular(List<String> lines, String destinationPath) {
        for (int i = 0; i + 1 < lines.size(); i++) {
            String header = lines.get(i);
            String separator = lines.get(i + 1);
            if (!header.contains("destination-path") || !isSeparator(separator)) {
                continue;
            }
            List<int[]> columns = columnRanges(separator);
            for (int j = i + 2; j < lines.size(); j++) {
                String row = lines.get(j);
                if (!row.contains(destinationPath)) {
                    continue;
                }
                Map<String, String> fields = new HashMap<>();
                for (int c = 0; c < columns.size(); c++) {
                    boolean last = c == columns.size() - 1;
                    String name = slice(header, columns.get(c), last);
                    fields.put(name, slice(row, columns.get(c), last));
                }
                return fields.containsKey(FIELD_STATE) ? fields : null;
            }
        }
        return null;
    }

    private Map<String, String> readPositional(List<String> lines, String destinationPath) {
        for (String line : lines) {
            if (!line.contains(destinationPath)) {
                continue;
            }
            String[] tokens = line.trim().split("\\s+");
            if (tokens.length < 5) {
                return null;
            }
            Map<String, String> fields = new HashMap<>();
            fields.put(FIELD_LAG_TIME, tokens[tokens.length - 1]);
            fields.put(FIELD_STATUS, tokens[tokens.length - 2]);
            fields.put(FIELD_STATE, tokens[tokens.length - 3]);
            fields.put(FIELD_POLICY, tokens[tokens.length - 4]);
            fields.put(FIELD_SCHEDULE, tokens[tokens.length - 5]);
            return fields;
        }
        return null;
    }

    private static boolean isSeparator(String line) {
        String trimmed = line.trim();
        return !trimmed.isEmpty() && trimmed.chars().allMatch(ch -> ch == '-' || ch == ' ');
    }

    private static List<int[]> columnRanges(String separator) {
        List<int[]> ranges = new ArrayList<>();
        int i = 0;
        while (i < separator.length()) {
            if (separator.charAt(i) == '-') {
                int start = i;
                while (i < separator.length() && separator.charAt(i) == '-') {
                    i++;
                }
                ranges.add(new int[]{start, i});
            } else {
                i++;
            }
        }
        // Each column extends up to the start of the next one
        for (int c = 0; c + 1 < ranges.size(); c++) {
            ranges.get(c)[1] = ranges.get(c + 1)[0];
        }
        return ranges;
    }

    private static String slice(String line, int[] range, boolean toEnd) {
        if (range[0] >= line.length()) {
            return "";
        }
        int end = toEnd ? line.length() : Math.min(range[1], line.length());
        return line.substring(range[0], end).trim();
    }

    private static String emptyToNull(String value) {
        return value == null || value.isBlank() || "-".equals(value.trim()) ? null : value.trim();
    }
}
