package io.drcontroller.audit;

import io.drcontroller.models.AuditRecord;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Audit log kept in a plain text file, one line per record.
 *
 * Appends hold an in-process lock and an exclusive file lock so concurrent writers,
 * threads or other controller processes sharing the file, never interleave lines.
 */
@Slf4j
public class FileAuditLog implements AuditLog {

    private final Path file;
    private final AuditLineFormat format;
    private final ReentrantLock writeLock = new ReentrantLock();

    public FileAuditLog(Path file, AuditLineFormat format) {
        this.file = file;
        this.format = format;
    }

    public Path getFile() {
        return file;
    }

    @Override
    public void record(AuditRecord record) throws AuditWriteException {
        byte[] line = (format.format(record) + System.lineSeparator()).getBytes(StandardCharsets.UTF_8);
        writeLock.lock();
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (FileChannel channel = FileChannel.open(file,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
                 FileLock ignored = channel.lock()) {
                ByteBuffer buffer = ByteBuffer.wrap(line);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(false);
            }
            log.info("Audit: {} {} by {} ({})", record.getAction(), record.getApplication(),
                record.getOperator(), record.getOutcome());
        } catch (IOException e) {
            throw new AuditWriteException("Failed to append audit record to " + file + ": " + e.getMessage(), e);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public List<AuditRecord> readRecent(String application, int limit) {
        List<AuditRecord> matching = new ArrayList<>();
        for (AuditRecord record : readAll()) {
            if (record.getApplication().equals(application)) {
                matching.add(record);
            }
        }
        Collections.reverse(matching);
        return matching.size() > limit ? new ArrayList<>(matching.subList(0, limit)) : matching;
    }

    @Override
    public Map<String, AuditRecord> latestByApplication() {
        Map<String, AuditRecord> latest = new LinkedHashMap<>();
        // later lines win
        for (AuditRecord record : readAll()) {
            latest.put(record.getApplication(), record);
        }
        return latest;
    }

    private List<AuditRecord> readAll() {
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return Collections.emptyList();
        } catch (IOException e) {
            log.warn("Failed to read audit log {}: {}", file, e.getMessage());
            return Collections.emptyList();
        }
        List<AuditRecord> records = new ArrayList<>(lines.size());
        for (String line : lines) {
            Optional<AuditRecord> record = format.parse(line);
            if (record.isPresent()) {
                records.add(record.get());
            } else if (!line.isBlank()) {
                log.debug("Skipping malformed audit line: {}", line);
            }
        }
        // stable: equal timestamps keep file order
        records.sort(Comparator.comparing(AuditRecord::getTimestamp));
        return records;
    }
}
