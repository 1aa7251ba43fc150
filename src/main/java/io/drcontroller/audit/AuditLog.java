package io.drcontroller.audit;

import io.drcontroller.models.AuditRecord;

import java.util.List;
import java.util.Map;

/**
 * Append-only record of confirmed operator actions.
 */
public interface AuditLog {

    void record(AuditRecord record) throws AuditWriteException;

    /**
     * Most recent records of one application, newest first.
     */
    List<AuditRecord> readRecent(String application, int limit);

    /**
     * Latest record per application.
     */
    Map<String, AuditRecord> latestByApplication();
}
