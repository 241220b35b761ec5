package com.insightpulse.kgengine.knowledge;

import com.insightpulse.kgengine.model.audit.MutationLogEntry;
import com.insightpulse.kgengine.model.audit.MutationRecord;

import java.util.List;
import java.util.Optional;

/**
 * Append-only audit ledger of node and edge mutations.
 * Read methods serve audit and bulk-sync replay; query paths never consult the log.
 */
public interface MutationLog {

    /**
     * Append within the caller's transaction, so the entry commits or rolls back with the mutation.
     */
    MutationLogEntry record(MutationRecord record);

    /**
     * Append in a new transaction that commits even if the caller's transaction rolls back.
     * Used for failed mutations.
     */
    MutationLogEntry recordIsolated(MutationRecord record);

    List<MutationLogEntry> history(String target);

    Optional<MutationLogEntry> findEntry(Long id);

    List<MutationLogEntry> recent(int limit);
}
