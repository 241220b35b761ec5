package com.insightpulse.kgengine.service.sync;

import com.insightpulse.kgengine.model.sync.BulkSyncResult;
import com.insightpulse.kgengine.model.sync.GraphSnapshot;

/**
 * Applies batches of nodes and edges delivered by ingestion jobs.
 */
public interface BulkSyncService {

    /**
     * Upsert every node, then create every edge. Each item is its own mutation; a failing item
     * is reported in the result and does not stop the batch. The whole snapshot is written to
     * the mutation log as one BULK_SYNC entry.
     */
    BulkSyncResult sync(GraphSnapshot snapshot);

    /**
     * Re-apply the snapshot stored in an earlier BULK_SYNC log entry.
     *
     * @throws com.insightpulse.kgengine.exception.NotFoundException if no entry has this id
     * @throws com.insightpulse.kgengine.exception.ValidationException if the entry is not a bulk sync
     */
    BulkSyncResult replay(Long logEntryId);
}
