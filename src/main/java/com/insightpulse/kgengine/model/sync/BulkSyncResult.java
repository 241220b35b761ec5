package com.insightpulse.kgengine.model.sync;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
public class BulkSyncResult {

    private String source;
    private int nodesUpserted;
    private int edgesCreated;
    private int edgesSkipped; // duplicates, treated as no-ops
    private int embeddingsComputed;

    @Builder.Default
    private List<String> failures = new ArrayList<>();

    private Long logEntryId;

    public boolean isSuccessful() {
        return failures.isEmpty();
    }
}
