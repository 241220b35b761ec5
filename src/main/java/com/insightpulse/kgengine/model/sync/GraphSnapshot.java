package com.insightpulse.kgengine.model.sync;

import com.insightpulse.kgengine.model.graph.EdgeCreate;
import com.insightpulse.kgengine.model.graph.NodeUpsert;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Batch of nodes and edges delivered by an ingestion job or the seed file.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphSnapshot {

    private String source; // e.g. "seed", "github-webhook"

    @Builder.Default
    private List<NodeUpsert> nodes = new ArrayList<>();

    @Builder.Default
    private List<EdgeCreate> edges = new ArrayList<>();
}
