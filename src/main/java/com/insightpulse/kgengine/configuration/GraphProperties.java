package com.insightpulse.kgengine.configuration;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Write-side rules for the node and edge stores.
 */
@Data
public class GraphProperties {

    /**
     * Node type tags accepted in addition to the built-in taxonomy.
     */
    private List<String> extraNodeTypes = new ArrayList<>();

    /**
     * Edge type tags accepted in addition to the built-in taxonomy.
     */
    private List<String> extraEdgeTypes = new ArrayList<>();

    /**
     * When true, edges may reference slugs that have no node (soft references).
     */
    private boolean allowDanglingEdges = false;

    @NotNull
    private DuplicateEdgePolicy duplicateEdgePolicy = DuplicateEdgePolicy.IGNORE;

    /**
     * Value written to the mutation log's source column for direct store calls.
     */
    @NotBlank
    private String mutationSource = "kg-engine";

    public enum DuplicateEdgePolicy {
        /** Return the existing edge, log the attempt as a successful no-op. */
        IGNORE,

        /** Reject with DuplicateEdgeException. */
        FAIL
    }
}
