package com.insightpulse.kgengine.model.graph;

/**
 * Built-in relationship taxonomy. Deployments may accept further tags through
 * {@code app.graph.extra-edge-types}.
 */
public enum EdgeType {
    USES_SERVICE("uses_service"),
    DEPENDS_ON("depends_on"),
    STORES_DATA_IN("stores_data_in"),
    HAS_DASHBOARD("has_dashboard"),
    IMPLEMENTS_SPEC("implements_spec"),
    MERGED_FROM("merged_from"),
    DEPLOYED_TO("deployed_to"),
    TRIGGERS_WORKFLOW("triggers_workflow"),
    HAS_MIGRATION("has_migration"),
    POWERS_AGENT("powers_agent"),
    HAS_SEED_DATA("has_seed_data"),
    ENFORCES_RLS("enforces_rls"),
    VALIDATED_BY("validated_by");

    private final String tag;

    EdgeType(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }
}
