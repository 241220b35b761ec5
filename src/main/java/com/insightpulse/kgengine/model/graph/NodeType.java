package com.insightpulse.kgengine.model.graph;

/**
 * Built-in node taxonomy. Deployments may accept further tags through
 * {@code app.graph.extra-node-types}.
 */
public enum NodeType {
    PRODUCT("product"),
    SERVICE("service"),
    DATABASE("database"),
    SCHEMA("schema"),
    TABLE("table"),
    WORKFLOW("workflow"),
    REPOSITORY("repository"),
    SPEC_KIT("spec_kit"),
    MODULE("module"),
    DASHBOARD("dashboard"),
    AGENT("agent"),
    SKILL("skill"),
    WORKTREE_BRANCH("worktree_branch"),
    MIGRATION("migration"),
    DEPLOYMENT("deployment");

    private final String tag;

    NodeType(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }
}
