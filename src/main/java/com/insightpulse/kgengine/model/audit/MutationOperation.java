package com.insightpulse.kgengine.model.audit;

public enum MutationOperation {
    NODE_UPSERT,
    EDGE_CREATE,
    NODE_DELETE,
    EDGE_DELETE,
    BULK_SYNC,
    EMBEDDING_SET
}
