package com.insightpulse.kgengine.exception;

import lombok.Getter;

@Getter
public class DuplicateEdgeException extends KnowledgeGraphException {

    private final String srcSlug;
    private final String dstSlug;
    private final String edgeType;

    public DuplicateEdgeException(String srcSlug, String dstSlug, String edgeType) {
        super("Edge already exists: " + srcSlug + " -[" + edgeType + "]-> " + dstSlug);
        this.srcSlug = srcSlug;
        this.dstSlug = dstSlug;
        this.edgeType = edgeType;
    }
}
