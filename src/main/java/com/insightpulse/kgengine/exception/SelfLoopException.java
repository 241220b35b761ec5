package com.insightpulse.kgengine.exception;

import lombok.Getter;

@Getter
public class SelfLoopException extends KnowledgeGraphException {

    private final String slug;
    private final String edgeType;

    public SelfLoopException(String slug, String edgeType) {
        super("Self-loop rejected: " + slug + " -[" + edgeType + "]-> " + slug);
        this.slug = slug;
        this.edgeType = edgeType;
    }
}
