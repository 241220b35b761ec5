package com.insightpulse.kgengine.exception;

import lombok.Getter;

@Getter
public class EdgeNotFoundException extends NotFoundException {

    private final String srcSlug;
    private final String dstSlug;
    private final String edgeType;

    public EdgeNotFoundException(String srcSlug, String dstSlug, String edgeType) {
        super("Edge not found: " + srcSlug + " -[" + edgeType + "]-> " + dstSlug);
        this.srcSlug = srcSlug;
        this.dstSlug = dstSlug;
        this.edgeType = edgeType;
    }
}
