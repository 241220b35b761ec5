package com.insightpulse.kgengine.exception;

import lombok.Getter;

@Getter
public class DepthLimitExceededException extends KnowledgeGraphException {

    private final int requestedDepth;
    private final int maxDepth;

    public DepthLimitExceededException(int requestedDepth, int maxDepth) {
        super("Requested depth " + requestedDepth + " exceeds configured maximum " + maxDepth);
        this.requestedDepth = requestedDepth;
        this.maxDepth = maxDepth;
    }
}
