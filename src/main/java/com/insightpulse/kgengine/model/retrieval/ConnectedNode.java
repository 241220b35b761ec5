package com.insightpulse.kgengine.model.retrieval;

public record ConnectedNode(
        String slug,
        String nodeType,
        String title,
        String edgeType
) {
}
