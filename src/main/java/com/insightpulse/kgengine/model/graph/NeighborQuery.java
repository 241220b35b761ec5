package com.insightpulse.kgengine.model.graph;

import com.insightpulse.kgengine.knowledge.RelationshipDirection;
import lombok.Builder;
import lombok.Data;

/**
 * Neighbor expansion request. Defaults: outgoing edges of any type, one hop.
 */
@Data
@Builder
public class NeighborQuery {

    private String startSlug;

    /**
     * Only follow edges of this type; null follows every type.
     */
    private String edgeType;

    @Builder.Default
    private RelationshipDirection direction = RelationshipDirection.OUTGOING;

    @Builder.Default
    private int maxDepth = 1;

    public static NeighborQuery of(String startSlug) {
        return NeighborQuery.builder().startSlug(startSlug).build();
    }
}
