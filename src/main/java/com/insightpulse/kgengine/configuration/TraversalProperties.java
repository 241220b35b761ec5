package com.insightpulse.kgengine.configuration;

import com.insightpulse.kgengine.knowledge.RelationshipDirection;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class TraversalProperties {

    /**
     * Hard ceiling on max_depth for neighbor expansion and path search.
     */
    @Min(1)
    @Max(50)
    private int maxDepth = 5;

    /**
     * Direction shortest-path search follows. Fixed per deployment.
     */
    @NotNull
    private RelationshipDirection pathDirection = RelationshipDirection.OUTGOING;
}
