package com.insightpulse.kgengine.model.graph;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@NoArgsConstructor
@AllArgsConstructor
public class EdgeCreate {

    private String srcSlug;
    private String dstSlug;
    private String edgeType;
    private Double weight; // null means KgEdge.DEFAULT_WEIGHT
    private Map<String, Object> props;
    private Map<String, Object> metadata;
    private String source; // null means app.graph.mutation-source

    public double effectiveWeight() {
        return weight == null ? KgEdge.DEFAULT_WEIGHT : weight;
    }

    public String describe() {
        return KgEdge.describe(srcSlug, dstSlug, edgeType);
    }
}
