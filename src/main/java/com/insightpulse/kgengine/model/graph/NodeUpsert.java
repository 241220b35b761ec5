package com.insightpulse.kgengine.model.graph;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Input for a node upsert. Only non-null fields are written to an existing node;
 * a supplied props or metadata map replaces the stored one.
 * <p>
 * {@code source} names the issuer in the mutation log; when null the configured
 * {@code app.graph.mutation-source} is recorded.
 */
@Data
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@NoArgsConstructor
@AllArgsConstructor
public class NodeUpsert {

    private String slug;
    private String nodeType;
    private String title;
    private String description;
    private Map<String, Object> props;
    private Map<String, Object> metadata;
    private String source;
}
