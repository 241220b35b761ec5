package com.insightpulse.kgengine.knowledge;

import com.insightpulse.kgengine.configuration.AppProperties;
import com.insightpulse.kgengine.exception.ValidationException;
import com.insightpulse.kgengine.model.graph.EdgeType;
import com.insightpulse.kgengine.model.graph.NodeType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Accepted node and edge type tags: the built-in enums plus any configured extras.
 */
@Slf4j
@Component
public class GraphTaxonomy {

    private final Set<String> nodeTypes;
    private final Set<String> edgeTypes;

    public GraphTaxonomy(AppProperties appProperties) {
        Set<String> nodes = new TreeSet<>();
        Arrays.stream(NodeType.values()).map(NodeType::getTag).forEach(nodes::add);
        nodes.addAll(appProperties.getGraph().getExtraNodeTypes());

        Set<String> edges = new TreeSet<>();
        Arrays.stream(EdgeType.values()).map(EdgeType::getTag).forEach(edges::add);
        edges.addAll(appProperties.getGraph().getExtraEdgeTypes());

        this.nodeTypes = Collections.unmodifiableSet(nodes);
        this.edgeTypes = Collections.unmodifiableSet(edges);

        log.info("Graph taxonomy: {} node types, {} edge types", nodeTypes.size(), edgeTypes.size());
    }

    public void requireNodeType(String tag) {
        if (tag == null || !nodeTypes.contains(tag)) {
            throw new ValidationException("Unknown node type '" + tag + "'. Accepted: " + nodeTypes);
        }
    }

    public void requireEdgeType(String tag) {
        if (tag == null || !edgeTypes.contains(tag)) {
            throw new ValidationException("Unknown edge type '" + tag + "'. Accepted: " + edgeTypes);
        }
    }
}
