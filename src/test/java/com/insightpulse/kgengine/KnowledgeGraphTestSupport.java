package com.insightpulse.kgengine;

import com.insightpulse.kgengine.configuration.AppProperties;
import com.insightpulse.kgengine.knowledge.EdgeStore;
import com.insightpulse.kgengine.knowledge.EmbeddingService;
import com.insightpulse.kgengine.knowledge.MutationLog;
import com.insightpulse.kgengine.knowledge.NodeStore;
import com.insightpulse.kgengine.model.graph.EdgeCreate;
import com.insightpulse.kgengine.model.graph.KgEdge;
import com.insightpulse.kgengine.model.graph.KgNode;
import com.insightpulse.kgengine.model.graph.NodeUpsert;
import com.insightpulse.kgengine.search.SimilarityIndex;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

/**
 * Shared context for tests against the H2-backed stores. The embedding model is mocked;
 * vectors are three-dimensional under the test profile.
 */
@SpringBootTest
@ActiveProfiles("test")
public abstract class KnowledgeGraphTestSupport {

    @Autowired
    protected NodeStore nodeStore;

    @Autowired
    protected EdgeStore edgeStore;

    @Autowired
    protected MutationLog mutationLog;

    @Autowired
    protected SimilarityIndex similarityIndex;

    @Autowired
    protected AppProperties appProperties;

    @Autowired
    protected JdbcTemplate jdbcTemplate;

    @MockBean
    protected EmbeddingService embeddingService;

    @BeforeEach
    void resetGraph() {
        // mutation log rows are immutable through the application, so tests clear them directly
        jdbcTemplate.update("DELETE FROM KG_EDGES");
        jdbcTemplate.update("DELETE FROM KG_NODES");
        jdbcTemplate.update("DELETE FROM KG_MUTATION_LOG");
        similarityIndex.clear();
    }

    protected KgNode node(String slug, String nodeType, String title) {
        return nodeStore.upsertNode(NodeUpsert.builder()
                .slug(slug)
                .nodeType(nodeType)
                .title(title)
                .build());
    }

    protected KgNode node(String slug, String nodeType, String title, float... embedding) {
        KgNode node = node(slug, nodeType, title);
        nodeStore.setEmbedding(slug, embedding);
        return node;
    }

    protected KgEdge edge(String srcSlug, String dstSlug, String edgeType) {
        return edgeStore.createEdge(EdgeCreate.builder()
                .srcSlug(srcSlug)
                .dstSlug(dstSlug)
                .edgeType(edgeType)
                .build());
    }
}
