package com.insightpulse.kgengine.config;

import com.insightpulse.kgengine.configuration.AppProperties;
import com.insightpulse.kgengine.configuration.SimilarityProperties;
import com.insightpulse.kgengine.search.SimilarityIndex;
import com.insightpulse.kgengine.search.impl.ClusteredSimilarityIndex;
import com.insightpulse.kgengine.search.impl.ExactSimilarityIndex;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Similarity index wiring.
 *
 * <p>{@code app.similarity.mode=exact} scans every vector (full recall, linear cost).
 * {@code clustered} probes the closest k-means buckets only and trades recall for speed
 * once the graph passes {@code train-threshold} embedded nodes.
 */
@Slf4j
@Configuration
public class SimilarityIndexConfig {

    @Bean
    public SimilarityIndex similarityIndex(AppProperties appProperties) {
        int dimensions = appProperties.getEmbedding().getDimensions();
        SimilarityProperties similarity = appProperties.getSimilarity();

        if (similarity.getMode() == SimilarityProperties.Mode.CLUSTERED) {
            log.info("Similarity index: clustered ({} clusters, probe {}, train at {}), {} dimensions",
                    similarity.getClusters(), similarity.getProbeCount(), similarity.getTrainThreshold(), dimensions);
            return new ClusteredSimilarityIndex(dimensions, similarity.getClusters(), similarity.getProbeCount(),
                    similarity.getTrainThreshold(), similarity.getKmeansIterations());
        }
        log.info("Similarity index: exact, {} dimensions", dimensions);
        return new ExactSimilarityIndex(dimensions);
    }
}
