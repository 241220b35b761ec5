package com.insightpulse.kgengine.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * Similarity index selection and clustering parameters.
 *
 * <pre>
 * app:
 *   similarity:
 *     mode: clustered
 *     clusters: 32
 *     probe-count: 4
 *     train-threshold: 1000
 * </pre>
 */
@Data
public class SimilarityProperties {

    @NotNull
    private Mode mode = Mode.EXACT;

    /**
     * Number of k-means centroids for the clustered index.
     */
    @Min(1)
    private int clusters = 32;

    /**
     * Clusters scanned per query, closest centroid first.
     */
    @Min(1)
    private int probeCount = 4;

    /**
     * Below this many vectors the clustered index answers with exact scans.
     */
    @Min(1)
    private int trainThreshold = 1000;

    @Min(1)
    private int kmeansIterations = 10;

    public enum Mode {
        EXACT,
        CLUSTERED
    }
}
