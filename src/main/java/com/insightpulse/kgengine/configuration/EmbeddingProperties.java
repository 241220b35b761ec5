package com.insightpulse.kgengine.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class EmbeddingProperties {

    @NotNull
    private Provider provider = Provider.OLLAMA;

    /**
     * Vector length every stored embedding must have.
     */
    @Min(1)
    private int dimensions = 1024;

    /**
     * Embed title + description for nodes that have no embedding after an upsert.
     */
    private boolean autoEmbed = false;

    @NotBlank
    private String baseUrl = "http://localhost:11434";

    @NotBlank
    private String modelName = "mxbai-embed-large";

    @Min(1)
    private int timeoutSeconds = 120;

    @Min(0)
    private int maxRetries = 3;

    public enum Provider {
        OLLAMA,
        NONE
    }
}
