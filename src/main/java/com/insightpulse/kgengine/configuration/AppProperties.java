package com.insightpulse.kgengine.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private GraphProperties graph = new GraphProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private EmbeddingProperties embedding = new EmbeddingProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private SimilarityProperties similarity = new SimilarityProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private TraversalProperties traversal = new TraversalProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private ContextProperties context = new ContextProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private SeedProperties seed = new SeedProperties();
}
