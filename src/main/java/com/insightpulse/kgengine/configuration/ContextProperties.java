package com.insightpulse.kgengine.configuration;

import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class ContextProperties {

    @Min(1)
    private int defaultMaxNodes = 20;

    @Min(1)
    private int maxNodesLimit = 200;
}
