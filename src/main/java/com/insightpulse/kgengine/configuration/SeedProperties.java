package com.insightpulse.kgengine.configuration;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class SeedProperties {

    private boolean enabled = false;

    @NotBlank
    private String location = "classpath:kg/seed-graph.json";
}
