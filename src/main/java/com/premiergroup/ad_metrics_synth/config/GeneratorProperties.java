package com.premiergroup.ad_metrics_synth.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "generator")
@Data
public class GeneratorProperties {

    /**
     * Seed used when a generation request carries none. Left empty, every such run draws a fresh one.
     */
    private Long defaultSeed;

    /**
     * Length of the reference video asset used for average watch time.
     */
    private int assetSeconds = 30;

    private Cors cors = new Cors();

    @Data
    public static class Cors {
        private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:4200", "http://localhost:8080"));
    }
}
