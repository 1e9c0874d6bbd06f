package com.premiergroup.ad_metrics_synth;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@SpringBootApplication
@EnableJpaRepositories
public class AdMetricsSynthApplication {

    public static void main(String[] args) {
        SpringApplication.run(AdMetricsSynthApplication.class, args);
    }
}
