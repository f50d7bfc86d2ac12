package com.example.deltacode.config;

import com.example.deltacode.domain.ScoringConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ScoringProperties.class)
public class DeltaCodeConfiguration {
    private static final Logger log = LogManager.getLogger(DeltaCodeConfiguration.class);

    @Bean
    public ScoringConfig scoringConfig(ScoringProperties properties) {
        ScoringConfig config = properties.toScoringConfig();
        log.info(
                "Scoring with weights {} and tracked attributes {}",
                config.weights(),
                config.trackedAttributes());
        return config;
    }
}
