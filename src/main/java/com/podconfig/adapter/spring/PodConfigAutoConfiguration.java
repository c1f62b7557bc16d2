package com.podconfig.adapter.spring;

import com.podconfig.config.PodConfig;
import com.podconfig.config.PodConfigLoader;
import com.podconfig.policy.CriticalityPolicy;
import com.podconfig.policy.CriticalityPolicyFactory;
import com.podconfig.provenance.PodProvenance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for pod provenance and criticality classification.
 */
@Configuration
@ConditionalOnProperty(prefix = "podconfig", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(PodConfigProperties.class)
public class PodConfigAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(PodConfigAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public PodConfig podConfig(PodConfigProperties properties) {
        log.info("Loading pod configuration from: {}", properties.getConfigPath());
        return PodConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public PodProvenance podProvenance() {
        return new PodProvenance();
    }

    @Bean
    @ConditionalOnMissingBean
    public CriticalityPolicy criticalityPolicy(PodConfig config, PodProvenance provenance) {
        log.info("Creating CriticalityPolicy for sources {}", config.sources());
        return CriticalityPolicyFactory.create(config, provenance);
    }
}
