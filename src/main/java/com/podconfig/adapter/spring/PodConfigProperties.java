package com.podconfig.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for the pod configuration core.
 */
@ConfigurationProperties(prefix = "podconfig")
public class PodConfigProperties {

    /**
     * Whether the pod configuration beans are created.
     */
    private boolean enabled = true;

    /**
     * Path to the YAML configuration file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:podconfig.yaml";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getConfigPath() {
        return configPath;
    }

    public void setConfigPath(String configPath) {
        this.configPath = configPath;
    }
}
