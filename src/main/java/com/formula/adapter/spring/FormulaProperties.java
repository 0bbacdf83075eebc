package com.formula.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for the formula engine.
 */
@ConfigurationProperties(prefix = "formula")
public class FormulaProperties {

    /**
     * Whether the formula engine is enabled.
     */
    private boolean enabled = true;

    /**
     * Path to the engine configuration file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:formula.yaml";

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
