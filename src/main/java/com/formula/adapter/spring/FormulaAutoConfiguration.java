package com.formula.adapter.spring;

import com.formula.config.ConfigLoader;
import com.formula.config.FormulaConfig;
import com.formula.engine.FormulaEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Spring Boot auto-configuration for the formula engine.
 */
@AutoConfiguration
@ConditionalOnProperty(prefix = "formula", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(FormulaProperties.class)
public class FormulaAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(FormulaAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public FormulaConfig formulaConfig(FormulaProperties properties) {
        log.info("Loading formula configuration from: {}", properties.getConfigPath());
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public FormulaEngine formulaEngine(FormulaConfig config) {
        log.info("Creating FormulaEngine: {}", config.name());
        return new FormulaEngine(config);
    }
}
