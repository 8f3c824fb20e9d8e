package com.architecture.memory.flowgraph.config;

import com.architecture.memory.flowgraph.service.graph.IdentifierSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires converter settings and the identifier source used for unit and connection guids.
 */
@Configuration
@EnableConfigurationProperties(ConverterProperties.class)
@Slf4j
public class ConverterConfig {

    @Bean
    public IdentifierSource identifierSource(ConverterProperties properties) {
        log.info("[converter-config] scanOrder={} layout={}", properties.getScanOrder(), properties.getLayout());
        return IdentifierSource.random();
    }
}
