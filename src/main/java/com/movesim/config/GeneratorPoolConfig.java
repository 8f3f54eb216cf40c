package com.movesim.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Thread pool sizing for generator tasks. Every generator occupies one thread for the whole
 * session, so the pool has no queue and {@link #maxPoolSize} caps the number of entities that
 * can be simulated at once.
 */
@Configuration
@ConfigurationProperties(prefix = "movesim.generator-pool")
@Getter
@Setter
public class GeneratorPoolConfig {

    private int corePoolSize = 8;

    private int maxPoolSize = 256;

    private int keepAliveSeconds = 60;

    private String threadNamePrefix = "generator-";
}
