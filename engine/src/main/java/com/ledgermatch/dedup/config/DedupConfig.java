package com.ledgermatch.dedup.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Dedup module configuration: matching properties.
 */
@Configuration
@EnableConfigurationProperties(DedupProperties.class)
public class DedupConfig {
}
