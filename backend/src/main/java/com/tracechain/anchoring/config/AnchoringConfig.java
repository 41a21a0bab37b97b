package com.tracechain.anchoring.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(AnchoringProperties.class)
public class AnchoringConfig {
}
