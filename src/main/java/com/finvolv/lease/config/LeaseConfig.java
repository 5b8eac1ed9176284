package com.finvolv.lease.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(LeaseWorkbookProperties.class)
public class LeaseConfig {
}
