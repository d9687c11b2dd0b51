package com.studytime.progress.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * 进度模块配置。
 */
@Configuration
@EnableConfigurationProperties(ProgressProperties.class)
public class ProgressModuleConfig {
}
