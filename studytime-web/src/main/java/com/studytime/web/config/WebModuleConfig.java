package com.studytime.web.config;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.relational.core.dialect.Dialect;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web 模块配置。
 */
@Configuration
@ComponentScan(basePackages = "com.studytime.web")
@EnableConfigurationProperties(WebProperties.class)
@RequiredArgsConstructor
public class WebModuleConfig implements WebMvcConfigurer {

    private final WebProperties webProperties;

    /**
     * 注册 SQLite 方言 —— Spring Data JDBC 内置不认识 SQLite，需手动提供。
     */
    @Bean
    public Dialect jdbcDialect() {
        return SqliteDialect.INSTANCE;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/**")
                .allowedOrigins(webProperties.getAllowedOrigins().toArray(new String[0]))
                .allowedMethods("GET", "POST", "OPTIONS");
    }
}
