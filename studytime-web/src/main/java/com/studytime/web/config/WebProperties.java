package com.studytime.web.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Web 层配置项。
 */
@Data
@ConfigurationProperties(prefix = "studytime.web")
public class WebProperties {

    /** 允许跨域访问的来源，不带 Origin 的请求总是放行 */
    private List<String> allowedOrigins = new ArrayList<>(List.of(
            "http://127.0.0.1",
            "https://demo.cpdacademy.co",
            "https://cpdacademy.co",
            "https://www.cpdacademy.co"));

    /** 生产防护：拒绝 Postman 等调试工具和非白名单来源 */
    private boolean prodGuard = false;

    /** 是否打印请求访问日志 */
    private boolean accessLog = true;

    public boolean isOriginAllowed(String origin) {
        return origin == null || allowedOrigins.contains(origin);
    }
}
