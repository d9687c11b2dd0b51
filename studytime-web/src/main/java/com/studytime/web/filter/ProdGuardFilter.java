package com.studytime.web.filter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.studytime.common.dto.ApiResponse;
import com.studytime.web.config.WebProperties;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * 生产环境请求过滤：拒绝 Postman 一类调试工具，以及带了非白名单 Origin 的请求。
 * 仅在 {@code studytime.web.prod-guard=true} 时生效。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProdGuardFilter extends OncePerRequestFilter {

    private final WebProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !properties.isProdGuard();
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        String userAgent = req.getHeader(HttpHeaders.USER_AGENT);
        if (userAgent != null && userAgent.toLowerCase(Locale.ROOT).contains("postman")) {
            log.warn("拒绝调试工具请求: {} {}, UA={}", req.getMethod(), req.getRequestURI(), userAgent);
            forbidden(res);
            return;
        }

        String origin = req.getHeader(HttpHeaders.ORIGIN);
        if (!properties.isOriginAllowed(origin)) {
            log.warn("拒绝非白名单来源: {} {}, Origin={}", req.getMethod(), req.getRequestURI(), origin);
            forbidden(res);
            return;
        }

        chain.doFilter(req, res);
    }

    private void forbidden(HttpServletResponse res) throws IOException {
        res.setStatus(HttpStatus.FORBIDDEN.value());
        res.setContentType(MediaType.APPLICATION_JSON_VALUE);
        res.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(res.getWriter(), ApiResponse.error("FORBIDDEN", "Access forbidden"));
    }
}
