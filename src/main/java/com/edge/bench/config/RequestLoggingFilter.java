package com.edge.bench.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingRequestWrapper;
import org.springframework.web.util.ContentCachingResponseWrapper;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * 记录 /api 请求与响应
 * <p>
 * 帧数据请求体可能很大，只记录前 1000 个字符
 */
@Component
public class RequestLoggingFilter extends OncePerRequestFilter {
    private static final Logger logger = LoggerFactory.getLogger(RequestLoggingFilter.class);

    private static final int MAX_REQUEST_BODY_LOG = 1000;
    private static final int MAX_RESPONSE_BODY_LOG = 5000;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith("/api/");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        ContentCachingRequestWrapper requestWrapper = new ContentCachingRequestWrapper(request);
        ContentCachingResponseWrapper responseWrapper = new ContentCachingResponseWrapper(response);

        long startTime = System.currentTimeMillis();

        try {
            logger.info("=== Incoming Request ===");
            logger.info("Method: {} {}", request.getMethod(), request.getRequestURI());

            filterChain.doFilter(requestWrapper, responseWrapper);

        } finally {
            long duration = System.currentTimeMillis() - startTime;

            if (request.getMethod().equalsIgnoreCase("POST") || request.getMethod().equalsIgnoreCase("PUT")) {
                byte[] content = requestWrapper.getContentAsByteArray();
                if (content.length > 0) {
                    String body = new String(content, StandardCharsets.UTF_8);
                    if (body.length() > MAX_REQUEST_BODY_LOG) {
                        body = body.substring(0, MAX_REQUEST_BODY_LOG) + "...";
                    }
                    logger.debug("Request Body: {}", body);
                }
            }

            byte[] responseContent = responseWrapper.getContentAsByteArray();
            if (responseContent.length > 0 && responseContent.length < MAX_RESPONSE_BODY_LOG) {
                // 只打印文本类响应
                String contentType = response.getContentType();
                if (contentType != null && (contentType.contains("json") || contentType.contains("text"))) {
                    logger.debug("Response Body: {}", new String(responseContent, StandardCharsets.UTF_8));
                }
            }

            // 必须把缓存的响应写回，否则客户端收不到数据
            responseWrapper.copyBodyToResponse();

            logger.info("Duration: {} ms | Status: {}", duration, response.getStatus());
        }
    }
}
