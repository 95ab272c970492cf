package com.edge.merger.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingResponseWrapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * 记录每个请求的方法、路径、耗时和状态
 * 上传的图片不记录；响应体只记录较短的 JSON（错误信息等），图片 base64 太长直接跳过
 */
@Component
public class RequestLoggingFilter extends OncePerRequestFilter {
    private static final Logger logger = LoggerFactory.getLogger(RequestLoggingFilter.class);

    private static final int MAX_LOGGED_RESPONSE = 2000;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String path = request.getRequestURI();
        if (!path.startsWith("/api/")) {
            // swagger-ui 等静态资源
            filterChain.doFilter(request, response);
            return;
        }

        ContentCachingResponseWrapper responseWrapper = new ContentCachingResponseWrapper(response);
        long startTime = System.currentTimeMillis();
        try {
            String contentType = request.getContentType();
            logger.info(">>> {} {} ({}, {} bytes)", request.getMethod(), path,
                    contentType == null ? "no body" : contentType, request.getContentLengthLong());
            filterChain.doFilter(request, responseWrapper);
        } finally {
            long duration = System.currentTimeMillis() - startTime;

            byte[] responseContent = responseWrapper.getContentAsByteArray();
            String responseType = responseWrapper.getContentType();
            if (responseContent.length > 0 && responseContent.length < MAX_LOGGED_RESPONSE
                    && responseType != null && responseType.contains("json")) {
                logger.debug("Response Body: {}", new String(responseContent, StandardCharsets.UTF_8));
            }

            // 复制响应到原始响应，否则客户端收不到数据
            responseWrapper.copyBodyToResponse();
            logger.info("<<< {} {} | Status: {} | Duration: {} ms", request.getMethod(), path,
                    responseWrapper.getStatus(), duration);
        }
    }
}
