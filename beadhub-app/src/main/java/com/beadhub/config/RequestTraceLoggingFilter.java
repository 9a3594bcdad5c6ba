package com.beadhub.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingRequestWrapper;
import org.springframework.web.util.ContentCachingResponseWrapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 统一 HTTP 链路日志过滤器：分配 traceId / requestId 并写入 MDC，记录 HTTP_IN / HTTP_OUT。
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class RequestTraceLoggingFilter extends OncePerRequestFilter {

    static final String HEADER_TRACE_ID = "X-Trace-Id";
    static final String HEADER_REQUEST_ID = "X-Request-Id";
    private static final String MDC_TRACE_ID = "traceId";
    private static final String MDC_REQUEST_ID = "requestId";

    private final ObjectMapper objectMapper;
    private final ObservabilityHttpLogProperties properties;
    private final AntPathMatcher pathMatcher;

    public RequestTraceLoggingFilter(ObjectMapper objectMapper,
                                     ObservabilityHttpLogProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.pathMatcher = new AntPathMatcher();
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (request == null || !properties.isEnabled()) {
            return true;
        }
        String path = normalizePath(request.getRequestURI());
        if (matchesAny(path, properties.getExcludePathPatterns())) {
            return true;
        }
        List<String> includePatterns = properties.getIncludePathPatterns();
        if (includePatterns == null || includePatterns.isEmpty()) {
            return false;
        }
        return !matchesAny(path, includePatterns);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String traceId = resolveOrCreateId(request.getHeader(HEADER_TRACE_ID));
        String requestId = resolveOrCreateId(request.getHeader(HEADER_REQUEST_ID));
        String path = normalizePath(request.getRequestURI());
        String method = request.getMethod();

        response.setHeader(HEADER_TRACE_ID, traceId);
        response.setHeader(HEADER_REQUEST_ID, requestId);
        MDC.put(MDC_TRACE_ID, traceId);
        MDC.put(MDC_REQUEST_ID, requestId);

        long startNs = System.nanoTime();
        boolean sampled = shouldSample();
        ContentCachingRequestWrapper requestWrapper = new ContentCachingRequestWrapper(request);
        ContentCachingResponseWrapper responseWrapper = new ContentCachingResponseWrapper(response);
        if (sampled) {
            log.info("HTTP_IN method={}, path={}, query={}, clientIp={}",
                    method, path, sanitizeQuery(request.getQueryString()), resolveClientIp(request));
        }

        Throwable error = null;
        try {
            filterChain.doFilter(requestWrapper, responseWrapper);
        } catch (ServletException | IOException | RuntimeException ex) {
            error = ex;
            throw ex;
        } finally {
            long costMs = (System.nanoTime() - startNs) / 1_000_000L;
            boolean slowRequest = costMs >= Math.max(properties.getSlowRequestThresholdMs(), 0L);
            if (error != null) {
                log.warn("HTTP_OUT method={}, path={}, status={}, costMs={}, outcome=error, errorType={}, errorMessage={}",
                        method, path, responseWrapper.getStatus(), costMs,
                        error.getClass().getSimpleName(), truncate(error.getMessage(), 200));
            } else if (sampled || slowRequest) {
                log.info("HTTP_OUT method={}, path={}, status={}, responseCode={}, costMs={}, slow={}, requestBodySummary={}",
                        method, path, responseWrapper.getStatus(),
                        StringUtils.defaultIfBlank(extractResponseCode(responseWrapper), "-"),
                        costMs, slowRequest, extractRequestBodySummary(requestWrapper));
            }
            responseWrapper.copyBodyToResponse();
            MDC.remove(MDC_REQUEST_ID);
            MDC.remove(MDC_TRACE_ID);
        }
    }

    private String resolveOrCreateId(String value) {
        String trimmed = StringUtils.trimToNull(value);
        if (trimmed != null && trimmed.length() <= 128) {
            return trimmed;
        }
        return UUID.randomUUID().toString().replace("-", "");
    }

    private boolean shouldSample() {
        double rate = properties.getSampleRate();
        if (rate <= 0D) {
            return false;
        }
        return rate >= 1D || ThreadLocalRandom.current().nextDouble() <= rate;
    }

    private String extractResponseCode(ContentCachingResponseWrapper responseWrapper) {
        byte[] body = responseWrapper.getContentAsByteArray();
        String contentType = responseWrapper.getContentType();
        if (body.length == 0 || StringUtils.isBlank(contentType)
                || !contentType.toLowerCase(Locale.ROOT).contains(MediaType.APPLICATION_JSON_VALUE)) {
            return null;
        }
        try {
            Map<String, Object> responseMap = objectMapper.readValue(body, new TypeReference<Map<String, Object>>() {
            });
            Object code = responseMap.get("code");
            return code == null ? null : String.valueOf(code);
        } catch (IOException ex) {
            log.debug("Response code extraction skipped: {}", ex.getMessage());
            return null;
        }
    }

    private String extractRequestBodySummary(ContentCachingRequestWrapper requestWrapper) {
        if (!properties.isLogRequestBody()) {
            return "-";
        }
        byte[] body = requestWrapper.getContentAsByteArray();
        if (body.length == 0) {
            return "-";
        }
        try {
            Map<String, Object> source = objectMapper.readValue(new String(body, StandardCharsets.UTF_8),
                    new TypeReference<Map<String, Object>>() {
                    });
            Map<String, Object> summary = new LinkedHashMap<>();
            for (String key : properties.getRequestBodyWhitelist()) {
                if (StringUtils.isNotBlank(key) && source.containsKey(key)) {
                    summary.put(key, isMaskField(key) ? "***" : source.get(key));
                }
            }
            if (summary.isEmpty()) {
                return "-";
            }
            return truncate(objectMapper.writeValueAsString(summary), Math.max(64, properties.getMaxBodyLength()));
        } catch (IOException ex) {
            return "<non-json body, " + body.length + " bytes>";
        }
    }

    private boolean isMaskField(String key) {
        List<String> maskFields = properties.getMaskFields();
        if (StringUtils.isBlank(key) || maskFields == null) {
            return false;
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        for (String maskField : maskFields) {
            if (StringUtils.isNotBlank(maskField) && normalized.equals(maskField.trim().toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    private String sanitizeQuery(String queryString) {
        if (StringUtils.isBlank(queryString)) {
            return "-";
        }
        StringBuilder sanitized = new StringBuilder();
        for (String part : queryString.split("&")) {
            if (StringUtils.isBlank(part)) {
                continue;
            }
            String[] kv = part.split("=", 2);
            if (sanitized.length() > 0) {
                sanitized.append('&');
            }
            sanitized.append(kv[0]).append('=');
            sanitized.append(isMaskField(kv[0]) ? "***" : truncate(kv.length > 1 ? kv[1] : "", 80));
        }
        return sanitized.length() == 0 ? "-" : sanitized.toString();
    }

    private String resolveClientIp(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (StringUtils.isNotBlank(forwarded)) {
            return forwarded.split(",")[0].trim();
        }
        return StringUtils.defaultIfBlank(request.getRemoteAddr(), "unknown");
    }

    private boolean matchesAny(String path, List<String> patterns) {
        if (patterns == null) {
            return false;
        }
        for (String pattern : patterns) {
            if (StringUtils.isNotBlank(pattern) && pathMatcher.match(pattern.trim(), path)) {
                return true;
            }
        }
        return false;
    }

    private String normalizePath(String path) {
        return StringUtils.defaultIfBlank(path, "/").trim();
    }

    private String truncate(String text, int maxLength) {
        if (StringUtils.isBlank(text) || maxLength <= 0 || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength);
    }
}
