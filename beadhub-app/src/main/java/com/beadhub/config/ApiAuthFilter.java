package com.beadhub.config;

import com.beadhub.api.response.Response;
import com.beadhub.domain.auth.model.valobj.AuthIdentity;
import com.beadhub.domain.auth.model.valobj.AuthRequest;
import com.beadhub.domain.auth.service.TrustBoundaryDomainService;
import com.beadhub.types.enums.ResponseCode;
import com.beadhub.types.exception.AppException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * `/v1/**` 信任边界过滤器（初始化接口除外）。
 * <p>
 * 解析出的 {@link AuthIdentity} 放入请求属性；公开只读身份只允许 GET/HEAD。
 * </p>
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 20)
public class ApiAuthFilter extends OncePerRequestFilter {

    static final String HEADER_PROXY_AUTH = "X-BH-Auth";
    static final String HEADER_PROJECT_ID = "X-Project-ID";
    static final String HEADER_USER_ID = "X-User-ID";
    static final String HEADER_API_KEY = "X-API-Key";
    static final String HEADER_ACTOR_ID = "X-Aweb-Actor-ID";

    private static final String API_PREFIX = "/v1/";
    private static final List<String> WHITELIST_PATTERNS = List.of(
            "/v1/init"
    );

    private final ObjectMapper objectMapper;
    private final TrustBoundaryDomainService trustBoundaryDomainService;
    private final AntPathMatcher antPathMatcher;

    public ApiAuthFilter(ObjectMapper objectMapper,
                         TrustBoundaryDomainService trustBoundaryDomainService) {
        this.objectMapper = objectMapper;
        this.trustBoundaryDomainService = trustBoundaryDomainService;
        this.antPathMatcher = new AntPathMatcher();
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (request == null) {
            return true;
        }
        if ("OPTIONS".equalsIgnoreCase(request.getMethod())) {
            return true;
        }
        String path = normalizePath(request.getRequestURI());
        if (!path.startsWith(API_PREFIX)) {
            return true;
        }
        for (String pattern : WHITELIST_PATTERNS) {
            if (antPathMatcher.match(pattern, path)) {
                return true;
            }
        }
        return false;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String path = normalizePath(request.getRequestURI());
        AuthIdentity identity;
        try {
            identity = trustBoundaryDomainService.resolve(toAuthRequest(request));
        } catch (AppException ex) {
            if (log.isDebugEnabled()) {
                log.debug("Auth rejected. method={}, path={}, reason={}", request.getMethod(), path, ex.getInfo());
            }
            writeError(response, ResponseCode.fromCode(ex.getCode()), ex.getInfo());
            return;
        }
        if (identity.isPublicReader() && !isSafeMethod(request.getMethod())) {
            log.debug("Public reader write rejected. method={}, path={}, projectId={}",
                    request.getMethod(), path, identity.getProjectId());
            writeError(response, ResponseCode.FORBIDDEN, "Public readers cannot modify project state");
            return;
        }
        request.setAttribute(AuthIdentity.REQUEST_ATTRIBUTE, identity);
        filterChain.doFilter(request, response);
    }

    private AuthRequest toAuthRequest(HttpServletRequest request) {
        return AuthRequest.builder()
                .authorization(StringUtils.trimToNull(request.getHeader(HttpHeaders.AUTHORIZATION)))
                .proxySignature(StringUtils.trimToNull(request.getHeader(HEADER_PROXY_AUTH)))
                .projectId(StringUtils.trimToNull(request.getHeader(HEADER_PROJECT_ID)))
                .userId(StringUtils.trimToNull(request.getHeader(HEADER_USER_ID)))
                .apiKey(StringUtils.trimToNull(request.getHeader(HEADER_API_KEY)))
                .actorId(StringUtils.trimToNull(request.getHeader(HEADER_ACTOR_ID)))
                .build();
    }

    private boolean isSafeMethod(String method) {
        return "GET".equalsIgnoreCase(method) || "HEAD".equalsIgnoreCase(method);
    }

    private void writeError(HttpServletResponse response, ResponseCode responseCode, String message) throws IOException {
        Response<Void> body = Response.<Void>builder()
                .code(responseCode.getCode())
                .info(StringUtils.defaultIfBlank(message, responseCode.getInfo()))
                .build();
        response.setStatus(responseCode.getHttpStatus());
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.getWriter().write(objectMapper.writeValueAsString(body));
        response.getWriter().flush();
    }

    private String normalizePath(String path) {
        if (StringUtils.isBlank(path)) {
            return "/";
        }
        return path.trim();
    }
}
