package com.beadhub.domain.auth.service;

import com.beadhub.domain.auth.adapter.gateway.IIdentityGateway;
import com.beadhub.domain.auth.model.valobj.ApiKeyCredential;
import com.beadhub.domain.auth.model.valobj.AuthIdentity;
import com.beadhub.domain.auth.model.valobj.AuthRequest;
import com.beadhub.domain.project.adapter.repository.IProjectRepository;
import com.beadhub.domain.project.model.entity.ProjectEntity;
import com.beadhub.types.enums.PrincipalKindEnum;
import com.beadhub.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * 信任边界领域服务：把请求解析为 {@link AuthIdentity}，并提供身份绑定与只读约束检查。
 * <p>
 * 配置了共享密钥且请求携带代理签名头时走代理模式，否则走 Bearer 直连模式。
 * 未配置密钥时代理头被完全忽略。
 * </p>
 *
 * @author beadhub
 * @since 2026-01-12
 */
@Slf4j
@Service
public class TrustBoundaryDomainService {

    private static final String BEARER_PREFIX = "Bearer ";

    private final IIdentityGateway identityGateway;
    private final IProjectRepository projectRepository;
    private final ProxySignatureDomainService proxySignatureDomainService;
    private final String internalSecret;

    public TrustBoundaryDomainService(IIdentityGateway identityGateway,
                                      IProjectRepository projectRepository,
                                      ProxySignatureDomainService proxySignatureDomainService,
                                      @Value("${beadhub.auth.internal-secret:}") String internalSecret) {
        this.identityGateway = identityGateway;
        this.projectRepository = projectRepository;
        this.proxySignatureDomainService = proxySignatureDomainService;
        this.internalSecret = StringUtils.trimToEmpty(internalSecret);
    }

    public boolean isProxyModeEnabled() {
        return StringUtils.isNotEmpty(internalSecret);
    }

    public AuthIdentity resolve(AuthRequest request) {
        if (request == null) {
            throw AppException.unauthenticated("Missing credentials");
        }
        if (isProxyModeEnabled() && request.hasProxyHeaders()) {
            return resolveProxy(request);
        }
        return resolveBearer(request.getAuthorization());
    }

    /**
     * 请求体中引用的工作区必须是认证身份本身。
     */
    public void ensureActorBinding(AuthIdentity identity, String workspaceId) {
        if (identity == null) {
            throw AppException.unauthenticated("Missing credentials");
        }
        if (StringUtils.isBlank(workspaceId)) {
            return;
        }
        if (identity.isPublicReader() || !Objects.equals(identity.getActorId(), workspaceId)) {
            throw AppException.forbidden("workspace_id does not match authenticated actor");
        }
    }

    public void ensureWritable(AuthIdentity identity) {
        if (identity == null) {
            throw AppException.unauthenticated("Missing credentials");
        }
        if (identity.isPublicReader()) {
            throw AppException.forbidden("Public readers cannot modify project state");
        }
    }

    private AuthIdentity resolveBearer(String authorization) {
        if (StringUtils.isBlank(authorization) || !authorization.startsWith(BEARER_PREFIX)) {
            throw AppException.unauthenticated("Missing bearer token");
        }
        String token = authorization.substring(BEARER_PREFIX.length()).trim();
        if (token.isEmpty()) {
            throw AppException.unauthenticated("Missing bearer token");
        }
        ApiKeyCredential credential = identityGateway.findByPlainKey(token);
        if (credential == null || !credential.isUsable(LocalDateTime.now())) {
            throw AppException.unauthenticated("Invalid API key");
        }
        return AuthIdentity.builder()
                .projectId(credential.getProjectId())
                .actorId(credential.getAgentId())
                .principalKind(PrincipalKindEnum.API_KEY)
                .principalId(credential.getApiKeyId())
                .build();
    }

    private AuthIdentity resolveProxy(AuthRequest request) {
        ProxySignatureDomainService.SignedClaims claims =
                proxySignatureDomainService.verify(internalSecret, request.getProxySignature());
        if (claims == null) {
            log.warn("Proxy signature rejected. projectId={}", request.getProjectId());
            throw AppException.unauthenticated("Invalid proxy signature");
        }
        if (!Objects.equals(claims.projectId(), StringUtils.trimToNull(request.getProjectId()))) {
            throw AppException.unauthenticated("Signed project does not match X-Project-ID");
        }
        return switch (claims.kind()) {
            case USER -> resolveProxyUser(claims, request);
            case API_KEY -> resolveProxyApiKey(claims, request);
            case PUBLIC_READER -> resolvePublicReader(claims);
        };
    }

    private AuthIdentity resolveProxyUser(ProxySignatureDomainService.SignedClaims claims, AuthRequest request) {
        if (claims.principalId() == null || !claims.principalId().equals(StringUtils.trimToNull(request.getUserId()))) {
            throw AppException.unauthenticated("Signed user does not match X-User-ID");
        }
        ensureSignedActor(claims, request);
        requireProject(claims.projectId());
        return AuthIdentity.builder()
                .projectId(claims.projectId())
                .actorId(claims.actorId())
                .principalKind(PrincipalKindEnum.USER)
                .principalId(claims.principalId())
                .build();
    }

    private AuthIdentity resolveProxyApiKey(ProxySignatureDomainService.SignedClaims claims, AuthRequest request) {
        if (claims.principalId() == null || !claims.principalId().equals(StringUtils.trimToNull(request.getApiKey()))) {
            throw AppException.unauthenticated("Signed key does not match X-API-Key");
        }
        ensureSignedActor(claims, request);
        ApiKeyCredential credential = identityGateway.findById(claims.principalId());
        if (credential == null
                || !credential.isUsable(LocalDateTime.now())
                || !Objects.equals(credential.getProjectId(), claims.projectId())) {
            throw AppException.unauthenticated("Invalid API key");
        }
        if (credential.getAgentId() != null && !Objects.equals(credential.getAgentId(), claims.actorId())) {
            throw AppException.unauthenticated("Signed actor does not own the API key");
        }
        return AuthIdentity.builder()
                .projectId(claims.projectId())
                .actorId(claims.actorId())
                .principalKind(PrincipalKindEnum.API_KEY)
                .principalId(claims.principalId())
                .build();
    }

    private AuthIdentity resolvePublicReader(ProxySignatureDomainService.SignedClaims claims) {
        ProjectEntity project = requireProject(claims.projectId());
        if (!project.isPublic()) {
            throw AppException.forbidden("Project is not public");
        }
        return AuthIdentity.builder()
                .projectId(claims.projectId())
                .principalKind(PrincipalKindEnum.PUBLIC_READER)
                .build();
    }

    private void ensureSignedActor(ProxySignatureDomainService.SignedClaims claims, AuthRequest request) {
        if (claims.actorId() == null || !claims.actorId().equals(StringUtils.trimToNull(request.getActorId()))) {
            throw AppException.unauthenticated("Signed actor does not match X-Aweb-Actor-ID");
        }
    }

    private ProjectEntity requireProject(String projectId) {
        ProjectEntity project = projectRepository.findById(projectId);
        if (project == null) {
            throw AppException.unauthenticated("Unknown project");
        }
        return project;
    }
}
