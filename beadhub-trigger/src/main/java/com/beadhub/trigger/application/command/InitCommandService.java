package com.beadhub.trigger.application.command;

import com.beadhub.api.dto.InitRequestDTO;
import com.beadhub.api.dto.InitResponseDTO;
import com.beadhub.domain.auth.adapter.gateway.IIdentityGateway;
import com.beadhub.domain.auth.model.valobj.IssuedApiKey;
import com.beadhub.domain.policy.model.entity.PolicyEntity;
import com.beadhub.domain.project.adapter.repository.IProjectRepository;
import com.beadhub.domain.project.adapter.repository.IRepoRepository;
import com.beadhub.domain.project.adapter.repository.IWorkspaceRepository;
import com.beadhub.domain.project.model.entity.ProjectEntity;
import com.beadhub.domain.project.model.entity.RepoEntity;
import com.beadhub.domain.project.model.entity.WorkspaceEntity;
import com.beadhub.domain.project.service.RepoOriginDomainService;
import com.beadhub.domain.project.service.WorkspaceNamingDomainService;
import com.beadhub.types.enums.ProjectVisibilityEnum;
import com.beadhub.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * 初始化写用例：一次事务内完成项目、仓库、工作区、API Key 与默认策略的准备。
 * <p>
 * 任一步失败整体回滚，不留下部分行；对同一 slug + origin + alias 重复调用会收敛到已有行并签发新 Key。
 * </p>
 */
@Slf4j
@Service
public class InitCommandService {

    static final String DEFAULT_ROLE = "agent";

    private final IProjectRepository projectRepository;
    private final IRepoRepository repoRepository;
    private final IWorkspaceRepository workspaceRepository;
    private final IIdentityGateway identityGateway;
    private final RepoOriginDomainService repoOriginDomainService;
    private final WorkspaceNamingDomainService workspaceNamingDomainService;
    private final PolicyCommandService policyCommandService;

    public InitCommandService(IProjectRepository projectRepository,
                              IRepoRepository repoRepository,
                              IWorkspaceRepository workspaceRepository,
                              IIdentityGateway identityGateway,
                              RepoOriginDomainService repoOriginDomainService,
                              WorkspaceNamingDomainService workspaceNamingDomainService,
                              PolicyCommandService policyCommandService) {
        this.projectRepository = projectRepository;
        this.repoRepository = repoRepository;
        this.workspaceRepository = workspaceRepository;
        this.identityGateway = identityGateway;
        this.repoOriginDomainService = repoOriginDomainService;
        this.workspaceNamingDomainService = workspaceNamingDomainService;
        this.policyCommandService = policyCommandService;
    }

    @Transactional(rollbackFor = Exception.class)
    public InitResponseDTO init(InitRequestDTO request) {
        if (request == null) {
            throw AppException.illegalParameter("Request body is required");
        }
        String slug = StringUtils.trimToEmpty(request.getProjectSlug());
        if (!workspaceNamingDomainService.isValidProjectSlug(slug)) {
            throw AppException.illegalParameter("Invalid project_slug: " + StringUtils.left(slug, 64));
        }
        String canonicalOrigin = canonicalize(request.getRepoOrigin());
        String humanName = StringUtils.trimToNull(request.getHumanName());
        if (humanName != null && !workspaceNamingDomainService.isValidHumanName(humanName)) {
            throw AppException.illegalParameter("Invalid human_name");
        }
        String role = normalizeRole(request.getRole());
        String requestedAlias = StringUtils.trimToNull(request.getAlias());
        if (requestedAlias != null && !workspaceNamingDomainService.isValidAlias(requestedAlias)) {
            throw AppException.illegalParameter("Invalid alias: " + StringUtils.left(requestedAlias, 64));
        }
        ProjectVisibilityEnum visibility = parseVisibility(request.getVisibility());

        boolean projectCreated = false;
        ProjectEntity project = projectRepository.findBySlug(null, slug);
        if (project == null) {
            ProjectEntity draft = new ProjectEntity();
            draft.setSlug(slug);
            draft.setName(StringUtils.defaultIfBlank(request.getProjectName(), slug));
            draft.setVisibility(visibility == null ? ProjectVisibilityEnum.PRIVATE : visibility);
            project = projectRepository.save(draft);
            projectCreated = true;
        }

        RepoEntity repo = repoRepository.findByCanonicalOrigin(project.getId(), canonicalOrigin);
        boolean repoCreated = repo == null || repo.isDeleted();
        RepoEntity repoDraft = new RepoEntity();
        repoDraft.setId(repo == null ? null : repo.getId());
        repoDraft.setProjectId(project.getId());
        repoDraft.setOriginUrl(request.getRepoOrigin().trim());
        repoDraft.setCanonicalOrigin(canonicalOrigin);
        repoDraft.setName(repoOriginDomainService.extractRepoName(canonicalOrigin));
        repo = repoRepository.ensure(repoDraft);

        WorkspaceEntity workspace = null;
        if (requestedAlias != null) {
            workspace = workspaceRepository.findActiveByAlias(project.getId(), requestedAlias);
            if (workspace != null && !Objects.equals(workspace.getRepoId(), repo.getId())) {
                Map<String, Object> detail = new LinkedHashMap<>();
                detail.put("alias", requestedAlias);
                detail.put("workspace_id", workspace.getWorkspaceId());
                detail.put("repo_id", workspace.getRepoId());
                throw AppException.conflict("Alias is already used by a workspace on another repo", detail);
            }
        }
        boolean workspaceCreated = workspace == null;
        String alias = requestedAlias;
        if (alias == null) {
            alias = workspaceNamingDomainService.suggestAlias(role, workspaceRepository.findActiveAliases(project.getId()));
            if (alias == null) {
                throw AppException.conflict("No free alias available for role " + role, null);
            }
        }
        if (workspace == null) {
            workspace = new WorkspaceEntity();
            workspace.setWorkspaceId(UUID.randomUUID().toString());
            workspace.setProjectId(project.getId());
            workspace.setRepoId(repo.getId());
            workspace.setAlias(alias);
        }
        if (humanName != null || workspace.getHumanName() == null) {
            workspace.setHumanName(StringUtils.defaultString(humanName, alias));
        }
        workspace.setRole(role);
        workspace.setHostname(StringUtils.defaultIfBlank(request.getHostname(), workspace.getHostname()));
        workspace.setWorkspacePath(StringUtils.defaultIfBlank(request.getWorkspacePath(), workspace.getWorkspacePath()));
        workspace.setLastSeenAt(LocalDateTime.now());
        workspace = workspaceRepository.save(workspace);

        IssuedApiKey apiKey = identityGateway.issueApiKey(project.getId(), workspace.getWorkspaceId(), workspace.getAlias());
        PolicyEntity policy = policyCommandService.ensureActivePolicy(project.getId());

        log.info("Init completed. projectId={}, slug={}, repoId={}, workspaceId={}, alias={}, projectCreated={}, repoCreated={}, workspaceCreated={}",
                project.getId(), slug, repo.getId(), workspace.getWorkspaceId(), workspace.getAlias(),
                projectCreated, repoCreated, workspaceCreated);

        InitResponseDTO response = new InitResponseDTO();
        response.setStatus("ok");
        response.setApiKey(apiKey.getPlainKey());
        response.setProjectId(project.getId());
        response.setProjectSlug(project.getSlug());
        response.setRepoId(repo.getId());
        response.setCanonicalOrigin(canonicalOrigin);
        response.setWorkspaceId(workspace.getWorkspaceId());
        response.setAlias(workspace.getAlias());
        response.setHumanName(workspace.getHumanName());
        response.setRole(workspace.getRole());
        response.setPolicyId(policy.getPolicyId());
        response.setCreated(projectCreated || repoCreated || workspaceCreated);
        response.setWorkspaceCreated(workspaceCreated);
        return response;
    }

    private String canonicalize(String repoOrigin) {
        if (StringUtils.isBlank(repoOrigin)) {
            throw AppException.illegalParameter("repo_origin is required");
        }
        try {
            return repoOriginDomainService.canonicalize(repoOrigin);
        } catch (IllegalArgumentException ex) {
            throw AppException.illegalParameter(ex.getMessage());
        }
    }

    private String normalizeRole(String role) {
        if (StringUtils.isBlank(role)) {
            return DEFAULT_ROLE;
        }
        String normalized = workspaceNamingDomainService.normalizeRole(role);
        if (normalized == null) {
            throw AppException.illegalParameter("Invalid role");
        }
        return normalized;
    }

    private ProjectVisibilityEnum parseVisibility(String visibility) {
        if (StringUtils.isBlank(visibility)) {
            return null;
        }
        try {
            return ProjectVisibilityEnum.fromCode(visibility.trim().toLowerCase());
        } catch (IllegalArgumentException ex) {
            throw AppException.illegalParameter("Invalid visibility: " + visibility);
        }
    }
}
