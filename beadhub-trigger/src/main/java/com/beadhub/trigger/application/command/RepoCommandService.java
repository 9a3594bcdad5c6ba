package com.beadhub.trigger.application.command;

import com.beadhub.api.dto.RepoEnsureRequestDTO;
import com.beadhub.api.dto.RepoEnsureResponseDTO;
import com.beadhub.domain.auth.model.valobj.AuthIdentity;
import com.beadhub.domain.auth.service.TrustBoundaryDomainService;
import com.beadhub.domain.bead.adapter.repository.IBeadClaimRepository;
import com.beadhub.domain.bead.model.entity.BeadClaimEntity;
import com.beadhub.domain.notification.adapter.repository.ISubscriptionRepository;
import com.beadhub.domain.project.adapter.repository.IRepoRepository;
import com.beadhub.domain.project.adapter.repository.IWorkspaceRepository;
import com.beadhub.domain.project.model.entity.RepoEntity;
import com.beadhub.domain.project.service.RepoOriginDomainService;
import com.beadhub.trigger.event.ProjectEventPublisher;
import com.beadhub.types.enums.EventTypeEnum;
import com.beadhub.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 仓库写用例：注册与级联软删除。
 */
@Slf4j
@Service
public class RepoCommandService {

    private static final int MAX_RELEASED_CLAIMS_LISTED = 500;

    private final TrustBoundaryDomainService trustBoundaryDomainService;
    private final IRepoRepository repoRepository;
    private final IWorkspaceRepository workspaceRepository;
    private final IBeadClaimRepository beadClaimRepository;
    private final ISubscriptionRepository subscriptionRepository;
    private final RepoOriginDomainService repoOriginDomainService;
    private final ProjectEventPublisher projectEventPublisher;

    public RepoCommandService(TrustBoundaryDomainService trustBoundaryDomainService,
                              IRepoRepository repoRepository,
                              IWorkspaceRepository workspaceRepository,
                              IBeadClaimRepository beadClaimRepository,
                              ISubscriptionRepository subscriptionRepository,
                              RepoOriginDomainService repoOriginDomainService,
                              ProjectEventPublisher projectEventPublisher) {
        this.trustBoundaryDomainService = trustBoundaryDomainService;
        this.repoRepository = repoRepository;
        this.workspaceRepository = workspaceRepository;
        this.beadClaimRepository = beadClaimRepository;
        this.subscriptionRepository = subscriptionRepository;
        this.repoOriginDomainService = repoOriginDomainService;
        this.projectEventPublisher = projectEventPublisher;
    }

    /**
     * 在调用方项目内幂等注册仓库；已软删除的同地址仓库会被恢复。
     */
    @Transactional(rollbackFor = Exception.class)
    public RepoEnsureResponseDTO ensure(AuthIdentity identity, RepoEnsureRequestDTO request) {
        trustBoundaryDomainService.ensureWritable(identity);
        String projectId = StringUtils.trimToNull(request.getProjectId());
        if (projectId != null && !projectId.equals(identity.getProjectId())) {
            throw AppException.notFound("Project not found: " + projectId);
        }
        String canonicalOrigin = canonicalize(request.getOriginUrl());

        RepoEntity existing = repoRepository.findByCanonicalOrigin(identity.getProjectId(), canonicalOrigin);
        boolean created = existing == null || existing.isDeleted();
        RepoEntity draft = new RepoEntity();
        draft.setId(existing == null ? null : existing.getId());
        draft.setProjectId(identity.getProjectId());
        draft.setOriginUrl(request.getOriginUrl().trim());
        draft.setCanonicalOrigin(canonicalOrigin);
        draft.setName(repoOriginDomainService.extractRepoName(canonicalOrigin));
        RepoEntity repo = repoRepository.ensure(draft);
        if (created) {
            log.info("Repo registered. projectId={}, repoId={}, canonicalOrigin={}",
                    repo.getProjectId(), repo.getId(), canonicalOrigin);
        }

        RepoEnsureResponseDTO response = new RepoEnsureResponseDTO();
        response.setRepoId(repo.getId());
        response.setCanonicalOrigin(repo.getCanonicalOrigin());
        response.setName(repo.getName());
        response.setCreated(created);
        return response;
    }

    /**
     * 软删除仓库并在同一事务内级联：仓库下的工作区被软删除（此后按 GONE 处理），其认领与订阅被删除。
     * <p>
     * 在线状态不在数据库事务内，由调用方在提交后用返回的工作区 ID 清理。
     * </p>
     */
    @Transactional(rollbackFor = Exception.class)
    public RepoDeletion delete(AuthIdentity identity, String repoId) {
        trustBoundaryDomainService.ensureWritable(identity);
        if (StringUtils.isBlank(repoId)) {
            throw AppException.illegalParameter("repo_id is required");
        }
        RepoEntity repo = repoRepository.lockById(repoId);
        if (repo == null || !repo.belongsTo(identity.getProjectId()) || repo.isDeleted()) {
            throw AppException.notFound("Repo not found: " + repoId);
        }

        List<String> workspaceIds = workspaceRepository.findLiveIdsByRepo(repoId);
        int claimsDeleted = 0;
        for (String workspaceId : workspaceIds) {
            List<BeadClaimEntity> claims = beadClaimRepository.findPage(repo.getProjectId(), workspaceId,
                    null, null, MAX_RELEASED_CLAIMS_LISTED);
            claimsDeleted += beadClaimRepository.deleteByWorkspace(workspaceId);
            subscriptionRepository.deleteByWorkspace(workspaceId);
            for (BeadClaimEntity claim : claims) {
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("bead_id", claim.getBeadId());
                payload.put("alias", claim.getAlias());
                payload.put("reason", "repo_deleted");
                projectEventPublisher.publishAfterCommit(EventTypeEnum.BEAD_RELEASED, repo.getProjectId(),
                        workspaceId, payload);
            }
        }
        int workspacesDeleted = workspaceRepository.softDeleteByRepo(repoId);
        repoRepository.softDelete(repoId);

        log.info("Repo deleted. projectId={}, repoId={}, workspacesDeleted={}, claimsDeleted={}",
                repo.getProjectId(), repoId, workspacesDeleted, claimsDeleted);
        return new RepoDeletion(repoId, workspaceIds, workspacesDeleted, claimsDeleted);
    }

    private String canonicalize(String originUrl) {
        if (StringUtils.isBlank(originUrl)) {
            throw AppException.illegalParameter("origin_url is required");
        }
        try {
            return repoOriginDomainService.canonicalize(originUrl);
        } catch (IllegalArgumentException ex) {
            throw AppException.illegalParameter(ex.getMessage());
        }
    }

    public record RepoDeletion(String repoId, List<String> workspaceIds, int workspacesDeleted, int claimsDeleted) {
    }
}
