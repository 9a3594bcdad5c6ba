package com.beadhub.trigger.application.query;

import com.beadhub.api.dto.BeadIssueDTO;
import com.beadhub.api.dto.BeadIssueListResponseDTO;
import com.beadhub.domain.auth.model.valobj.AuthIdentity;
import com.beadhub.domain.bead.adapter.repository.IBeadIssueRepository;
import com.beadhub.domain.bead.model.entity.BeadIssueEntity;
import com.beadhub.domain.bead.model.valobj.BeadRef;
import com.beadhub.domain.project.service.RepoOriginDomainService;
import com.beadhub.trigger.application.common.CoordinationViewAssembler;
import com.beadhub.trigger.application.common.WorkspaceGuard;
import com.beadhub.types.common.Constants;
import com.beadhub.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 工作条目镜像读用例：可开工条目与单条目查询。
 */
@Service
public class BeadIssueQueryService {

    public static final int DEFAULT_READY_LIMIT = 10;
    static final int MAX_READY_LIMIT = 200;

    /**
     * 过滤阻塞项后仍需凑满 limit，按此倍数多取候选
     */
    private static final int CANDIDATE_FACTOR = 4;

    private final IBeadIssueRepository beadIssueRepository;
    private final WorkspaceGuard workspaceGuard;
    private final RepoOriginDomainService repoOriginDomainService;
    private final CoordinationViewAssembler coordinationViewAssembler;

    public BeadIssueQueryService(IBeadIssueRepository beadIssueRepository,
                                 WorkspaceGuard workspaceGuard,
                                 RepoOriginDomainService repoOriginDomainService,
                                 CoordinationViewAssembler coordinationViewAssembler) {
        this.beadIssueRepository = beadIssueRepository;
        this.workspaceGuard = workspaceGuard;
        this.repoOriginDomainService = repoOriginDomainService;
        this.coordinationViewAssembler = coordinationViewAssembler;
    }

    /**
     * 状态为 open 且所有阻塞项均已关闭的条目。镜像中查不到的阻塞项不视为阻塞。
     */
    public BeadIssueListResponseDTO ready(AuthIdentity identity, String workspaceId, String repo, String branch,
                                          Integer limit) {
        if (StringUtils.isBlank(workspaceId)) {
            throw AppException.illegalParameter("workspace_id is required");
        }
        workspaceGuard.requireLiveWorkspace(identity.getProjectId(), workspaceId);
        int pageSize = limit == null ? DEFAULT_READY_LIMIT : limit;
        if (pageSize < 1 || pageSize > MAX_READY_LIMIT) {
            throw AppException.illegalParameter("limit must be between 1 and " + MAX_READY_LIMIT);
        }

        List<BeadIssueEntity> candidates = beadIssueRepository.findByStatus(identity.getProjectId(),
                normalizeRepo(repo), StringUtils.trimToNull(branch), Constants.STATUS_OPEN,
                pageSize * CANDIDATE_FACTOR);
        Map<String, List<BeadIssueEntity>> blockerCache = new HashMap<>();
        List<BeadIssueDTO> issues = new ArrayList<>();
        for (BeadIssueEntity issue : candidates) {
            if (issues.size() >= pageSize) {
                break;
            }
            if (!isBlocked(identity.getProjectId(), issue, blockerCache)) {
                issues.add(coordinationViewAssembler.toBeadIssueDTO(issue));
            }
        }
        BeadIssueListResponseDTO response = new BeadIssueListResponseDTO();
        response.setIssues(issues);
        response.setCount(issues.size());
        return response;
    }

    /**
     * 同一 bead_id 存在于多个仓库 / 分支时返回最近一次同步的那条。
     */
    public BeadIssueDTO get(AuthIdentity identity, String beadId) {
        if (StringUtils.isBlank(beadId)) {
            throw AppException.illegalParameter("bead_id is required");
        }
        List<BeadIssueEntity> rows = beadIssueRepository.findByBeadId(identity.getProjectId(), beadId.trim());
        if (rows.isEmpty()) {
            throw AppException.notFound("Issue not found: " + beadId.trim());
        }
        return coordinationViewAssembler.toBeadIssueDTO(rows.get(0));
    }

    private boolean isBlocked(String projectId, BeadIssueEntity issue, Map<String, List<BeadIssueEntity>> cache) {
        if (issue.getBlockedBy() == null) {
            return false;
        }
        for (BeadRef ref : issue.getBlockedBy()) {
            List<BeadIssueEntity> targets = cache.computeIfAbsent(ref.getBeadId(),
                    beadId -> beadIssueRepository.findByBeadId(projectId, beadId));
            for (BeadIssueEntity target : targets) {
                boolean sameRepo = ref.getRepo() == null || Objects.equals(ref.getRepo(), target.getRepo());
                boolean sameBranch = ref.getBranch() == null || Objects.equals(ref.getBranch(), target.getBranch());
                if (sameRepo && sameBranch && !Constants.STATUS_CLOSED.equals(target.getStatus())) {
                    return true;
                }
            }
        }
        return false;
    }

    private String normalizeRepo(String repo) {
        String trimmed = StringUtils.trimToNull(repo);
        if (trimmed == null || repoOriginDomainService.isCanonical(trimmed)) {
            return trimmed;
        }
        try {
            return repoOriginDomainService.canonicalize(trimmed);
        } catch (IllegalArgumentException ex) {
            throw AppException.illegalParameter(ex.getMessage());
        }
    }
}
