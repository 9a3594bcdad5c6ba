package com.beadhub.trigger.application.query;

import com.beadhub.api.dto.StatusResponseDTO;
import com.beadhub.api.dto.WorkspaceDTO;
import com.beadhub.domain.auth.model.valobj.AuthIdentity;
import com.beadhub.domain.bead.adapter.repository.IBeadClaimRepository;
import com.beadhub.domain.escalation.adapter.repository.IEscalationRepository;
import com.beadhub.domain.policy.adapter.repository.IPolicyRepository;
import com.beadhub.domain.policy.model.entity.PolicyEntity;
import com.beadhub.domain.presence.model.valobj.PresenceFilter;
import com.beadhub.domain.presence.model.valobj.PresenceRecord;
import com.beadhub.domain.project.adapter.repository.IProjectRepository;
import com.beadhub.domain.project.model.entity.ProjectEntity;
import com.beadhub.trigger.application.common.CoordinationViewAssembler;
import com.beadhub.trigger.application.common.PageCursorCodec;
import com.beadhub.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * 项目状态快照读用例：在线工作区、活跃认领、待处理升级数与激活策略版本。
 */
@Service
public class StatusQueryService {

    private final IProjectRepository projectRepository;
    private final IBeadClaimRepository beadClaimRepository;
    private final IEscalationRepository escalationRepository;
    private final IPolicyRepository policyRepository;
    private final WorkspaceQueryService workspaceQueryService;
    private final CoordinationViewAssembler coordinationViewAssembler;

    public StatusQueryService(IProjectRepository projectRepository,
                              IBeadClaimRepository beadClaimRepository,
                              IEscalationRepository escalationRepository,
                              IPolicyRepository policyRepository,
                              WorkspaceQueryService workspaceQueryService,
                              CoordinationViewAssembler coordinationViewAssembler) {
        this.projectRepository = projectRepository;
        this.beadClaimRepository = beadClaimRepository;
        this.escalationRepository = escalationRepository;
        this.policyRepository = policyRepository;
        this.workspaceQueryService = workspaceQueryService;
        this.coordinationViewAssembler = coordinationViewAssembler;
    }

    public StatusResponseDTO status(AuthIdentity identity, String workspaceId, String repoId) {
        String projectId = identity.getProjectId();
        ProjectEntity project = projectRepository.findById(projectId);
        if (project == null) {
            throw AppException.notFound("Project not found: " + projectId);
        }
        boolean redact = identity.isPublicReader();
        String workspaceFilter = StringUtils.trimToNull(workspaceId);
        String repoFilter = StringUtils.trimToNull(repoId);

        List<WorkspaceDTO> workspaces = new ArrayList<>();
        for (PresenceRecord record : workspaceQueryService.lookupOnline(PresenceFilter.builder()
                .projectId(projectId)
                .repoId(repoFilter)
                .build())) {
            if (workspaceFilter == null || workspaceFilter.equals(record.getWorkspaceId())) {
                workspaces.add(coordinationViewAssembler.toWorkspaceDTO(record, redact));
            }
        }

        StatusResponseDTO response = new StatusResponseDTO();
        response.setProjectId(projectId);
        response.setProjectSlug(project.getSlug());
        response.setVisibility(project.getVisibility() == null ? null : project.getVisibility().getCode());
        response.setWorkspaceId(workspaceFilter);
        response.setRepoId(repoFilter);
        response.setWorkspaces(workspaces);
        response.setOnlineCount(workspaces.size());
        response.setClaims(coordinationViewAssembler.toClaimDTOs(
                beadClaimRepository.findPage(projectId, workspaceFilter, null, null, PageCursorCodec.MAX_LIMIT), redact));
        response.setPendingEscalations(escalationRepository.countPending(projectId));
        if (StringUtils.isNotBlank(project.getActivePolicyId())) {
            PolicyEntity active = policyRepository.findById(projectId, project.getActivePolicyId());
            response.setActivePolicyId(project.getActivePolicyId());
            response.setActivePolicyVersion(active == null ? null : active.getVersion());
        }
        response.setTimestamp(OffsetDateTime.now(ZoneOffset.UTC).toString());
        return response;
    }
}
