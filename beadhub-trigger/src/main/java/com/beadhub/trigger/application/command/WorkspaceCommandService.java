package com.beadhub.trigger.application.command;

import com.beadhub.api.dto.HeartbeatRequestDTO;
import com.beadhub.domain.auth.model.valobj.AuthIdentity;
import com.beadhub.domain.bead.adapter.repository.IBeadClaimRepository;
import com.beadhub.domain.bead.model.entity.BeadClaimEntity;
import com.beadhub.domain.notification.adapter.repository.ISubscriptionRepository;
import com.beadhub.domain.presence.model.valobj.PresenceRecord;
import com.beadhub.domain.presence.service.PresenceDomainService;
import com.beadhub.domain.project.adapter.repository.IWorkspaceRepository;
import com.beadhub.domain.project.model.entity.WorkspaceEntity;
import com.beadhub.trigger.application.common.WorkspaceGuard;
import com.beadhub.trigger.event.ProjectEventPublisher;
import com.beadhub.types.common.Constants;
import com.beadhub.types.enums.EventTypeEnum;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 工作区写用例：软删除与心跳。
 */
@Slf4j
@Service
public class WorkspaceCommandService {

    private static final int MAX_RELEASED_CLAIMS_LISTED = 500;

    private final WorkspaceGuard workspaceGuard;
    private final IWorkspaceRepository workspaceRepository;
    private final IBeadClaimRepository beadClaimRepository;
    private final ISubscriptionRepository subscriptionRepository;
    private final PresenceDomainService presenceDomainService;
    private final ProjectEventPublisher projectEventPublisher;

    public WorkspaceCommandService(WorkspaceGuard workspaceGuard,
                                   IWorkspaceRepository workspaceRepository,
                                   IBeadClaimRepository beadClaimRepository,
                                   ISubscriptionRepository subscriptionRepository,
                                   PresenceDomainService presenceDomainService,
                                   ProjectEventPublisher projectEventPublisher) {
        this.workspaceGuard = workspaceGuard;
        this.workspaceRepository = workspaceRepository;
        this.beadClaimRepository = beadClaimRepository;
        this.subscriptionRepository = subscriptionRepository;
        this.presenceDomainService = presenceDomainService;
        this.projectEventPublisher = projectEventPublisher;
    }

    /**
     * 软删除工作区，同时释放其全部认领与订阅；别名随之可被新工作区复用。
     */
    @Transactional(rollbackFor = Exception.class)
    public WorkspaceEntity delete(AuthIdentity identity, String workspaceId) {
        WorkspaceEntity workspace = workspaceGuard.requireActingWorkspace(identity, workspaceId);
        List<BeadClaimEntity> claims = beadClaimRepository.findPage(workspace.getProjectId(), workspaceId,
                null, null, MAX_RELEASED_CLAIMS_LISTED);
        int releasedClaims = beadClaimRepository.deleteByWorkspace(workspaceId);
        int removedSubscriptions = subscriptionRepository.deleteByWorkspace(workspaceId);
        workspaceRepository.softDelete(workspaceId);
        workspace.softDelete();

        for (BeadClaimEntity claim : claims) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("bead_id", claim.getBeadId());
            payload.put("alias", workspace.getAlias());
            payload.put("reason", "workspace_deleted");
            projectEventPublisher.publishAfterCommit(EventTypeEnum.BEAD_RELEASED, workspace.getProjectId(),
                    workspaceId, payload);
        }
        log.info("Workspace deleted. projectId={}, workspaceId={}, alias={}, releasedClaims={}, removedSubscriptions={}",
                workspace.getProjectId(), workspaceId, workspace.getAlias(), releasedClaims, removedSubscriptions);
        return workspace;
    }

    @Transactional(rollbackFor = Exception.class)
    public PresenceRecord heartbeat(AuthIdentity identity, HeartbeatRequestDTO request) {
        WorkspaceEntity workspace = workspaceGuard.requireActingWorkspace(identity,
                request == null ? null : request.getWorkspaceId());
        workspaceRepository.touchLastSeen(workspace.getWorkspaceId(), LocalDateTime.now());
        String branch = StringUtils.defaultIfBlank(request.getBranch(), Constants.DEFAULT_BRANCH);
        return presenceDomainService.heartbeat(workspace, branch,
                StringUtils.trimToNull(request.getCurrentBead()), StringUtils.trimToNull(request.getCommandLine()));
    }
}
