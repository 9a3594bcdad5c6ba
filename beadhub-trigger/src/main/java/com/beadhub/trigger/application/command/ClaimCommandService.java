package com.beadhub.trigger.application.command;

import com.beadhub.domain.auth.model.valobj.AuthIdentity;
import com.beadhub.domain.bead.adapter.repository.IBeadClaimRepository;
import com.beadhub.domain.project.model.entity.WorkspaceEntity;
import com.beadhub.trigger.application.common.WorkspaceGuard;
import com.beadhub.trigger.event.ProjectEventPublisher;
import com.beadhub.types.enums.EventTypeEnum;
import com.beadhub.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 认领写用例：显式释放调用方自己的认领。
 */
@Slf4j
@Service
public class ClaimCommandService {

    private final WorkspaceGuard workspaceGuard;
    private final IBeadClaimRepository beadClaimRepository;
    private final ProjectEventPublisher projectEventPublisher;

    public ClaimCommandService(WorkspaceGuard workspaceGuard,
                               IBeadClaimRepository beadClaimRepository,
                               ProjectEventPublisher projectEventPublisher) {
        this.workspaceGuard = workspaceGuard;
        this.beadClaimRepository = beadClaimRepository;
        this.projectEventPublisher = projectEventPublisher;
    }

    @Transactional(rollbackFor = Exception.class)
    public void release(AuthIdentity identity, String workspaceId, String beadId) {
        WorkspaceEntity workspace = workspaceGuard.requireActingWorkspace(identity, workspaceId);
        if (!beadClaimRepository.deleteByWorkspaceAndBead(workspace.getProjectId(), workspaceId, beadId)) {
            throw AppException.notFound("Claim not found: " + beadId);
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("bead_id", beadId);
        payload.put("alias", workspace.getAlias());
        projectEventPublisher.publishAfterCommit(EventTypeEnum.BEAD_RELEASED, workspace.getProjectId(), workspaceId, payload);
        log.info("Claim released. projectId={}, workspaceId={}, beadId={}", workspace.getProjectId(), workspaceId, beadId);
    }
}
