package com.beadhub.trigger.application.common;

import com.beadhub.domain.auth.model.valobj.AuthIdentity;
import com.beadhub.domain.auth.service.TrustBoundaryDomainService;
import com.beadhub.domain.project.adapter.repository.IWorkspaceRepository;
import com.beadhub.domain.project.model.entity.WorkspaceEntity;
import com.beadhub.types.enums.ResponseCode;
import com.beadhub.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * 写用例公共前置检查：可写身份、actor 绑定、工作区存在且属于当前项目。
 */
@Component
public class WorkspaceGuard {

    private final TrustBoundaryDomainService trustBoundaryDomainService;
    private final IWorkspaceRepository workspaceRepository;

    public WorkspaceGuard(TrustBoundaryDomainService trustBoundaryDomainService,
                          IWorkspaceRepository workspaceRepository) {
        this.trustBoundaryDomainService = trustBoundaryDomainService;
        this.workspaceRepository = workspaceRepository;
    }

    /**
     * 校验调用方可以以 workspaceId 身份写入；actor 绑定在任何存储访问之前完成。
     *
     * @return 存活的工作区
     */
    public WorkspaceEntity requireActingWorkspace(AuthIdentity identity, String workspaceId) {
        trustBoundaryDomainService.ensureWritable(identity);
        if (StringUtils.isBlank(workspaceId)) {
            throw AppException.illegalParameter("workspace_id is required");
        }
        trustBoundaryDomainService.ensureActorBinding(identity, workspaceId);
        return requireLiveWorkspace(identity.getProjectId(), workspaceId);
    }

    public WorkspaceEntity requireLiveWorkspace(String projectId, String workspaceId) {
        WorkspaceEntity workspace = workspaceRepository.findById(workspaceId);
        if (workspace == null || !workspace.belongsTo(projectId)) {
            throw AppException.notFound("Workspace not found: " + workspaceId);
        }
        if (workspace.isDeleted()) {
            throw new AppException(ResponseCode.GONE, "Workspace has been deleted: " + workspaceId);
        }
        return workspace;
    }
}
