package com.beadhub.trigger.application.query;

import com.beadhub.api.dto.BdhCommandRequestDTO;
import com.beadhub.api.dto.BdhCommandResponseDTO;
import com.beadhub.api.dto.ClaimDTO;
import com.beadhub.domain.auth.model.valobj.AuthIdentity;
import com.beadhub.domain.auth.service.TrustBoundaryDomainService;
import com.beadhub.domain.bead.adapter.repository.IBeadClaimRepository;
import com.beadhub.domain.bead.model.entity.BeadClaimEntity;
import com.beadhub.domain.bead.model.valobj.ClaimDecision;
import com.beadhub.domain.bead.service.BeadPayloadDomainService;
import com.beadhub.domain.bead.service.ClaimArbitrationDomainService;
import com.beadhub.domain.project.adapter.repository.IWorkspaceRepository;
import com.beadhub.domain.project.model.entity.WorkspaceEntity;
import com.beadhub.trigger.application.common.CoordinationViewAssembler;
import com.beadhub.trigger.application.common.PageCursorCodec;
import com.beadhub.trigger.application.common.WorkspaceGuard;
import com.beadhub.types.common.Constants;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * bdh 命令预检：判断一条即将执行的命令是否会与他人的认领冲突，不修改任何状态。
 */
@Service
public class BdhCommandQueryService {

    static final String CONTEXT_BEADS_IN_PROGRESS = "beads_in_progress";

    private final WorkspaceGuard workspaceGuard;
    private final TrustBoundaryDomainService trustBoundaryDomainService;
    private final IWorkspaceRepository workspaceRepository;
    private final IBeadClaimRepository beadClaimRepository;
    private final BeadPayloadDomainService beadPayloadDomainService;
    private final ClaimArbitrationDomainService claimArbitrationDomainService;
    private final CoordinationViewAssembler coordinationViewAssembler;

    public BdhCommandQueryService(WorkspaceGuard workspaceGuard,
                                  TrustBoundaryDomainService trustBoundaryDomainService,
                                  IWorkspaceRepository workspaceRepository,
                                  IBeadClaimRepository beadClaimRepository,
                                  BeadPayloadDomainService beadPayloadDomainService,
                                  ClaimArbitrationDomainService claimArbitrationDomainService,
                                  CoordinationViewAssembler coordinationViewAssembler) {
        this.workspaceGuard = workspaceGuard;
        this.trustBoundaryDomainService = trustBoundaryDomainService;
        this.workspaceRepository = workspaceRepository;
        this.beadClaimRepository = beadClaimRepository;
        this.beadPayloadDomainService = beadPayloadDomainService;
        this.claimArbitrationDomainService = claimArbitrationDomainService;
        this.coordinationViewAssembler = coordinationViewAssembler;
    }

    public BdhCommandResponseDTO preflight(AuthIdentity identity, BdhCommandRequestDTO request) {
        String workspaceId = request == null ? null : request.getWorkspaceId();
        trustBoundaryDomainService.ensureActorBinding(identity, workspaceId);
        String projectId = identity.getProjectId();

        BdhCommandResponseDTO response = new BdhCommandResponseDTO();
        List<BeadClaimEntity> projectClaims = beadClaimRepository.findPage(projectId, null, null, null, PageCursorCodec.MAX_LIMIT);
        Map<String, List<ClaimDTO>> context = new LinkedHashMap<>();
        context.put(CONTEXT_BEADS_IN_PROGRESS, coordinationViewAssembler.toClaimDTOs(projectClaims, identity.isPublicReader()));
        response.setContext(context);

        String beadId = claimTarget(request == null ? null : request.getCommandLine());
        if (beadId == null) {
            response.setApproved(true);
            return response;
        }
        WorkspaceEntity caller = StringUtils.isBlank(workspaceId)
                ? anonymousCaller(identity)
                : workspaceGuard.requireLiveWorkspace(projectId, workspaceId);
        List<BeadClaimEntity> existing = beadClaimRepository.findByBead(projectId, beadId);
        Set<String> liveIds = existing.isEmpty()
                ? Set.of()
                : workspaceRepository.findLiveIds(existing.stream()
                .map(BeadClaimEntity::getWorkspaceId)
                .collect(Collectors.toList()));
        ClaimDecision decision = claimArbitrationDomainService.arbitrate(beadId, beadId, caller, false, existing, liveIds);
        if (decision.isRejected()) {
            BeadClaimEntity holder = decision.getHolder();
            response.setApproved(false);
            response.setReason("Bead " + beadId + " is already claimed by " + holder.getAlias()
                    + " (workspace " + holder.getWorkspaceId() + ")");
            return response;
        }
        response.setApproved(true);
        return response;
    }

    /**
     * 从命令行中解析认领目标：{@code update <id> --status in_progress} 或 {@code update <id> --claim}。
     *
     * @return 目标 bead_id；命令不是认领时返回 null
     */
    String claimTarget(String commandLine) {
        if (StringUtils.isBlank(commandLine)) {
            return null;
        }
        List<String> tokens = Arrays.asList(StringUtils.split(commandLine.trim()));
        int updateIdx = tokens.indexOf("update");
        if (updateIdx < 0 || updateIdx + 1 >= tokens.size()) {
            return null;
        }
        String beadId = tokens.get(updateIdx + 1);
        if (!beadPayloadDomainService.isValidBeadId(beadId)) {
            return null;
        }
        for (int i = updateIdx + 2; i < tokens.size(); i++) {
            String token = tokens.get(i);
            if ("--claim".equals(token)) {
                return beadId;
            }
            if (("--status".equals(token) || "-s".equals(token)) && i + 1 < tokens.size()
                    && Constants.STATUS_IN_PROGRESS.equals(tokens.get(i + 1))) {
                return beadId;
            }
            if (("--status=" + Constants.STATUS_IN_PROGRESS).equals(token)) {
                return beadId;
            }
        }
        return null;
    }

    private WorkspaceEntity anonymousCaller(AuthIdentity identity) {
        WorkspaceEntity caller = new WorkspaceEntity();
        caller.setWorkspaceId(identity.getActorId());
        caller.setProjectId(identity.getProjectId());
        return caller;
    }
}
