package com.beadhub.trigger.http;

import com.beadhub.api.dto.BdhCommandRequestDTO;
import com.beadhub.api.dto.BdhCommandResponseDTO;
import com.beadhub.api.dto.BdhSyncRequestDTO;
import com.beadhub.api.dto.BdhSyncResponseDTO;
import com.beadhub.api.dto.ClaimChangeDTO;
import com.beadhub.api.response.Response;
import com.beadhub.domain.auth.model.valobj.AuthIdentity;
import com.beadhub.domain.bead.model.valobj.ClaimDecision;
import com.beadhub.domain.bead.model.valobj.SyncResult;
import com.beadhub.domain.presence.service.PresenceDomainService;
import com.beadhub.trigger.application.command.BeadSyncCommandService;
import com.beadhub.trigger.application.common.CoordinationViewAssembler;
import com.beadhub.trigger.application.query.BdhCommandQueryService;
import com.beadhub.types.enums.ResponseCode;
import com.beadhub.types.exception.AppException;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;

/**
 * bdh 客户端 API：同步与命令预检。
 */
@RestController
@RequestMapping("/v1/bdh")
public class BdhController {

    private final BeadSyncCommandService beadSyncCommandService;
    private final BdhCommandQueryService bdhCommandQueryService;
    private final PresenceDomainService presenceDomainService;
    private final CoordinationViewAssembler assembler;

    public BdhController(BeadSyncCommandService beadSyncCommandService,
                         BdhCommandQueryService bdhCommandQueryService,
                         PresenceDomainService presenceDomainService,
                         CoordinationViewAssembler assembler) {
        this.beadSyncCommandService = beadSyncCommandService;
        this.bdhCommandQueryService = bdhCommandQueryService;
        this.presenceDomainService = presenceDomainService;
        this.assembler = assembler;
    }

    @PostMapping("/sync")
    public Response<BdhSyncResponseDTO> sync(@RequestAttribute(AuthIdentity.REQUEST_ATTRIBUTE) AuthIdentity identity,
                                             @RequestBody BdhSyncRequestDTO request) {
        if (request == null) {
            throw AppException.illegalParameter("Request body is required");
        }
        BeadSyncCommandService.SyncOutcome outcome = beadSyncCommandService.sync(identity, request);
        // 事务已提交，在线状态刷新失败不影响同步结果
        presenceDomainService.heartbeat(outcome.workspace(), outcome.branch(), outcome.currentBead(),
                request.getCommandLine());
        return success(toSyncResponseDTO(outcome.result()));
    }

    @PostMapping("/command")
    public Response<BdhCommandResponseDTO> command(@RequestAttribute(AuthIdentity.REQUEST_ATTRIBUTE) AuthIdentity identity,
                                                   @RequestBody BdhCommandRequestDTO request) {
        if (request == null) {
            throw AppException.illegalParameter("Request body is required");
        }
        return success(bdhCommandQueryService.preflight(identity, request));
    }

    private BdhSyncResponseDTO toSyncResponseDTO(SyncResult result) {
        BdhSyncResponseDTO dto = new BdhSyncResponseDTO();
        dto.setSynced(Boolean.TRUE);
        dto.setSyncMode(result.getSyncMode() == null ? null : result.getSyncMode().getCode());
        dto.setRepo(result.getRepo());
        dto.setBranch(result.getBranch());
        dto.setIssuesSynced(result.getIssuesSynced());
        dto.setIssuesAdded(result.getIssuesAdded());
        dto.setIssuesUpdated(result.getIssuesUpdated());
        dto.setIssuesDeleted(result.getIssuesDeleted());
        dto.setConflicts(new ArrayList<>(result.getConflicts()));
        dto.setConflictsCount(result.getConflicts().size());
        List<ClaimChangeDTO> claims = new ArrayList<>();
        for (ClaimDecision decision : result.getClaimDecisions()) {
            claims.add(assembler.toClaimChangeDTO(decision));
        }
        dto.setClaims(claims);
        dto.setNotificationsQueued(result.getNotificationsQueued());
        dto.setSyncedAt(assembler.formatTime(result.getSyncedAt()));
        return dto;
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
