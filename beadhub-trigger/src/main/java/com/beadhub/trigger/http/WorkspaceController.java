package com.beadhub.trigger.http;

import com.beadhub.api.dto.HeartbeatRequestDTO;
import com.beadhub.api.dto.WorkspaceDTO;
import com.beadhub.api.dto.WorkspaceListResponseDTO;
import com.beadhub.api.response.Response;
import com.beadhub.domain.auth.model.valobj.AuthIdentity;
import com.beadhub.domain.presence.model.valobj.PresenceRecord;
import com.beadhub.domain.presence.service.PresenceDomainService;
import com.beadhub.domain.project.model.entity.WorkspaceEntity;
import com.beadhub.trigger.application.command.WorkspaceCommandService;
import com.beadhub.trigger.application.common.CoordinationViewAssembler;
import com.beadhub.trigger.application.query.WorkspaceQueryService;
import com.beadhub.types.enums.ResponseCode;
import com.beadhub.types.exception.AppException;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 工作区列表、软删除与心跳 API。
 */
@RestController
@RequestMapping("/v1/workspaces")
public class WorkspaceController {

    private final WorkspaceQueryService workspaceQueryService;
    private final WorkspaceCommandService workspaceCommandService;
    private final PresenceDomainService presenceDomainService;
    private final CoordinationViewAssembler assembler;

    public WorkspaceController(WorkspaceQueryService workspaceQueryService,
                               WorkspaceCommandService workspaceCommandService,
                               PresenceDomainService presenceDomainService,
                               CoordinationViewAssembler assembler) {
        this.workspaceQueryService = workspaceQueryService;
        this.workspaceCommandService = workspaceCommandService;
        this.presenceDomainService = presenceDomainService;
        this.assembler = assembler;
    }

    @GetMapping
    public Response<WorkspaceListResponseDTO> list(@RequestAttribute(AuthIdentity.REQUEST_ATTRIBUTE) AuthIdentity identity,
                                                   @RequestParam(value = "repo_id", required = false) String repoId,
                                                   @RequestParam(value = "limit", required = false) Integer limit,
                                                   @RequestParam(value = "cursor", required = false) String cursor) {
        return success(workspaceQueryService.list(identity, repoId, limit, cursor));
    }

    @DeleteMapping("/{workspaceId}")
    public Response<Map<String, Object>> delete(@RequestAttribute(AuthIdentity.REQUEST_ATTRIBUTE) AuthIdentity identity,
                                                @PathVariable("workspaceId") String workspaceId) {
        WorkspaceEntity deleted = workspaceCommandService.delete(identity, workspaceId);
        presenceDomainService.clear(List.of(deleted.getWorkspaceId()));
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("workspace_id", deleted.getWorkspaceId());
        data.put("alias", deleted.getAlias());
        data.put("deleted_at", assembler.formatTime(deleted.getDeletedAt()));
        return success(data);
    }

    @PostMapping("/heartbeat")
    public Response<WorkspaceDTO> heartbeat(@RequestAttribute(AuthIdentity.REQUEST_ATTRIBUTE) AuthIdentity identity,
                                            @RequestBody HeartbeatRequestDTO request) {
        if (request == null) {
            throw AppException.illegalParameter("Request body is required");
        }
        PresenceRecord record = workspaceCommandService.heartbeat(identity, request);
        return success(assembler.toWorkspaceDTO(record, false));
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
