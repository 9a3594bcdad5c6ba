package com.beadhub.trigger.http;

import com.beadhub.api.dto.StatusResponseDTO;
import com.beadhub.api.response.Response;
import com.beadhub.domain.auth.model.valobj.AuthIdentity;
import com.beadhub.trigger.application.query.StatusQueryService;
import com.beadhub.types.enums.ResponseCode;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 项目状态快照 API。
 */
@RestController
public class StatusController {

    private final StatusQueryService statusQueryService;

    public StatusController(StatusQueryService statusQueryService) {
        this.statusQueryService = statusQueryService;
    }

    @GetMapping("/v1/status")
    public Response<StatusResponseDTO> status(@RequestAttribute(AuthIdentity.REQUEST_ATTRIBUTE) AuthIdentity identity,
                                              @RequestParam(value = "workspace_id", required = false) String workspaceId,
                                              @RequestParam(value = "repo_id", required = false) String repoId) {
        return Response.<StatusResponseDTO>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(statusQueryService.status(identity, workspaceId, repoId))
                .build();
    }
}
