package com.beadhub.trigger.http;

import com.beadhub.api.dto.ClaimListResponseDTO;
import com.beadhub.api.response.Response;
import com.beadhub.domain.auth.model.valobj.AuthIdentity;
import com.beadhub.trigger.application.command.ClaimCommandService;
import com.beadhub.trigger.application.query.ClaimQueryService;
import com.beadhub.types.enums.ResponseCode;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 认领查询与释放 API。
 */
@RestController
@RequestMapping("/v1/claims")
public class ClaimController {

    private final ClaimQueryService claimQueryService;
    private final ClaimCommandService claimCommandService;

    public ClaimController(ClaimQueryService claimQueryService,
                           ClaimCommandService claimCommandService) {
        this.claimQueryService = claimQueryService;
        this.claimCommandService = claimCommandService;
    }

    @GetMapping
    public Response<ClaimListResponseDTO> list(@RequestAttribute(AuthIdentity.REQUEST_ATTRIBUTE) AuthIdentity identity,
                                               @RequestParam(value = "workspace_id", required = false) String workspaceId,
                                               @RequestParam(value = "limit", required = false) Integer limit,
                                               @RequestParam(value = "cursor", required = false) String cursor) {
        return success(claimQueryService.list(identity, workspaceId, limit, cursor));
    }

    @DeleteMapping("/{beadId}")
    public Response<Map<String, Object>> release(@RequestAttribute(AuthIdentity.REQUEST_ATTRIBUTE) AuthIdentity identity,
                                                 @PathVariable("beadId") String beadId,
                                                 @RequestParam(value = "workspace_id", required = false) String workspaceId) {
        claimCommandService.release(identity, workspaceId, beadId);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("bead_id", beadId);
        data.put("workspace_id", workspaceId);
        data.put("released", Boolean.TRUE);
        return success(data);
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
