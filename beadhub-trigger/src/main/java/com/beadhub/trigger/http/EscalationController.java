package com.beadhub.trigger.http;

import com.beadhub.api.dto.EscalationCreateRequestDTO;
import com.beadhub.api.dto.EscalationDTO;
import com.beadhub.api.dto.EscalationListResponseDTO;
import com.beadhub.api.dto.EscalationRespondRequestDTO;
import com.beadhub.api.response.Response;
import com.beadhub.domain.auth.model.valobj.AuthIdentity;
import com.beadhub.trigger.application.command.EscalationCommandService;
import com.beadhub.trigger.application.common.CoordinationViewAssembler;
import com.beadhub.trigger.application.query.EscalationQueryService;
import com.beadhub.types.enums.ResponseCode;
import com.beadhub.types.exception.AppException;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 人工升级 API。
 */
@RestController
@RequestMapping("/v1/escalations")
public class EscalationController {

    private final EscalationCommandService escalationCommandService;
    private final EscalationQueryService escalationQueryService;
    private final CoordinationViewAssembler assembler;

    public EscalationController(EscalationCommandService escalationCommandService,
                                EscalationQueryService escalationQueryService,
                                CoordinationViewAssembler assembler) {
        this.escalationCommandService = escalationCommandService;
        this.escalationQueryService = escalationQueryService;
        this.assembler = assembler;
    }

    @PostMapping
    public Response<EscalationDTO> create(@RequestAttribute(AuthIdentity.REQUEST_ATTRIBUTE) AuthIdentity identity,
                                          @RequestBody EscalationCreateRequestDTO request) {
        if (request == null) {
            throw AppException.illegalParameter("Request body is required");
        }
        return success(assembler.toEscalationDTO(escalationCommandService.create(identity, request), false));
    }

    @GetMapping
    public Response<EscalationListResponseDTO> list(@RequestAttribute(AuthIdentity.REQUEST_ATTRIBUTE) AuthIdentity identity,
                                                    @RequestParam(value = "status", required = false) String status,
                                                    @RequestParam(value = "workspace_id", required = false) String workspaceId,
                                                    @RequestParam(value = "limit", required = false) Integer limit,
                                                    @RequestParam(value = "cursor", required = false) String cursor) {
        return success(escalationQueryService.list(identity, status, workspaceId, limit, cursor));
    }

    @GetMapping("/{escalationId}")
    public Response<EscalationDTO> get(@RequestAttribute(AuthIdentity.REQUEST_ATTRIBUTE) AuthIdentity identity,
                                       @PathVariable("escalationId") String escalationId) {
        return success(escalationQueryService.get(identity, escalationId));
    }

    @PostMapping("/{escalationId}/respond")
    public Response<EscalationDTO> respond(@RequestAttribute(AuthIdentity.REQUEST_ATTRIBUTE) AuthIdentity identity,
                                           @PathVariable("escalationId") String escalationId,
                                           @RequestBody EscalationRespondRequestDTO request) {
        if (request == null) {
            throw AppException.illegalParameter("Request body is required");
        }
        return success(assembler.toEscalationDTO(
                escalationCommandService.respond(identity, escalationId, request), false));
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
