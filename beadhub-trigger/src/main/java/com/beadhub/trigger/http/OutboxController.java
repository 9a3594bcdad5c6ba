package com.beadhub.trigger.http;

import com.beadhub.api.dto.OutboxEntryDTO;
import com.beadhub.api.dto.OutboxListResponseDTO;
import com.beadhub.api.response.Response;
import com.beadhub.domain.auth.model.valobj.AuthIdentity;
import com.beadhub.domain.auth.service.TrustBoundaryDomainService;
import com.beadhub.trigger.application.command.OutboxDeliveryCommandService;
import com.beadhub.trigger.application.common.CoordinationViewAssembler;
import com.beadhub.trigger.application.query.OutboxQueryService;
import com.beadhub.types.enums.ResponseCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 通知发件箱运维 API：查看永久失败条目并手动重新排队。
 */
@Slf4j
@RestController
@RequestMapping("/v1/outbox")
public class OutboxController {

    private final OutboxQueryService outboxQueryService;
    private final OutboxDeliveryCommandService outboxDeliveryCommandService;
    private final TrustBoundaryDomainService trustBoundaryDomainService;
    private final CoordinationViewAssembler assembler;

    public OutboxController(OutboxQueryService outboxQueryService,
                            OutboxDeliveryCommandService outboxDeliveryCommandService,
                            TrustBoundaryDomainService trustBoundaryDomainService,
                            CoordinationViewAssembler assembler) {
        this.outboxQueryService = outboxQueryService;
        this.outboxDeliveryCommandService = outboxDeliveryCommandService;
        this.trustBoundaryDomainService = trustBoundaryDomainService;
        this.assembler = assembler;
    }

    @GetMapping("/failed")
    public Response<OutboxListResponseDTO> failed(@RequestAttribute(AuthIdentity.REQUEST_ATTRIBUTE) AuthIdentity identity,
                                                  @RequestParam(value = "limit", required = false) Integer limit) {
        trustBoundaryDomainService.ensureWritable(identity);
        return success(outboxQueryService.listFailed(identity.getProjectId(), limit));
    }

    @PostMapping("/{entryId}/retry")
    public Response<OutboxEntryDTO> retry(@RequestAttribute(AuthIdentity.REQUEST_ATTRIBUTE) AuthIdentity identity,
                                          @PathVariable("entryId") String entryId) {
        trustBoundaryDomainService.ensureWritable(identity);
        OutboxEntryDTO dto = assembler.toOutboxEntryDTO(
                outboxDeliveryCommandService.requeue(identity.getProjectId(), entryId));
        log.info("Outbox entry requeued by operator. projectId={}, entryId={}, actorId={}",
                identity.getProjectId(), entryId, identity.getActorId());
        return success(dto);
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
