package com.beadhub.trigger.http;

import com.beadhub.api.dto.SubscriptionCreateRequestDTO;
import com.beadhub.api.dto.SubscriptionDTO;
import com.beadhub.api.dto.SubscriptionListResponseDTO;
import com.beadhub.api.response.Response;
import com.beadhub.domain.auth.model.valobj.AuthIdentity;
import com.beadhub.trigger.application.command.SubscriptionCommandService;
import com.beadhub.trigger.application.common.CoordinationViewAssembler;
import com.beadhub.trigger.application.query.SubscriptionQueryService;
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
import java.util.Map;

/**
 * bead 订阅 API。
 */
@RestController
@RequestMapping("/v1/subscriptions")
public class SubscriptionController {

    private final SubscriptionCommandService subscriptionCommandService;
    private final SubscriptionQueryService subscriptionQueryService;
    private final CoordinationViewAssembler assembler;

    public SubscriptionController(SubscriptionCommandService subscriptionCommandService,
                                  SubscriptionQueryService subscriptionQueryService,
                                  CoordinationViewAssembler assembler) {
        this.subscriptionCommandService = subscriptionCommandService;
        this.subscriptionQueryService = subscriptionQueryService;
        this.assembler = assembler;
    }

    @PostMapping
    public Response<SubscriptionDTO> subscribe(@RequestAttribute(AuthIdentity.REQUEST_ATTRIBUTE) AuthIdentity identity,
                                               @RequestBody SubscriptionCreateRequestDTO request) {
        if (request == null) {
            throw AppException.illegalParameter("Request body is required");
        }
        return success(assembler.toSubscriptionDTO(subscriptionCommandService.subscribe(identity, request)));
    }

    @GetMapping
    public Response<SubscriptionListResponseDTO> list(@RequestAttribute(AuthIdentity.REQUEST_ATTRIBUTE) AuthIdentity identity,
                                                      @RequestParam(value = "workspace_id", required = false) String workspaceId) {
        return success(subscriptionQueryService.list(identity, workspaceId));
    }

    @DeleteMapping("/{subscriptionId}")
    public Response<Map<String, Object>> unsubscribe(@RequestAttribute(AuthIdentity.REQUEST_ATTRIBUTE) AuthIdentity identity,
                                                     @PathVariable("subscriptionId") String subscriptionId,
                                                     @RequestParam(value = "workspace_id", required = false) String workspaceId) {
        subscriptionCommandService.unsubscribe(identity, workspaceId, subscriptionId);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("subscription_id", subscriptionId);
        data.put("deleted", Boolean.TRUE);
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
