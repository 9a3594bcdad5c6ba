package com.beadhub.trigger.http;

import com.beadhub.api.dto.PolicyActivateRequestDTO;
import com.beadhub.api.dto.PolicyCreateRequestDTO;
import com.beadhub.api.dto.PolicyDTO;
import com.beadhub.api.dto.PolicyHistoryResponseDTO;
import com.beadhub.api.response.Response;
import com.beadhub.domain.auth.model.valobj.AuthIdentity;
import com.beadhub.domain.auth.service.TrustBoundaryDomainService;
import com.beadhub.domain.policy.model.entity.PolicyEntity;
import com.beadhub.trigger.application.command.PolicyCommandService;
import com.beadhub.trigger.application.common.CoordinationViewAssembler;
import com.beadhub.trigger.application.common.WorkspaceGuard;
import com.beadhub.trigger.application.query.PolicyQueryService;
import com.beadhub.types.enums.ResponseCode;
import com.beadhub.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 项目策略 API：激活策略读取（带 ETag）、历史、新版本创建、回滚与重置。
 */
@RestController
@RequestMapping("/v1/policies")
public class PolicyController {

    private final PolicyQueryService policyQueryService;
    private final PolicyCommandService policyCommandService;
    private final TrustBoundaryDomainService trustBoundaryDomainService;
    private final WorkspaceGuard workspaceGuard;
    private final CoordinationViewAssembler assembler;

    public PolicyController(PolicyQueryService policyQueryService,
                            PolicyCommandService policyCommandService,
                            TrustBoundaryDomainService trustBoundaryDomainService,
                            WorkspaceGuard workspaceGuard,
                            CoordinationViewAssembler assembler) {
        this.policyQueryService = policyQueryService;
        this.policyCommandService = policyCommandService;
        this.trustBoundaryDomainService = trustBoundaryDomainService;
        this.workspaceGuard = workspaceGuard;
        this.assembler = assembler;
    }

    @GetMapping("/active")
    public ResponseEntity<Response<PolicyDTO>> active(@RequestAttribute(AuthIdentity.REQUEST_ATTRIBUTE) AuthIdentity identity,
                                                      @RequestParam(value = "role", required = false) String role,
                                                      @RequestParam(value = "only_selected", required = false, defaultValue = "false") boolean onlySelected,
                                                      @RequestHeader(value = HttpHeaders.IF_NONE_MATCH, required = false) String ifNoneMatch) {
        PolicyDTO policy = policyQueryService.getActive(identity.getProjectId(), role, onlySelected);
        String etag = "\"" + policy.getPolicyId() + "\"";
        if (matchesEtag(ifNoneMatch, policy.getPolicyId())) {
            return ResponseEntity.status(HttpStatus.NOT_MODIFIED).eTag(etag).build();
        }
        return ResponseEntity.ok().eTag(etag).body(success(policy));
    }

    @GetMapping
    public Response<PolicyHistoryResponseDTO> history(@RequestAttribute(AuthIdentity.REQUEST_ATTRIBUTE) AuthIdentity identity,
                                                      @RequestParam(value = "limit", required = false) Integer limit) {
        return success(policyQueryService.history(identity.getProjectId(), limit));
    }

    @GetMapping("/{policyId}")
    public Response<PolicyDTO> get(@RequestAttribute(AuthIdentity.REQUEST_ATTRIBUTE) AuthIdentity identity,
                                   @PathVariable("policyId") String policyId) {
        return success(policyQueryService.get(identity.getProjectId(), policyId));
    }

    @PostMapping
    public Response<PolicyDTO> create(@RequestAttribute(AuthIdentity.REQUEST_ATTRIBUTE) AuthIdentity identity,
                                      @RequestBody PolicyCreateRequestDTO request) {
        if (request == null || request.getBundle() == null) {
            throw AppException.illegalParameter("bundle is required");
        }
        String workspaceId = ensureWriter(identity, request.getWorkspaceId());
        boolean activate = request.getActivate() == null || request.getActivate();
        PolicyEntity created = policyCommandService.create(identity.getProjectId(),
                assembler.toBundle(request.getBundle()),
                StringUtils.trimToNull(request.getBasePolicyId()),
                activate,
                workspaceId);
        String activeId = activate ? created.getPolicyId() : null;
        return success(assembler.toPolicyDTO(created, created.getBundle(), activeId, null));
    }

    @PostMapping("/{policyId}/activate")
    public Response<PolicyDTO> activate(@RequestAttribute(AuthIdentity.REQUEST_ATTRIBUTE) AuthIdentity identity,
                                        @PathVariable("policyId") String policyId,
                                        @RequestBody(required = false) PolicyActivateRequestDTO request) {
        trustBoundaryDomainService.ensureWritable(identity);
        String basePolicyId = request == null ? null : StringUtils.trimToNull(request.getBasePolicyId());
        PolicyEntity activated = policyCommandService.activate(identity.getProjectId(), policyId, basePolicyId);
        return success(assembler.toPolicyDTO(activated, activated.getBundle(), activated.getPolicyId(), null));
    }

    @PostMapping("/reset")
    public Response<PolicyDTO> reset(@RequestAttribute(AuthIdentity.REQUEST_ATTRIBUTE) AuthIdentity identity,
                                     @RequestBody(required = false) PolicyActivateRequestDTO request,
                                     @RequestParam(value = "workspace_id", required = false) String workspaceId) {
        String createdBy = ensureWriter(identity, workspaceId);
        String basePolicyId = request == null ? null : StringUtils.trimToNull(request.getBasePolicyId());
        PolicyEntity created = policyCommandService.resetToDefaults(identity.getProjectId(), basePolicyId, createdBy);
        return success(assembler.toPolicyDTO(created, created.getBundle(), created.getPolicyId(), null));
    }

    /**
     * 写操作需要非只读身份；携带 workspace_id 时额外校验 actor 绑定。
     */
    private String ensureWriter(AuthIdentity identity, String workspaceId) {
        if (StringUtils.isBlank(workspaceId)) {
            trustBoundaryDomainService.ensureWritable(identity);
            return null;
        }
        return workspaceGuard.requireActingWorkspace(identity, workspaceId).getWorkspaceId();
    }

    private boolean matchesEtag(String ifNoneMatch, String policyId) {
        if (StringUtils.isBlank(ifNoneMatch) || StringUtils.isBlank(policyId)) {
            return false;
        }
        for (String candidate : ifNoneMatch.split(",")) {
            String tag = StringUtils.removeStart(candidate.trim(), "W/");
            tag = StringUtils.strip(tag, "\"");
            if ("*".equals(tag) || policyId.equals(tag)) {
                return true;
            }
        }
        return false;
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
