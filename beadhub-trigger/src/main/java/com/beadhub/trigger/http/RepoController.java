package com.beadhub.trigger.http;

import com.beadhub.api.dto.RepoDeleteResponseDTO;
import com.beadhub.api.dto.RepoEnsureRequestDTO;
import com.beadhub.api.dto.RepoEnsureResponseDTO;
import com.beadhub.api.dto.RepoListResponseDTO;
import com.beadhub.api.dto.RepoLookupRequestDTO;
import com.beadhub.api.dto.RepoLookupResponseDTO;
import com.beadhub.api.response.Response;
import com.beadhub.domain.auth.model.valobj.AuthIdentity;
import com.beadhub.domain.presence.service.PresenceDomainService;
import com.beadhub.trigger.application.command.RepoCommandService;
import com.beadhub.trigger.application.query.RepoQueryService;
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

/**
 * 仓库查找、注册、列表与级联删除 API。
 */
@RestController
@RequestMapping("/v1/repos")
public class RepoController {

    private final RepoQueryService repoQueryService;
    private final RepoCommandService repoCommandService;
    private final PresenceDomainService presenceDomainService;

    public RepoController(RepoQueryService repoQueryService,
                          RepoCommandService repoCommandService,
                          PresenceDomainService presenceDomainService) {
        this.repoQueryService = repoQueryService;
        this.repoCommandService = repoCommandService;
        this.presenceDomainService = presenceDomainService;
    }

    @PostMapping("/lookup")
    public Response<RepoLookupResponseDTO> lookup(@RequestAttribute(AuthIdentity.REQUEST_ATTRIBUTE) AuthIdentity identity,
                                                  @RequestBody RepoLookupRequestDTO request) {
        if (request == null) {
            throw AppException.illegalParameter("Request body is required");
        }
        return success(repoQueryService.lookup(identity, request.getOriginUrl()));
    }

    @PostMapping("/ensure")
    public Response<RepoEnsureResponseDTO> ensure(@RequestAttribute(AuthIdentity.REQUEST_ATTRIBUTE) AuthIdentity identity,
                                                  @RequestBody RepoEnsureRequestDTO request) {
        if (request == null) {
            throw AppException.illegalParameter("Request body is required");
        }
        return success(repoCommandService.ensure(identity, request));
    }

    @GetMapping
    public Response<RepoListResponseDTO> list(@RequestAttribute(AuthIdentity.REQUEST_ATTRIBUTE) AuthIdentity identity,
                                              @RequestParam(value = "limit", required = false) Integer limit,
                                              @RequestParam(value = "cursor", required = false) String cursor) {
        return success(repoQueryService.list(identity, limit, cursor));
    }

    @DeleteMapping("/{repoId}")
    public Response<RepoDeleteResponseDTO> delete(@RequestAttribute(AuthIdentity.REQUEST_ATTRIBUTE) AuthIdentity identity,
                                                  @PathVariable("repoId") String repoId) {
        RepoCommandService.RepoDeletion deletion = repoCommandService.delete(identity, repoId);
        // 事务已提交，缓存清理失败时在线记录随 TTL 自然过期
        int presenceCleared = presenceDomainService.clear(deletion.workspaceIds());
        RepoDeleteResponseDTO response = new RepoDeleteResponseDTO();
        response.setId(deletion.repoId());
        response.setWorkspacesDeleted(deletion.workspacesDeleted());
        response.setClaimsDeleted(deletion.claimsDeleted());
        response.setPresenceCleared(presenceCleared);
        return success(response);
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
