package com.beadhub.trigger.application.query;

import com.beadhub.api.dto.ClaimListResponseDTO;
import com.beadhub.domain.auth.model.valobj.AuthIdentity;
import com.beadhub.domain.bead.adapter.repository.IBeadClaimRepository;
import com.beadhub.domain.bead.model.entity.BeadClaimEntity;
import com.beadhub.trigger.application.common.CoordinationViewAssembler;
import com.beadhub.trigger.application.common.PageCursorCodec;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 认领读用例。
 */
@Service
public class ClaimQueryService {

    private final IBeadClaimRepository beadClaimRepository;
    private final PageCursorCodec pageCursorCodec;
    private final CoordinationViewAssembler coordinationViewAssembler;

    public ClaimQueryService(IBeadClaimRepository beadClaimRepository,
                             PageCursorCodec pageCursorCodec,
                             CoordinationViewAssembler coordinationViewAssembler) {
        this.beadClaimRepository = beadClaimRepository;
        this.pageCursorCodec = pageCursorCodec;
        this.coordinationViewAssembler = coordinationViewAssembler;
    }

    public ClaimListResponseDTO list(AuthIdentity identity, String workspaceId, Integer limit, String cursor) {
        int pageSize = pageCursorCodec.normalizeLimit(limit);
        PageCursorCodec.PageCursor after = pageCursorCodec.decode(cursor);
        List<BeadClaimEntity> rows = beadClaimRepository.findPage(identity.getProjectId(),
                StringUtils.trimToNull(workspaceId),
                after == null ? null : after.createdAt(),
                after == null ? null : after.id(),
                pageSize + 1);
        boolean hasMore = rows.size() > pageSize;
        List<BeadClaimEntity> page = hasMore ? rows.subList(0, pageSize) : rows;

        ClaimListResponseDTO response = new ClaimListResponseDTO();
        response.setClaims(coordinationViewAssembler.toClaimDTOs(page, identity.isPublicReader()));
        response.setHasMore(hasMore);
        if (hasMore) {
            BeadClaimEntity last = page.get(page.size() - 1);
            response.setNextCursor(pageCursorCodec.encode(last.getClaimedAt(), last.getId()));
        }
        return response;
    }

    /**
     * 某工作区当前持有的全部认领（最多一页上限）。
     */
    public List<BeadClaimEntity> listByWorkspace(String projectId, String workspaceId) {
        return beadClaimRepository.findPage(projectId, workspaceId, null, null, PageCursorCodec.MAX_LIMIT);
    }
}
