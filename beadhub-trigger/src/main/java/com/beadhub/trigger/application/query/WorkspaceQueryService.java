package com.beadhub.trigger.application.query;

import com.beadhub.api.dto.WorkspaceDTO;
import com.beadhub.api.dto.WorkspaceListResponseDTO;
import com.beadhub.domain.auth.model.valobj.AuthIdentity;
import com.beadhub.domain.presence.adapter.repository.IPresenceRepository;
import com.beadhub.domain.presence.model.valobj.PresenceFilter;
import com.beadhub.domain.presence.model.valobj.PresenceRecord;
import com.beadhub.domain.project.adapter.repository.IWorkspaceRepository;
import com.beadhub.domain.project.model.entity.WorkspaceEntity;
import com.beadhub.trigger.application.common.CoordinationViewAssembler;
import com.beadhub.trigger.application.common.PageCursorCodec;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 工作区读用例：数据库中的存活工作区叠加 Redis 在线状态。
 */
@Slf4j
@Service
public class WorkspaceQueryService {

    private final IWorkspaceRepository workspaceRepository;
    private final IPresenceRepository presenceRepository;
    private final PageCursorCodec pageCursorCodec;
    private final CoordinationViewAssembler coordinationViewAssembler;

    public WorkspaceQueryService(IWorkspaceRepository workspaceRepository,
                                 IPresenceRepository presenceRepository,
                                 PageCursorCodec pageCursorCodec,
                                 CoordinationViewAssembler coordinationViewAssembler) {
        this.workspaceRepository = workspaceRepository;
        this.presenceRepository = presenceRepository;
        this.pageCursorCodec = pageCursorCodec;
        this.coordinationViewAssembler = coordinationViewAssembler;
    }

    public WorkspaceListResponseDTO list(AuthIdentity identity, String repoId, Integer limit, String cursor) {
        int pageSize = pageCursorCodec.normalizeLimit(limit);
        PageCursorCodec.PageCursor after = pageCursorCodec.decode(cursor);
        List<WorkspaceEntity> rows = workspaceRepository.findActivePage(identity.getProjectId(),
                StringUtils.trimToNull(repoId),
                after == null ? null : after.createdAt(),
                after == null ? null : after.id(),
                pageSize + 1);
        boolean hasMore = rows.size() > pageSize;
        List<WorkspaceEntity> page = hasMore ? rows.subList(0, pageSize) : rows;

        Map<String, PresenceRecord> online = onlineByWorkspace(PresenceFilter.builder()
                .projectId(identity.getProjectId())
                .repoId(StringUtils.trimToNull(repoId))
                .build());
        List<WorkspaceDTO> workspaces = new ArrayList<>();
        for (WorkspaceEntity workspace : page) {
            workspaces.add(coordinationViewAssembler.toWorkspaceDTO(workspace,
                    online.get(workspace.getWorkspaceId()), identity.isPublicReader()));
        }

        WorkspaceListResponseDTO response = new WorkspaceListResponseDTO();
        response.setWorkspaces(workspaces);
        response.setHasMore(hasMore);
        if (hasMore) {
            WorkspaceEntity last = page.get(page.size() - 1);
            response.setNextCursor(pageCursorCodec.encode(last.getCreatedAt(), last.getWorkspaceId()));
        }
        return response;
    }

    /**
     * 在线状态查询失败时按“无人在线”处理。
     */
    public List<PresenceRecord> lookupOnline(PresenceFilter filter) {
        try {
            return presenceRepository.lookup(filter);
        } catch (RuntimeException ex) {
            log.warn("Presence lookup failed, treating as empty. projectId={}, error={}",
                    filter.getProjectId(), ex.getMessage());
            return Collections.emptyList();
        }
    }

    private Map<String, PresenceRecord> onlineByWorkspace(PresenceFilter filter) {
        Map<String, PresenceRecord> result = new HashMap<>();
        for (PresenceRecord record : lookupOnline(filter)) {
            result.put(record.getWorkspaceId(), record);
        }
        return result;
    }
}
