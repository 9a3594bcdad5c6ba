package com.beadhub.domain.presence.service;

import com.beadhub.domain.presence.adapter.gateway.IProjectEventGateway;
import com.beadhub.domain.presence.adapter.repository.IPresenceRepository;
import com.beadhub.domain.presence.model.valobj.PresenceRecord;
import com.beadhub.domain.presence.model.valobj.ProjectEvent;
import com.beadhub.domain.project.model.entity.WorkspaceEntity;
import com.beadhub.types.enums.EventTypeEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 在线状态领域服务：心跳写入与 presence.updated 事件广播，任何缓存异常都不影响调用方。
 */
@Slf4j
@Service
public class PresenceDomainService {

    static final int MIN_TTL_SECONDS = 10;

    private final IPresenceRepository presenceRepository;
    private final IProjectEventGateway projectEventGateway;
    private final int ttlSeconds;

    public PresenceDomainService(IPresenceRepository presenceRepository,
                                 IProjectEventGateway projectEventGateway,
                                 @Value("${beadhub.presence.ttl-seconds:1800}") int ttlSeconds) {
        this.presenceRepository = presenceRepository;
        this.projectEventGateway = projectEventGateway;
        this.ttlSeconds = Math.max(MIN_TTL_SECONDS, ttlSeconds);
    }

    public int getTtlSeconds() {
        return ttlSeconds;
    }

    public PresenceRecord heartbeat(WorkspaceEntity workspace, String branch, String currentBead, String commandLine) {
        PresenceRecord record = PresenceRecord.builder()
                .workspaceId(workspace.getWorkspaceId())
                .projectId(workspace.getProjectId())
                .repoId(workspace.getRepoId())
                .branch(branch)
                .alias(workspace.getAlias())
                .humanName(workspace.getHumanName())
                .role(workspace.getRole())
                .currentBead(currentBead)
                .commandLine(commandLine)
                .lastSeen(OffsetDateTime.now(ZoneOffset.UTC).toString())
                .build();
        try {
            presenceRepository.heartbeat(record, ttlSeconds);
        } catch (RuntimeException ex) {
            log.warn("Presence heartbeat failed. workspaceId={}, error={}", workspace.getWorkspaceId(), ex.getMessage());
            return record;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("workspace_id", record.getWorkspaceId());
        payload.put("alias", record.getAlias());
        payload.put("repo_id", record.getRepoId());
        payload.put("branch", record.getBranch());
        payload.put("current_bead", record.getCurrentBead());
        payload.put("last_seen", record.getLastSeen());
        projectEventGateway.publish(ProjectEvent.builder()
                .type(EventTypeEnum.PRESENCE_UPDATED)
                .projectId(record.getProjectId())
                .workspaceId(record.getWorkspaceId())
                .payload(payload)
                .occurredAt(record.getLastSeen())
                .build());
        return record;
    }

    /**
     * 删除工作区的在线记录，索引集合中的残留成员由读取路径清理。
     *
     * @return 实际删除的记录数；缓存不可用时为 0
     */
    public int clear(Collection<String> workspaceIds) {
        if (workspaceIds == null || workspaceIds.isEmpty()) {
            return 0;
        }
        try {
            return presenceRepository.clear(workspaceIds);
        } catch (RuntimeException ex) {
            log.warn("Presence clear failed. workspaces={}, error={}", workspaceIds.size(), ex.getMessage());
            return 0;
        }
    }
}
