package com.beadhub.trigger.event;

import com.beadhub.domain.presence.adapter.gateway.IProjectEventGateway;
import com.beadhub.domain.presence.model.valobj.ProjectEvent;
import com.beadhub.types.enums.EventTypeEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 项目事件发布器：事务内登记，提交后发布；回滚时事件被丢弃。
 */
@Slf4j
@Component
public class ProjectEventPublisher {

    private final IProjectEventGateway projectEventGateway;

    public ProjectEventPublisher(IProjectEventGateway projectEventGateway) {
        this.projectEventGateway = projectEventGateway;
    }

    public void publishAfterCommit(EventTypeEnum type, String projectId, String workspaceId, Map<String, Object> payload) {
        publishAfterCommit(ProjectEvent.builder()
                .type(type)
                .projectId(projectId)
                .workspaceId(workspaceId)
                .payload(payload == null ? new LinkedHashMap<>() : payload)
                .occurredAt(OffsetDateTime.now(ZoneOffset.UTC).toString())
                .build());
    }

    public void publishAfterCommit(ProjectEvent event) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            publishQuietly(event);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                publishQuietly(event);
            }
        });
    }

    private void publishQuietly(ProjectEvent event) {
        try {
            projectEventGateway.publish(event);
        } catch (RuntimeException ex) {
            log.warn("Project event publish failed. projectId={}, type={}, error={}",
                    event.getProjectId(), event.typeName(), ex.getMessage());
        }
    }
}
