package com.beadhub.trigger.application.command;

import com.beadhub.api.dto.EscalationCreateRequestDTO;
import com.beadhub.api.dto.EscalationRespondRequestDTO;
import com.beadhub.domain.auth.model.valobj.AuthIdentity;
import com.beadhub.domain.auth.service.TrustBoundaryDomainService;
import com.beadhub.domain.escalation.adapter.repository.IEscalationRepository;
import com.beadhub.domain.escalation.model.entity.EscalationEntity;
import com.beadhub.domain.escalation.service.EscalationDomainService;
import com.beadhub.domain.notification.adapter.repository.IOutboxRepository;
import com.beadhub.domain.notification.service.OutboxDomainService;
import com.beadhub.domain.project.model.entity.WorkspaceEntity;
import com.beadhub.trigger.application.common.WorkspaceGuard;
import com.beadhub.trigger.event.ProjectEventPublisher;
import com.beadhub.types.enums.EventTypeEnum;
import com.beadhub.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 升级请求写用例：创建、响应与到期处理。
 */
@Slf4j
@Service
public class EscalationCommandService {

    private final WorkspaceGuard workspaceGuard;
    private final TrustBoundaryDomainService trustBoundaryDomainService;
    private final IEscalationRepository escalationRepository;
    private final IOutboxRepository outboxRepository;
    private final EscalationDomainService escalationDomainService;
    private final OutboxDomainService outboxDomainService;
    private final ProjectEventPublisher projectEventPublisher;

    public EscalationCommandService(WorkspaceGuard workspaceGuard,
                                    TrustBoundaryDomainService trustBoundaryDomainService,
                                    IEscalationRepository escalationRepository,
                                    IOutboxRepository outboxRepository,
                                    EscalationDomainService escalationDomainService,
                                    OutboxDomainService outboxDomainService,
                                    ProjectEventPublisher projectEventPublisher) {
        this.workspaceGuard = workspaceGuard;
        this.trustBoundaryDomainService = trustBoundaryDomainService;
        this.escalationRepository = escalationRepository;
        this.outboxRepository = outboxRepository;
        this.escalationDomainService = escalationDomainService;
        this.outboxDomainService = outboxDomainService;
        this.projectEventPublisher = projectEventPublisher;
    }

    @Transactional(rollbackFor = Exception.class)
    public EscalationEntity create(AuthIdentity identity, EscalationCreateRequestDTO request) {
        if (request == null) {
            throw AppException.illegalParameter("Request body is required");
        }
        WorkspaceEntity raiser = workspaceGuard.requireActingWorkspace(identity, request.getWorkspaceId());
        EscalationEntity escalation = escalationDomainService.create(raiser, request.getSubject(), request.getSituation(),
                request.getOptions(), request.getExpiresInSeconds());
        escalation = escalationRepository.save(escalation);
        projectEventPublisher.publishAfterCommit(EventTypeEnum.ESCALATION_CREATED, escalation.getProjectId(),
                escalation.getWorkspaceId(), eventPayload(escalation));
        log.info("Escalation created. projectId={}, escalationId={}, workspaceId={}",
                escalation.getProjectId(), escalation.getId(), escalation.getWorkspaceId());
        return escalation;
    }

    /**
     * 响应待处理的升级请求；通知发起工作区的发件箱条目与状态变更同事务写入。
     */
    @Transactional(rollbackFor = Exception.class)
    public EscalationEntity respond(AuthIdentity identity, String escalationId, EscalationRespondRequestDTO request) {
        trustBoundaryDomainService.ensureWritable(identity);
        String projectId = identity.getProjectId();
        EscalationEntity escalation = escalationRepository.lockById(projectId, escalationId);
        if (escalation == null) {
            throw AppException.notFound("Escalation not found: " + escalationId);
        }
        // 已到期但尚未被守护进程处理的请求在这里按 expired 拒绝，状态落库留给到期守护进程
        escalationDomainService.respond(escalation, request == null ? null : request.getResponse(),
                request == null ? null : request.getNote(), LocalDateTime.now());
        if (!escalationRepository.updateFromPending(escalation)) {
            Map<String, Object> detail = new LinkedHashMap<>();
            detail.put("escalation_id", escalationId);
            throw AppException.conflict("Escalation is no longer pending", detail);
        }
        outboxRepository.save(outboxDomainService.buildEscalationResponseEntry(projectId, escalation.getId(),
                escalation.getSubject(), escalation.getResponse(), escalation.getResponseNote(),
                escalation.getWorkspaceId(), escalation.getAlias()));
        projectEventPublisher.publishAfterCommit(EventTypeEnum.ESCALATION_RESPONDED, projectId,
                escalation.getWorkspaceId(), eventPayload(escalation));
        log.info("Escalation responded. projectId={}, escalationId={}", projectId, escalationId);
        return escalation;
    }

    /**
     * 将已到期的待处理请求置为 expired。
     *
     * @return 本批次过期数量
     */
    @Transactional(rollbackFor = Exception.class)
    public int expireDue(int limit) {
        List<EscalationEntity> due = escalationRepository.lockDuePending(LocalDateTime.now(), limit);
        int expired = 0;
        for (EscalationEntity escalation : due) {
            escalation.expire();
            if (escalationRepository.updateFromPending(escalation)) {
                expired++;
                publishExpired(escalation);
            }
        }
        return expired;
    }

    private void publishExpired(EscalationEntity escalation) {
        projectEventPublisher.publishAfterCommit(EventTypeEnum.ESCALATION_EXPIRED, escalation.getProjectId(),
                escalation.getWorkspaceId(), eventPayload(escalation));
    }

    private Map<String, Object> eventPayload(EscalationEntity escalation) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("escalation_id", escalation.getId());
        payload.put("alias", escalation.getAlias());
        payload.put("subject", escalation.getSubject());
        payload.put("status", escalation.getStatus() == null ? null : escalation.getStatus().getCode());
        return payload;
    }
}
