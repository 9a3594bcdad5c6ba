package com.beadhub.test;

import com.beadhub.api.dto.EscalationCreateRequestDTO;
import com.beadhub.api.dto.EscalationRespondRequestDTO;
import com.beadhub.domain.auth.model.valobj.AuthIdentity;
import com.beadhub.domain.auth.service.TrustBoundaryDomainService;
import com.beadhub.domain.escalation.adapter.repository.IEscalationRepository;
import com.beadhub.domain.escalation.model.entity.EscalationEntity;
import com.beadhub.domain.escalation.service.EscalationDomainService;
import com.beadhub.domain.notification.model.entity.OutboxEntryEntity;
import com.beadhub.domain.notification.service.OutboxDomainService;
import com.beadhub.domain.project.model.entity.WorkspaceEntity;
import com.beadhub.test.support.InMemoryOutboxRepository;
import com.beadhub.trigger.application.command.EscalationCommandService;
import com.beadhub.trigger.application.common.WorkspaceGuard;
import com.beadhub.trigger.event.ProjectEventPublisher;
import com.beadhub.types.enums.EscalationStatusEnum;
import com.beadhub.types.enums.EventTypeEnum;
import com.beadhub.types.enums.PrincipalKindEnum;
import com.beadhub.types.enums.ResponseCode;
import com.beadhub.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class EscalationCommandServiceTest {

    private WorkspaceGuard workspaceGuard;
    private IEscalationRepository escalationRepository;
    private InMemoryOutboxRepository outboxRepository;
    private ProjectEventPublisher projectEventPublisher;
    private EscalationCommandService service;

    @BeforeEach
    public void setUp() {
        workspaceGuard = mock(WorkspaceGuard.class);
        escalationRepository = mock(IEscalationRepository.class);
        outboxRepository = new InMemoryOutboxRepository();
        projectEventPublisher = mock(ProjectEventPublisher.class);
        service = new EscalationCommandService(workspaceGuard, mock(TrustBoundaryDomainService.class),
                escalationRepository, outboxRepository, new EscalationDomainService(3600, 7200),
                new OutboxDomainService(3, 30, 1800), projectEventPublisher);
        when(escalationRepository.save(any(EscalationEntity.class))).thenAnswer(invocation -> {
            EscalationEntity entity = invocation.getArgument(0);
            entity.setId("esc-1");
            return entity;
        });
    }

    @Test
    public void shouldCreateEscalationForActingWorkspaceAndPublishAfterCommit() {
        when(workspaceGuard.requireActingWorkspace(agent(), "ws-a")).thenReturn(workspace());
        EscalationCreateRequestDTO request = new EscalationCreateRequestDTO();
        request.setWorkspaceId("ws-a");
        request.setSubject("Schema change needs sign-off");
        request.setOptions(List.of("approve", "reject"));

        EscalationEntity created = service.create(agent(), request);

        Assertions.assertEquals("esc-1", created.getId());
        Assertions.assertEquals(EscalationStatusEnum.PENDING, created.getStatus());
        Assertions.assertEquals("alice-dev", created.getAlias());
        verify(projectEventPublisher).publishAfterCommit(eq(EventTypeEnum.ESCALATION_CREATED), eq("p-1"),
                eq("ws-a"), anyMap());
    }

    @Test
    public void shouldNotPersistWhenWorkspaceIsGone() {
        when(workspaceGuard.requireActingWorkspace(agent(), "ws-a"))
                .thenThrow(new AppException(ResponseCode.GONE, "Workspace has been deleted: ws-a"));
        EscalationCreateRequestDTO request = new EscalationCreateRequestDTO();
        request.setWorkspaceId("ws-a");
        request.setSubject("anything");

        AppException ex = Assertions.assertThrows(AppException.class, () -> service.create(agent(), request));

        Assertions.assertEquals(ResponseCode.GONE.getCode(), ex.getCode());
        verify(escalationRepository, never()).save(any(EscalationEntity.class));
    }

    @Test
    public void shouldQueueOutboxEntryForRaiserWhenResponded() {
        EscalationEntity pending = pending(LocalDateTime.now().plusHours(1));
        when(escalationRepository.lockById("p-1", "esc-1")).thenReturn(pending);
        when(escalationRepository.updateFromPending(pending)).thenReturn(true);

        EscalationEntity responded = service.respond(agent(), "esc-1", respondRequest("approve"));

        Assertions.assertEquals(EscalationStatusEnum.RESPONDED, responded.getStatus());
        List<OutboxEntryEntity> queued = outboxRepository.all();
        Assertions.assertEquals(1, queued.size());
        Assertions.assertEquals(OutboxEntryEntity.EVENT_ESCALATION_RESPONSE, queued.get(0).getEventType());
        Assertions.assertEquals("ws-a", queued.get(0).getRecipientWorkspaceId());
        verify(projectEventPublisher).publishAfterCommit(eq(EventTypeEnum.ESCALATION_RESPONDED), eq("p-1"),
                eq("ws-a"), anyMap());
    }

    @Test
    public void shouldConflictWhenEscalationAlreadyExpired() {
        EscalationEntity overdue = pending(LocalDateTime.now().minusMinutes(1));
        when(escalationRepository.lockById("p-1", "esc-1")).thenReturn(overdue);

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> service.respond(agent(), "esc-1", respondRequest("approve")));

        Assertions.assertEquals(ResponseCode.CONFLICT.getCode(), ex.getCode());
        Assertions.assertTrue(outboxRepository.all().isEmpty());
        verify(escalationRepository, never()).updateFromPending(any(EscalationEntity.class));
    }

    @Test
    public void shouldConflictWhenAnotherResponderWonTheRace() {
        EscalationEntity pending = pending(LocalDateTime.now().plusHours(1));
        when(escalationRepository.lockById("p-1", "esc-1")).thenReturn(pending);
        when(escalationRepository.updateFromPending(pending)).thenReturn(false);

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> service.respond(agent(), "esc-1", respondRequest("reject")));

        Assertions.assertEquals(ResponseCode.CONFLICT.getCode(), ex.getCode());
        Assertions.assertTrue(outboxRepository.all().isEmpty());
    }

    @Test
    public void shouldExpireOnlyRowsStillPending() {
        EscalationEntity first = pending(LocalDateTime.now().minusMinutes(5));
        EscalationEntity second = pending(LocalDateTime.now().minusMinutes(1));
        second.setId("esc-2");
        when(escalationRepository.lockDuePending(any(LocalDateTime.class), eq(50))).thenReturn(List.of(first, second));
        when(escalationRepository.updateFromPending(first)).thenReturn(true);
        when(escalationRepository.updateFromPending(second)).thenReturn(false);

        int expired = service.expireDue(50);

        Assertions.assertEquals(1, expired);
        Assertions.assertEquals(EscalationStatusEnum.EXPIRED, first.getStatus());
        verify(projectEventPublisher, times(1)).publishAfterCommit(eq(EventTypeEnum.ESCALATION_EXPIRED),
                anyString(), anyString(), anyMap());
    }

    private EscalationEntity pending(LocalDateTime expiresAt) {
        EscalationEntity entity = new EscalationEntity();
        entity.setId("esc-1");
        entity.setProjectId("p-1");
        entity.setWorkspaceId("ws-a");
        entity.setAlias("alice-dev");
        entity.setSubject("Schema change needs sign-off");
        entity.setStatus(EscalationStatusEnum.PENDING);
        entity.setCreatedAt(expiresAt.minusHours(2));
        entity.setExpiresAt(expiresAt);
        return entity;
    }

    private EscalationRespondRequestDTO respondRequest(String response) {
        EscalationRespondRequestDTO request = new EscalationRespondRequestDTO();
        request.setResponse(response);
        return request;
    }

    private WorkspaceEntity workspace() {
        WorkspaceEntity workspace = new WorkspaceEntity();
        workspace.setWorkspaceId("ws-a");
        workspace.setProjectId("p-1");
        workspace.setAlias("alice-dev");
        workspace.setHumanName("Alice");
        return workspace;
    }

    private AuthIdentity agent() {
        return AuthIdentity.builder()
                .projectId("p-1")
                .actorId("ws-a")
                .principalKind(PrincipalKindEnum.API_KEY)
                .principalId("k-1")
                .build();
    }
}
