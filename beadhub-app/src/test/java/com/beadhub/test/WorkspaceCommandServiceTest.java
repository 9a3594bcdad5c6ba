package com.beadhub.test;

import com.beadhub.api.dto.HeartbeatRequestDTO;
import com.beadhub.domain.auth.model.valobj.AuthIdentity;
import com.beadhub.domain.bead.model.entity.BeadClaimEntity;
import com.beadhub.domain.notification.model.entity.SubscriptionEntity;
import com.beadhub.domain.presence.service.PresenceDomainService;
import com.beadhub.domain.project.adapter.repository.IWorkspaceRepository;
import com.beadhub.domain.project.model.entity.WorkspaceEntity;
import com.beadhub.test.support.InMemoryBeadClaimRepository;
import com.beadhub.test.support.InMemorySubscriptionRepository;
import com.beadhub.trigger.application.command.WorkspaceCommandService;
import com.beadhub.trigger.application.common.WorkspaceGuard;
import com.beadhub.trigger.event.ProjectEventPublisher;
import com.beadhub.types.enums.EventTypeEnum;
import com.beadhub.types.enums.PrincipalKindEnum;
import com.beadhub.types.enums.ResponseCode;
import com.beadhub.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class WorkspaceCommandServiceTest {

    private WorkspaceGuard workspaceGuard;
    private IWorkspaceRepository workspaceRepository;
    private InMemoryBeadClaimRepository claimRepository;
    private InMemorySubscriptionRepository subscriptionRepository;
    private PresenceDomainService presenceDomainService;
    private ProjectEventPublisher projectEventPublisher;
    private WorkspaceCommandService service;

    @BeforeEach
    public void setUp() {
        workspaceGuard = mock(WorkspaceGuard.class);
        workspaceRepository = mock(IWorkspaceRepository.class);
        claimRepository = new InMemoryBeadClaimRepository();
        subscriptionRepository = new InMemorySubscriptionRepository();
        presenceDomainService = mock(PresenceDomainService.class);
        projectEventPublisher = mock(ProjectEventPublisher.class);
        service = new WorkspaceCommandService(workspaceGuard, workspaceRepository, claimRepository,
                subscriptionRepository, presenceDomainService, projectEventPublisher);
    }

    @Test
    public void shouldReleaseClaimsAndSubscriptionsWhenDeletingWorkspace() {
        when(workspaceGuard.requireActingWorkspace(agent(), "ws-a")).thenReturn(workspace());
        claimRepository.save(claim("ws-a", "bd-1"));
        claimRepository.save(claim("ws-a", "bd-2"));
        claimRepository.save(claim("ws-b", "bd-3"));
        subscriptionRepository.save(subscription("ws-a"));
        subscriptionRepository.save(subscription("ws-b"));

        WorkspaceEntity deleted = service.delete(agent(), "ws-a");

        Assertions.assertTrue(deleted.isDeleted());
        Assertions.assertEquals(1, claimRepository.all().size());
        Assertions.assertEquals("ws-b", claimRepository.all().get(0).getWorkspaceId());
        Assertions.assertTrue(subscriptionRepository.findByWorkspace("p-1", "ws-a").isEmpty());
        Assertions.assertEquals(1, subscriptionRepository.findByWorkspace("p-1", "ws-b").size());
        verify(workspaceRepository).softDelete("ws-a");
        verify(projectEventPublisher, times(2)).publishAfterCommit(eq(EventTypeEnum.BEAD_RELEASED), eq("p-1"),
                eq("ws-a"), anyMap());
    }

    @Test
    public void shouldLeaveEverythingUntouchedWhenActorMismatch() {
        when(workspaceGuard.requireActingWorkspace(agent(), "ws-b"))
                .thenThrow(AppException.forbidden("Actor mismatch"));
        claimRepository.save(claim("ws-b", "bd-3"));

        AppException ex = Assertions.assertThrows(AppException.class, () -> service.delete(agent(), "ws-b"));

        Assertions.assertEquals(ResponseCode.FORBIDDEN.getCode(), ex.getCode());
        Assertions.assertEquals(1, claimRepository.all().size());
        verify(workspaceRepository, never()).softDelete(anyString());
        verify(projectEventPublisher, never()).publishAfterCommit(any(), anyString(), anyString(), anyMap());
    }

    @Test
    public void shouldDefaultBranchAndTrimFieldsOnHeartbeat() {
        WorkspaceEntity workspace = workspace();
        when(workspaceGuard.requireActingWorkspace(agent(), "ws-a")).thenReturn(workspace);
        HeartbeatRequestDTO request = new HeartbeatRequestDTO();
        request.setWorkspaceId("ws-a");
        request.setBranch("  ");
        request.setCurrentBead(" bd-1 ");
        request.setCommandLine("");

        service.heartbeat(agent(), request);

        verify(workspaceRepository).touchLastSeen(eq("ws-a"), any(LocalDateTime.class));
        verify(presenceDomainService).heartbeat(workspace, "main", "bd-1", null);
    }

    private WorkspaceEntity workspace() {
        WorkspaceEntity workspace = new WorkspaceEntity();
        workspace.setWorkspaceId("ws-a");
        workspace.setProjectId("p-1");
        workspace.setAlias("alice-dev");
        return workspace;
    }

    private BeadClaimEntity claim(String workspaceId, String beadId) {
        BeadClaimEntity claim = new BeadClaimEntity();
        claim.setProjectId("p-1");
        claim.setWorkspaceId(workspaceId);
        claim.setAlias(workspaceId + "-alias");
        claim.setBeadId(beadId);
        claim.setApexBeadId(beadId);
        claim.setClaimedAt(LocalDateTime.now());
        return claim;
    }

    private SubscriptionEntity subscription(String workspaceId) {
        SubscriptionEntity subscription = new SubscriptionEntity();
        subscription.setProjectId("p-1");
        subscription.setWorkspaceId(workspaceId);
        subscription.setBeadId("bd-1");
        return subscription;
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
