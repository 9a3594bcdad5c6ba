package com.beadhub.test;

import com.beadhub.api.dto.SubscriptionCreateRequestDTO;
import com.beadhub.domain.auth.model.valobj.AuthIdentity;
import com.beadhub.domain.bead.service.BeadPayloadDomainService;
import com.beadhub.domain.notification.model.entity.SubscriptionEntity;
import com.beadhub.domain.project.model.entity.WorkspaceEntity;
import com.beadhub.domain.project.service.RepoOriginDomainService;
import com.beadhub.test.support.InMemorySubscriptionRepository;
import com.beadhub.trigger.application.command.SubscriptionCommandService;
import com.beadhub.trigger.application.common.WorkspaceGuard;
import com.beadhub.types.enums.PrincipalKindEnum;
import com.beadhub.types.enums.ResponseCode;
import com.beadhub.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class SubscriptionCommandServiceTest {

    private InMemorySubscriptionRepository subscriptionRepository;
    private WorkspaceGuard workspaceGuard;
    private SubscriptionCommandService service;

    @BeforeEach
    public void setUp() {
        subscriptionRepository = new InMemorySubscriptionRepository();
        workspaceGuard = mock(WorkspaceGuard.class);
        RepoOriginDomainService repoOriginDomainService = new RepoOriginDomainService();
        service = new SubscriptionCommandService(workspaceGuard, subscriptionRepository,
                new BeadPayloadDomainService(repoOriginDomainService), repoOriginDomainService);
        when(workspaceGuard.requireActingWorkspace(agent(), "ws-a")).thenReturn(workspace());
    }

    @Test
    public void shouldSubscribeWithDefaultEventTypeAndCanonicalRepo() {
        SubscriptionEntity saved = service.subscribe(agent(), request("bd-1", "git@github.com:acme/app.git", null));

        Assertions.assertEquals("sub-1", saved.getId());
        Assertions.assertEquals("alice-dev", saved.getAlias());
        Assertions.assertEquals("github.com/acme/app", saved.getRepo());
        Assertions.assertEquals(List.of(SubscriptionEntity.EVENT_STATUS_CHANGE), saved.getEventTypes());
    }

    @Test
    public void shouldConflictOnDuplicateWithExistingId() {
        service.subscribe(agent(), request("bd-1", null, null));

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> service.subscribe(agent(), request("bd-1", null, List.of("status_change"))));

        Assertions.assertEquals(ResponseCode.CONFLICT.getCode(), ex.getCode());
        Assertions.assertEquals("sub-1", ((Map<?, ?>) ex.getDetail()).get("subscription_id"));
    }

    @Test
    public void shouldRejectUnknownEventTypeAndInvalidBeadId() {
        AppException eventType = Assertions.assertThrows(AppException.class,
                () -> service.subscribe(agent(), request("bd-1", null, List.of("comment_added"))));
        AppException beadId = Assertions.assertThrows(AppException.class,
                () -> service.subscribe(agent(), request("not a bead", null, null)));

        Assertions.assertEquals(ResponseCode.ILLEGAL_PARAMETER.getCode(), eventType.getCode());
        Assertions.assertEquals(ResponseCode.ILLEGAL_PARAMETER.getCode(), beadId.getCode());
        Assertions.assertTrue(subscriptionRepository.findByWorkspace("p-1", "ws-a").isEmpty());
    }

    @Test
    public void shouldOnlyUnsubscribeOwnSubscriptions() {
        SubscriptionEntity foreign = new SubscriptionEntity();
        foreign.setProjectId("p-1");
        foreign.setWorkspaceId("ws-b");
        foreign.setBeadId("bd-2");
        subscriptionRepository.save(foreign);
        SubscriptionEntity own = service.subscribe(agent(), request("bd-1", null, null));

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> service.unsubscribe(agent(), "ws-a", foreign.getId()));
        service.unsubscribe(agent(), "ws-a", own.getId());

        Assertions.assertEquals(ResponseCode.NOT_FOUND.getCode(), ex.getCode());
        Assertions.assertNotNull(subscriptionRepository.findById("p-1", foreign.getId()));
        Assertions.assertNull(subscriptionRepository.findById("p-1", own.getId()));
    }

    private SubscriptionCreateRequestDTO request(String beadId, String repo, List<String> eventTypes) {
        SubscriptionCreateRequestDTO request = new SubscriptionCreateRequestDTO();
        request.setWorkspaceId("ws-a");
        request.setBeadId(beadId);
        request.setRepo(repo);
        request.setEventTypes(eventTypes);
        return request;
    }

    private WorkspaceEntity workspace() {
        WorkspaceEntity workspace = new WorkspaceEntity();
        workspace.setWorkspaceId("ws-a");
        workspace.setProjectId("p-1");
        workspace.setAlias("alice-dev");
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
