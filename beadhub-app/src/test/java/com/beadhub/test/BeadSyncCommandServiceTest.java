package com.beadhub.test;

import com.beadhub.api.dto.BdhSyncRequestDTO;
import com.beadhub.domain.auth.model.valobj.AuthIdentity;
import com.beadhub.domain.bead.model.entity.BeadClaimEntity;
import com.beadhub.domain.bead.model.entity.BeadIssueEntity;
import com.beadhub.domain.bead.model.valobj.ClaimDecision;
import com.beadhub.domain.bead.model.valobj.SyncResult;
import com.beadhub.domain.bead.service.BeadPayloadDomainService;
import com.beadhub.domain.bead.service.ClaimArbitrationDomainService;
import com.beadhub.domain.notification.model.entity.OutboxEntryEntity;
import com.beadhub.domain.notification.model.entity.SubscriptionEntity;
import com.beadhub.domain.notification.service.OutboxDomainService;
import com.beadhub.domain.presence.adapter.gateway.IProjectEventGateway;
import com.beadhub.domain.project.adapter.repository.IRepoRepository;
import com.beadhub.domain.project.adapter.repository.IWorkspaceRepository;
import com.beadhub.domain.project.model.entity.RepoEntity;
import com.beadhub.domain.project.model.entity.WorkspaceEntity;
import com.beadhub.domain.project.service.RepoOriginDomainService;
import com.beadhub.test.support.InMemoryBeadClaimRepository;
import com.beadhub.test.support.InMemoryBeadIssueRepository;
import com.beadhub.test.support.InMemoryOutboxRepository;
import com.beadhub.test.support.InMemorySubscriptionRepository;
import com.beadhub.trigger.application.command.BeadSyncCommandService;
import com.beadhub.trigger.application.common.JsonlPayloadParser;
import com.beadhub.trigger.application.common.WorkspaceGuard;
import com.beadhub.trigger.event.ProjectEventPublisher;
import com.beadhub.types.enums.ClaimActionEnum;
import com.beadhub.types.enums.EventTypeEnum;
import com.beadhub.types.enums.PrincipalKindEnum;
import com.beadhub.types.enums.ResponseCode;
import com.beadhub.types.enums.SyncModeEnum;
import com.beadhub.types.exception.AppException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class BeadSyncCommandServiceTest {

    private static final String PROJECT_ID = "p-1";
    private static final String REPO = "github.com/acme/app";

    private InMemoryBeadIssueRepository issueRepository;
    private InMemoryBeadClaimRepository claimRepository;
    private InMemoryOutboxRepository outboxRepository;
    private InMemorySubscriptionRepository subscriptionRepository;
    private IProjectEventGateway projectEventGateway;
    private BeadSyncCommandService service;

    private final WorkspaceEntity alice = workspace("ws-a", "alice-dev", "Alice");
    private final WorkspaceEntity bob = workspace("ws-b", "bob-dev", "Bob");

    @BeforeEach
    public void setUp() {
        issueRepository = new InMemoryBeadIssueRepository();
        claimRepository = new InMemoryBeadClaimRepository();
        outboxRepository = new InMemoryOutboxRepository();
        subscriptionRepository = new InMemorySubscriptionRepository();
        projectEventGateway = mock(IProjectEventGateway.class);

        WorkspaceGuard workspaceGuard = mock(WorkspaceGuard.class);
        when(workspaceGuard.requireActingWorkspace(any(), eq("ws-a"))).thenReturn(alice);
        when(workspaceGuard.requireActingWorkspace(any(), eq("ws-b"))).thenReturn(bob);

        RepoEntity repo = new RepoEntity();
        repo.setId("r-1");
        repo.setProjectId(PROJECT_ID);
        repo.setCanonicalOrigin(REPO);
        repo.setName("app");
        IRepoRepository repoRepository = mock(IRepoRepository.class);
        when(repoRepository.findById("r-1")).thenReturn(repo);

        IWorkspaceRepository workspaceRepository = mock(IWorkspaceRepository.class);
        when(workspaceRepository.findLiveIds(anyCollection())).thenReturn(Set.of("ws-a", "ws-b"));

        RepoOriginDomainService repoOriginDomainService = new RepoOriginDomainService();
        service = new BeadSyncCommandService(workspaceGuard,
                repoRepository,
                workspaceRepository,
                issueRepository,
                claimRepository,
                subscriptionRepository,
                outboxRepository,
                new BeadPayloadDomainService(repoOriginDomainService),
                new ClaimArbitrationDomainService(false),
                new OutboxDomainService(3, 30, 1800),
                repoOriginDomainService,
                new JsonlPayloadParser(new ObjectMapper()),
                new ProjectEventPublisher(projectEventGateway));
    }

    @Test
    public void shouldAddIssuesOnFullSync() {
        SyncResult result = sync("ws-a",
                "{\"id\":\"bd-1\",\"title\":\"Login\",\"status\":\"open\"}\n"
                        + "{\"id\":\"bd-2\",\"title\":\"Logout\",\"status\":\"open\"}\n").result();

        Assertions.assertEquals(SyncModeEnum.FULL, result.getSyncMode());
        Assertions.assertEquals(2, result.getIssuesSynced());
        Assertions.assertEquals(2, result.getIssuesAdded());
        Assertions.assertEquals(0, result.getIssuesUpdated());
        BeadIssueEntity stored = issueRepository.findForUpdate(PROJECT_ID, REPO, "main", "bd-1");
        Assertions.assertEquals("Login", stored.getTitle());
        Assertions.assertNotNull(stored.getSyncedAt());
    }

    @Test
    public void shouldRejectSecondClaimOnHeldBead() {
        BeadSyncCommandService.SyncOutcome first = sync("ws-a", "{\"id\":\"bd-1\",\"status\":\"in_progress\"}");
        BeadSyncCommandService.SyncOutcome second = sync("ws-b",
                "{\"id\":\"bd-1\",\"status\":\"in_progress\",\"title\":\"hijack\"}");

        Assertions.assertEquals("bd-1", first.currentBead());
        Assertions.assertEquals(ClaimActionEnum.CLAIMED, first.result().getClaimDecisions().get(0).getAction());

        ClaimDecision rejected = second.result().getClaimDecisions().get(0);
        Assertions.assertTrue(rejected.isRejected());
        Assertions.assertEquals("alice-dev", rejected.getHolder().getAlias());
        Assertions.assertEquals(0, second.result().getIssuesSynced());
        Assertions.assertNull(second.currentBead());
        Assertions.assertNull(issueRepository.findForUpdate(PROJECT_ID, REPO, "main", "bd-1").getTitle());

        List<BeadClaimEntity> claims = claimRepository.all();
        Assertions.assertEquals(1, claims.size());
        Assertions.assertEquals("ws-a", claims.get(0).getWorkspaceId());
        Assertions.assertEquals(List.of("bd-1", "bd-1"), claimRepository.lockedBeads());
    }

    @Test
    public void shouldReleaseClaimsAndNotifySubscribersWhenClosed() {
        SubscriptionEntity subscription = new SubscriptionEntity();
        subscription.setProjectId(PROJECT_ID);
        subscription.setWorkspaceId("ws-b");
        subscription.setAlias("bob-dev");
        subscription.setBeadId("bd-1");
        subscription.setEventTypes(List.of(SubscriptionEntity.EVENT_STATUS_CHANGE));
        subscriptionRepository.save(subscription);

        sync("ws-a", "{\"id\":\"bd-1\",\"status\":\"in_progress\"}");
        SyncResult result = sync("ws-a", "{\"id\":\"bd-1\",\"status\":\"closed\",\"title\":\"Login\"}").result();

        Assertions.assertEquals(1, result.getIssuesUpdated());
        Assertions.assertEquals(ClaimActionEnum.RELEASED, result.getClaimDecisions().get(0).getAction());
        Assertions.assertTrue(claimRepository.all().isEmpty());
        Assertions.assertEquals(1, result.getNotificationsQueued());

        List<OutboxEntryEntity> entries = outboxRepository.all();
        Assertions.assertEquals(1, entries.size());
        Assertions.assertEquals("ws-b", entries.get(0).getRecipientWorkspaceId());
        Assertions.assertEquals("in_progress", entries.get(0).getPayload().get("old_status"));
        Assertions.assertEquals("closed", entries.get(0).getPayload().get("new_status"));

        verify(projectEventGateway).publish(argThat(event -> event.getType() == EventTypeEnum.BEAD_STATUS_CHANGED));
        verify(projectEventGateway).publish(argThat(event -> event.getType() == EventTypeEnum.BEAD_RELEASED));
    }

    @Test
    public void shouldSkipStaleUpdatesAsConflicts() {
        sync("ws-a", "{\"id\":\"bd-1\",\"status\":\"open\",\"title\":\"new\",\"updated_at\":\"2026-01-12T10:00:00Z\"}");
        SyncResult result = sync("ws-a",
                "{\"id\":\"bd-1\",\"status\":\"open\",\"title\":\"old\",\"updated_at\":\"2026-01-12T09:00:00Z\"}").result();

        Assertions.assertEquals(List.of("bd-1"), result.getConflicts());
        Assertions.assertEquals(0, result.getIssuesSynced());
        Assertions.assertEquals("new", issueRepository.findForUpdate(PROJECT_ID, REPO, "main", "bd-1").getTitle());
    }

    @Test
    public void shouldDeleteIssuesAndTheirClaims() {
        sync("ws-a", "{\"id\":\"bd-1\",\"status\":\"in_progress\"}");

        BdhSyncRequestDTO request = request("ws-a", null);
        request.setSyncMode("incremental");
        request.setChangedIssues("");
        request.setDeletedIds(List.of("bd-1", "../bad"));
        SyncResult result = service.sync(identity("ws-a"), request).result();

        Assertions.assertEquals(SyncModeEnum.INCREMENTAL, result.getSyncMode());
        Assertions.assertEquals(1, result.getIssuesDeleted());
        Assertions.assertNull(issueRepository.findForUpdate(PROJECT_ID, REPO, "main", "bd-1"));
        Assertions.assertTrue(claimRepository.all().isEmpty());
    }

    @Test
    public void shouldRejectUnknownSyncModeAndBranch() {
        BdhSyncRequestDTO badMode = request("ws-a", "");
        badMode.setSyncMode("partial");
        AppException modeError = Assertions.assertThrows(AppException.class,
                () -> service.sync(identity("ws-a"), badMode));
        Assertions.assertEquals(ResponseCode.ILLEGAL_PARAMETER.getCode(), modeError.getCode());

        BdhSyncRequestDTO badBranch = request("ws-a", "");
        badBranch.setBranch("-rf");
        Assertions.assertThrows(AppException.class, () -> service.sync(identity("ws-a"), badBranch));
    }

    private BeadSyncCommandService.SyncOutcome sync(String workspaceId, String jsonl) {
        return service.sync(identity(workspaceId), request(workspaceId, jsonl));
    }

    private BdhSyncRequestDTO request(String workspaceId, String jsonl) {
        BdhSyncRequestDTO request = new BdhSyncRequestDTO();
        request.setWorkspaceId(workspaceId);
        request.setIssuesJsonl(jsonl);
        return request;
    }

    private AuthIdentity identity(String workspaceId) {
        return AuthIdentity.builder()
                .projectId(PROJECT_ID)
                .actorId(workspaceId)
                .principalKind(PrincipalKindEnum.API_KEY)
                .principalId("key-" + workspaceId)
                .build();
    }

    private static WorkspaceEntity workspace(String workspaceId, String alias, String humanName) {
        WorkspaceEntity workspace = new WorkspaceEntity();
        workspace.setWorkspaceId(workspaceId);
        workspace.setProjectId(PROJECT_ID);
        workspace.setRepoId("r-1");
        workspace.setAlias(alias);
        workspace.setHumanName(humanName);
        workspace.setRole("developer");
        return workspace;
    }
}
