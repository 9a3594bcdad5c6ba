package com.beadhub.test;

import com.beadhub.api.dto.BeadIssueDTO;
import com.beadhub.api.dto.BeadIssueListResponseDTO;
import com.beadhub.domain.auth.model.valobj.AuthIdentity;
import com.beadhub.domain.bead.model.entity.BeadIssueEntity;
import com.beadhub.domain.bead.model.valobj.BeadRef;
import com.beadhub.domain.project.service.RepoOriginDomainService;
import com.beadhub.test.support.InMemoryBeadIssueRepository;
import com.beadhub.trigger.application.common.CoordinationViewAssembler;
import com.beadhub.trigger.application.common.WorkspaceGuard;
import com.beadhub.trigger.application.query.BeadIssueQueryService;
import com.beadhub.types.enums.PrincipalKindEnum;
import com.beadhub.types.enums.ResponseCode;
import com.beadhub.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class BeadIssueQueryServiceTest {

    private static final String REPO = "github.com/acme/app";
    private static final LocalDateTime BASE = LocalDateTime.of(2026, 1, 12, 9, 0, 0);

    private InMemoryBeadIssueRepository issueRepository;
    private WorkspaceGuard workspaceGuard;
    private BeadIssueQueryService service;

    @BeforeEach
    public void setUp() {
        issueRepository = new InMemoryBeadIssueRepository();
        workspaceGuard = mock(WorkspaceGuard.class);
        service = new BeadIssueQueryService(issueRepository, workspaceGuard, new RepoOriginDomainService(),
                new CoordinationViewAssembler());
    }

    @Test
    public void shouldListOpenUnblockedIssuesByPriority() {
        issueRepository.upsert(issue("bd-1", "open", 2, 1));
        issueRepository.upsert(issue("bd-2", "open", 0, 2));
        issueRepository.upsert(issue("bd-3", "open", null, 0));
        issueRepository.upsert(issue("bd-4", "in_progress", 0, 3));
        BeadIssueEntity blocked = issue("bd-5", "open", 0, 4);
        blocked.getBlockedBy().add(new BeadRef(REPO, "main", "bd-4"));
        issueRepository.upsert(blocked);
        BeadIssueEntity unblocked = issue("bd-6", "open", 1, 5);
        unblocked.getBlockedBy().add(new BeadRef(REPO, "main", "bd-7"));
        unblocked.getBlockedBy().add(new BeadRef(REPO, "main", "bd-missing"));
        issueRepository.upsert(unblocked);
        issueRepository.upsert(issue("bd-7", "closed", 1, 6));

        BeadIssueListResponseDTO response = service.ready(agent(), "ws-a", null, null, null);

        Assertions.assertEquals(List.of("bd-2", "bd-6", "bd-1", "bd-3"),
                response.getIssues().stream().map(BeadIssueDTO::getBeadId).toList());
        Assertions.assertEquals(4, response.getCount());
    }

    @Test
    public void shouldFilterByRepoGivenAsRemoteUrlAndHonourLimit() {
        issueRepository.upsert(issue("bd-1", "open", 1, 1));
        issueRepository.upsert(issue("bd-2", "open", 2, 2));
        BeadIssueEntity elsewhere = issue("bd-3", "open", 0, 0);
        elsewhere.setRepo("github.com/acme/lib");
        issueRepository.upsert(elsewhere);

        BeadIssueListResponseDTO response = service.ready(agent(), "ws-a", "git@github.com:acme/app.git", "main", 1);

        Assertions.assertEquals(List.of("bd-1"), response.getIssues().stream().map(BeadIssueDTO::getBeadId).toList());
    }

    @Test
    public void shouldRejectOutOfRangeLimitAndForeignWorkspace() {
        when(workspaceGuard.requireLiveWorkspace("p-1", "ws-x"))
                .thenThrow(AppException.notFound("Workspace not found: ws-x"));

        AppException limit = Assertions.assertThrows(AppException.class,
                () -> service.ready(agent(), "ws-a", null, null, 0));
        AppException foreign = Assertions.assertThrows(AppException.class,
                () -> service.ready(agent(), "ws-x", null, null, null));

        Assertions.assertEquals(ResponseCode.ILLEGAL_PARAMETER.getCode(), limit.getCode());
        Assertions.assertEquals(ResponseCode.NOT_FOUND.getCode(), foreign.getCode());
    }

    @Test
    public void shouldGetIssueWithinProjectOnly() {
        issueRepository.upsert(issue("bd-1", "open", 1, 1));
        BeadIssueEntity other = issue("bd-9", "open", 1, 1);
        other.setProjectId("p-2");
        issueRepository.upsert(other);

        Assertions.assertEquals("bd-1", service.get(agent(), "bd-1").getBeadId());
        AppException ex = Assertions.assertThrows(AppException.class, () -> service.get(agent(), "bd-9"));
        Assertions.assertEquals(ResponseCode.NOT_FOUND.getCode(), ex.getCode());
    }

    private BeadIssueEntity issue(String beadId, String status, Integer priority, int createdOffsetMinutes) {
        BeadIssueEntity issue = new BeadIssueEntity();
        issue.setProjectId("p-1");
        issue.setRepo(REPO);
        issue.setBranch("main");
        issue.setBeadId(beadId);
        issue.setTitle("Issue " + beadId);
        issue.setStatus(status);
        issue.setPriority(priority);
        issue.setBlockedBy(new ArrayList<>());
        issue.setCreatedAt(BASE.plusMinutes(createdOffsetMinutes));
        return issue;
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
