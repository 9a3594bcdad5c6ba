package com.beadhub.test.domain;

import com.beadhub.domain.bead.model.entity.BeadClaimEntity;
import com.beadhub.domain.bead.model.entity.BeadIssueEntity;
import com.beadhub.domain.bead.model.valobj.ClaimDecision;
import com.beadhub.domain.bead.model.valobj.IncomingBead;
import com.beadhub.domain.bead.service.ClaimArbitrationDomainService;
import com.beadhub.domain.project.model.entity.WorkspaceEntity;
import com.beadhub.types.enums.ClaimActionEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.Set;

public class ClaimArbitrationDomainServiceTest {

    private final ClaimArbitrationDomainService exclusive = new ClaimArbitrationDomainService(false);
    private final ClaimArbitrationDomainService coordinated = new ClaimArbitrationDomainService(true);

    @Test
    public void shouldClaimUnheldBead() {
        WorkspaceEntity caller = workspace("ws-a", "alice-dev");

        ClaimDecision decision = exclusive.arbitrate("bd-1", null, caller, false,
                Collections.emptyList(), Collections.emptySet());

        Assertions.assertEquals(ClaimActionEnum.CLAIMED, decision.getAction());
        Assertions.assertTrue(decision.isNewClaim());
        Assertions.assertEquals("ws-a", decision.getClaim().getWorkspaceId());
        Assertions.assertEquals("bd-1", decision.getClaim().getApexBeadId());
        Assertions.assertFalse(decision.getClaim().isCoordinated());
    }

    @Test
    public void shouldRetainOwnClaim() {
        WorkspaceEntity caller = workspace("ws-a", "alice-dev");
        BeadClaimEntity own = claim("ws-a", "alice-dev", false, LocalDateTime.now().minusMinutes(5));

        ClaimDecision decision = exclusive.arbitrate("bd-1", null, caller, false, List.of(own), Set.of("ws-a"));

        Assertions.assertEquals(ClaimActionEnum.RETAINED, decision.getAction());
        Assertions.assertSame(own, decision.getClaim());
        Assertions.assertFalse(decision.isNewClaim());
    }

    @Test
    public void shouldRejectWhenAnotherLiveWorkspaceHoldsBead() {
        WorkspaceEntity caller = workspace("ws-b", "bob-dev");
        BeadClaimEntity held = claim("ws-a", "alice-dev", false, LocalDateTime.now().minusMinutes(5));

        ClaimDecision decision = exclusive.arbitrate("bd-1", null, caller, false, List.of(held), Set.of("ws-a", "ws-b"));

        Assertions.assertTrue(decision.isRejected());
        Assertions.assertNull(decision.getClaim());
        Assertions.assertEquals("alice-dev", decision.getHolder().getAlias());
    }

    @Test
    public void shouldReplaceClaimHeldByDeletedWorkspace() {
        WorkspaceEntity caller = workspace("ws-b", "bob-dev");
        BeadClaimEntity stale = claim("ws-gone", "old-dev", false, LocalDateTime.now().minusDays(1));

        ClaimDecision decision = exclusive.arbitrate("bd-1", null, caller, false, List.of(stale), Set.of("ws-b"));

        Assertions.assertEquals(ClaimActionEnum.CLAIMED, decision.getAction());
        Assertions.assertEquals(1, decision.getStaleClaims().size());
        Assertions.assertEquals("ws-gone", decision.getStaleClaims().get(0).getWorkspaceId());
    }

    @Test
    public void shouldRejectCoordinatedAttemptWhenFlagDisabled() {
        WorkspaceEntity caller = workspace("ws-b", "bob-dev");
        BeadClaimEntity held = claim("ws-a", "alice-dev", true, LocalDateTime.now());

        ClaimDecision decision = exclusive.arbitrate("bd-1", null, caller, true, List.of(held), Set.of("ws-a"));

        Assertions.assertTrue(decision.isRejected());
    }

    @Test
    public void shouldAllowCoordinatedClaimWhenEveryHolderIsCoordinated() {
        WorkspaceEntity caller = workspace("ws-b", "bob-dev");
        BeadClaimEntity held = claim("ws-a", "alice-dev", true, LocalDateTime.now());

        ClaimDecision decision = coordinated.arbitrate("bd-1", null, caller, true, List.of(held), Set.of("ws-a"));

        Assertions.assertEquals(ClaimActionEnum.COORDINATED, decision.getAction());
        Assertions.assertTrue(decision.getClaim().isCoordinated());
    }

    @Test
    public void shouldRejectCoordinatedAttemptAgainstExclusiveHolder() {
        WorkspaceEntity caller = workspace("ws-b", "bob-dev");
        BeadClaimEntity held = claim("ws-a", "alice-dev", false, LocalDateTime.now());

        ClaimDecision decision = coordinated.arbitrate("bd-1", null, caller, true, List.of(held), Set.of("ws-a"));

        Assertions.assertTrue(decision.isRejected());
    }

    @Test
    public void shouldReportEarliestHolderWhenSeveralClaimsExist() {
        WorkspaceEntity caller = workspace("ws-c", "carol-dev");
        BeadClaimEntity later = claim("ws-b", "bob-dev", true, LocalDateTime.now());
        BeadClaimEntity earlier = claim("ws-a", "alice-dev", true, LocalDateTime.now().minusHours(1));

        ClaimDecision decision = coordinated.arbitrate("bd-1", null, caller, false,
                List.of(later, earlier), Set.of("ws-a", "ws-b"));

        Assertions.assertTrue(decision.isRejected());
        Assertions.assertEquals("ws-a", decision.getHolder().getWorkspaceId());
    }

    @Test
    public void shouldTreatInProgressWithForeignAssigneeAsNonAttempt() {
        WorkspaceEntity caller = workspace("ws-a", "alice-dev");

        Assertions.assertTrue(exclusive.isClaimAttempt(incoming("in_progress", null), caller));
        Assertions.assertTrue(exclusive.isClaimAttempt(incoming("in_progress", "alice-dev"), caller));
        Assertions.assertFalse(exclusive.isClaimAttempt(incoming("in_progress", "bob-dev"), caller));
        Assertions.assertFalse(exclusive.isClaimAttempt(incoming("open", null), caller));
        Assertions.assertTrue(exclusive.releasesAllClaims("closed"));
        Assertions.assertFalse(exclusive.releasesAllClaims("open"));
    }

    private WorkspaceEntity workspace(String id, String alias) {
        WorkspaceEntity workspace = new WorkspaceEntity();
        workspace.setWorkspaceId(id);
        workspace.setProjectId("p-1");
        workspace.setAlias(alias);
        workspace.setHumanName("Tester");
        return workspace;
    }

    private BeadClaimEntity claim(String workspaceId, String alias, boolean coordinatedClaim, LocalDateTime claimedAt) {
        BeadClaimEntity claim = new BeadClaimEntity();
        claim.setId("c-" + workspaceId);
        claim.setProjectId("p-1");
        claim.setWorkspaceId(workspaceId);
        claim.setAlias(alias);
        claim.setBeadId("bd-1");
        claim.setApexBeadId("bd-1");
        claim.setCoordinated(coordinatedClaim);
        claim.setClaimedAt(claimedAt);
        return claim;
    }

    private IncomingBead incoming(String status, String assignee) {
        BeadIssueEntity issue = new BeadIssueEntity();
        issue.setBeadId("bd-1");
        issue.setStatus(status);
        issue.setAssignee(assignee);
        return new IncomingBead(issue, false);
    }
}
