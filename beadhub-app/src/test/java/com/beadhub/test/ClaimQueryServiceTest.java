package com.beadhub.test;

import com.beadhub.api.dto.ClaimListResponseDTO;
import com.beadhub.domain.auth.model.valobj.AuthIdentity;
import com.beadhub.domain.bead.model.entity.BeadClaimEntity;
import com.beadhub.test.support.InMemoryBeadClaimRepository;
import com.beadhub.trigger.application.common.CoordinationViewAssembler;
import com.beadhub.trigger.application.common.PageCursorCodec;
import com.beadhub.trigger.application.query.ClaimQueryService;
import com.beadhub.types.enums.PrincipalKindEnum;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

public class ClaimQueryServiceTest {

    private static final LocalDateTime BASE = LocalDateTime.of(2026, 1, 12, 9, 0, 0);

    private InMemoryBeadClaimRepository claimRepository;
    private ClaimQueryService service;

    @BeforeEach
    public void setUp() {
        claimRepository = new InMemoryBeadClaimRepository();
        service = new ClaimQueryService(claimRepository, new PageCursorCodec(new ObjectMapper()),
                new CoordinationViewAssembler());
        claimRepository.save(claim("p-1", "ws-a", "bd-3", BASE.plusMinutes(3)));
        claimRepository.save(claim("p-1", "ws-a", "bd-1", BASE.plusMinutes(1)));
        claimRepository.save(claim("p-1", "ws-b", "bd-2", BASE.plusMinutes(2)));
        claimRepository.save(claim("p-2", "ws-z", "bd-9", BASE));
    }

    @Test
    public void shouldPageClaimsInClaimOrderWithinProject() {
        AuthIdentity identity = identity();

        ClaimListResponseDTO first = service.list(identity, null, 2, null);

        Assertions.assertEquals(List.of("bd-1", "bd-2"), beadIds(first));
        Assertions.assertTrue(first.getHasMore());
        Assertions.assertNotNull(first.getNextCursor());

        ClaimListResponseDTO second = service.list(identity, null, 2, first.getNextCursor());

        Assertions.assertEquals(List.of("bd-3"), beadIds(second));
        Assertions.assertFalse(second.getHasMore());
        Assertions.assertNull(second.getNextCursor());
    }

    @Test
    public void shouldFilterClaimsByWorkspace() {
        ClaimListResponseDTO response = service.list(identity(), " ws-a ", null, null);

        Assertions.assertEquals(List.of("bd-1", "bd-3"), beadIds(response));
        Assertions.assertEquals(2, service.listByWorkspace("p-1", "ws-a").size());
        Assertions.assertTrue(service.listByWorkspace("p-1", "ws-z").isEmpty());
    }

    private List<String> beadIds(ClaimListResponseDTO response) {
        return response.getClaims().stream().map(claim -> claim.getBeadId()).toList();
    }

    private AuthIdentity identity() {
        return AuthIdentity.builder()
                .projectId("p-1")
                .actorId("ws-a")
                .principalKind(PrincipalKindEnum.API_KEY)
                .principalId("k-1")
                .build();
    }

    private BeadClaimEntity claim(String projectId, String workspaceId, String beadId, LocalDateTime claimedAt) {
        BeadClaimEntity claim = new BeadClaimEntity();
        claim.setProjectId(projectId);
        claim.setWorkspaceId(workspaceId);
        claim.setAlias(workspaceId + "-alias");
        claim.setHumanName("Agent " + workspaceId);
        claim.setBeadId(beadId);
        claim.setApexBeadId(beadId);
        claim.setClaimedAt(claimedAt);
        return claim;
    }
}
