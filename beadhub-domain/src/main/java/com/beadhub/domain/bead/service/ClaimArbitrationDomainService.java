package com.beadhub.domain.bead.service;

import com.beadhub.domain.bead.model.entity.BeadClaimEntity;
import com.beadhub.domain.bead.model.valobj.ClaimDecision;
import com.beadhub.domain.bead.model.valobj.IncomingBead;
import com.beadhub.domain.project.model.entity.WorkspaceEntity;
import com.beadhub.types.common.Constants;
import com.beadhub.types.enums.ClaimActionEnum;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * 认领仲裁领域服务。
 * <p>
 * 默认至多一个活跃持有者：条目已被其他存活工作区持有时拒绝调用方的认领，并报告持有者。
 * 协同认领只在 {@code beadhub.claims.coordinated-enabled=true}、调用方条目标记 coordinated、
 * 且所有现有存活认领均为协同认领时成立。已删除工作区的认领视为陈旧，被新认领替换。
 * </p>
 */
@Service
public class ClaimArbitrationDomainService {

    private final boolean coordinatedEnabled;

    public ClaimArbitrationDomainService(@Value("${beadhub.claims.coordinated-enabled:false}") boolean coordinatedEnabled) {
        this.coordinatedEnabled = coordinatedEnabled;
    }

    public boolean isCoordinatedEnabled() {
        return coordinatedEnabled;
    }

    /**
     * 入站条目是否是调用方的认领尝试：状态为 in_progress，且 assignee 为空或指向调用方。
     */
    public boolean isClaimAttempt(IncomingBead incoming, WorkspaceEntity caller) {
        if (incoming == null || caller == null) {
            return false;
        }
        if (!Constants.STATUS_IN_PROGRESS.equals(incoming.getIssue().getStatus())) {
            return false;
        }
        String assignee = StringUtils.trimToNull(incoming.getIssue().getAssignee());
        return assignee == null
                || assignee.equals(caller.getAlias())
                || assignee.equals(caller.getWorkspaceId())
                || assignee.equalsIgnoreCase(StringUtils.defaultString(caller.getHumanName()));
    }

    /**
     * 入站状态为 closed 时释放条目上所有认领。
     */
    public boolean releasesAllClaims(String status) {
        return Constants.STATUS_CLOSED.equals(status);
    }

    /**
     * 对一次认领尝试做仲裁。
     *
     * @param existing 条目上当前所有认领（调用方已持有条目锁）
     * @param liveWorkspaceIds existing 中仍存活的工作区 ID
     */
    public ClaimDecision arbitrate(String beadId,
                                   String apexBeadId,
                                   WorkspaceEntity caller,
                                   boolean wantsCoordinated,
                                   List<BeadClaimEntity> existing,
                                   Set<String> liveWorkspaceIds) {
        List<BeadClaimEntity> others = new ArrayList<>();
        List<BeadClaimEntity> stale = new ArrayList<>();
        BeadClaimEntity own = null;
        for (BeadClaimEntity claim : existing) {
            if (claim.isHeldBy(caller.getWorkspaceId())) {
                own = claim;
            } else if (liveWorkspaceIds.contains(claim.getWorkspaceId())) {
                others.add(claim);
            } else {
                stale.add(claim);
            }
        }

        if (own != null) {
            return ClaimDecision.builder()
                    .beadId(beadId)
                    .action(ClaimActionEnum.RETAINED)
                    .claim(own)
                    .staleClaims(stale)
                    .build();
        }
        if (others.isEmpty()) {
            return ClaimDecision.builder()
                    .beadId(beadId)
                    .action(ClaimActionEnum.CLAIMED)
                    .claim(newClaim(beadId, apexBeadId, caller, wantsCoordinated && coordinatedEnabled))
                    .staleClaims(stale)
                    .build();
        }
        boolean allCoordinated = others.stream().allMatch(BeadClaimEntity::isCoordinated);
        if (coordinatedEnabled && wantsCoordinated && allCoordinated) {
            return ClaimDecision.builder()
                    .beadId(beadId)
                    .action(ClaimActionEnum.COORDINATED)
                    .claim(newClaim(beadId, apexBeadId, caller, true))
                    .staleClaims(stale)
                    .build();
        }
        BeadClaimEntity holder = others.stream()
                .min(Comparator.comparing(BeadClaimEntity::getClaimedAt,
                        Comparator.nullsLast(Comparator.naturalOrder())))
                .orElse(others.get(0));
        return ClaimDecision.builder()
                .beadId(beadId)
                .action(ClaimActionEnum.REJECTED)
                .holder(holder)
                .build();
    }

    public ClaimDecision released(String beadId) {
        return ClaimDecision.builder()
                .beadId(beadId)
                .action(ClaimActionEnum.RELEASED)
                .build();
    }

    private BeadClaimEntity newClaim(String beadId, String apexBeadId, WorkspaceEntity caller, boolean coordinated) {
        BeadClaimEntity claim = new BeadClaimEntity();
        claim.setProjectId(caller.getProjectId());
        claim.setWorkspaceId(caller.getWorkspaceId());
        claim.setAlias(caller.getAlias());
        claim.setHumanName(caller.getHumanName());
        claim.setBeadId(beadId);
        claim.setApexBeadId(StringUtils.defaultIfBlank(apexBeadId, beadId));
        claim.setCoordinated(coordinated);
        claim.setClaimedAt(LocalDateTime.now());
        return claim;
    }
}
