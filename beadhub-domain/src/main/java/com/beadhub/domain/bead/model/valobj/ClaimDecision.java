package com.beadhub.domain.bead.model.valobj;

import com.beadhub.domain.bead.model.entity.BeadClaimEntity;
import com.beadhub.types.enums.ClaimActionEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collections;
import java.util.List;

/**
 * 认领仲裁结果。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClaimDecision {

    private String beadId;

    private ClaimActionEnum action;

    /**
     * 调用方在本次同步后的认领；拒绝或释放时为空
     */
    private BeadClaimEntity claim;

    /**
     * 拒绝时的当前持有者
     */
    private BeadClaimEntity holder;

    /**
     * 已删除工作区遗留的认领，需要被替换
     */
    @Builder.Default
    private List<BeadClaimEntity> staleClaims = Collections.emptyList();

    public boolean isRejected() {
        return action == ClaimActionEnum.REJECTED;
    }

    public boolean isClaimed() {
        return action == ClaimActionEnum.CLAIMED
                || action == ClaimActionEnum.RETAINED
                || action == ClaimActionEnum.COORDINATED;
    }

    /**
     * 是否产生了新的认领行
     */
    public boolean isNewClaim() {
        return action == ClaimActionEnum.CLAIMED || action == ClaimActionEnum.COORDINATED;
    }
}
