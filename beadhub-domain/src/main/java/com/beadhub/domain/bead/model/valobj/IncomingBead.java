package com.beadhub.domain.bead.model.valobj;

import com.beadhub.domain.bead.model.entity.BeadIssueEntity;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 一条已校验的入站条目及其客户端标记。
 */
@Data
@AllArgsConstructor
public class IncomingBead {

    private BeadIssueEntity issue;

    /**
     * 客户端请求协同认领
     */
    private boolean coordinated;

    public String getBeadId() {
        return issue.getBeadId();
    }
}
