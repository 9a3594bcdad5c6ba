package com.beadhub.domain.bead.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 条目状态变化。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BeadStatusChange {

    private String beadId;

    private String repo;

    private String branch;

    /**
     * 变化前状态；新条目为空
     */
    private String oldStatus;

    private String newStatus;

    private String title;

    public boolean isNewBead() {
        return oldStatus == null;
    }
}
