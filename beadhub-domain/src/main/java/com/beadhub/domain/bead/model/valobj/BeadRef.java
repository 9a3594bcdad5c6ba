package com.beadhub.domain.bead.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 跨仓库 / 分支的条目引用。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BeadRef {

    private String repo;

    private String branch;

    private String beadId;
}
