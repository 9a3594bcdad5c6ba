package com.beadhub.domain.policy.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 不变量文档。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PolicyInvariant {

    private String id;

    private String title;

    private String bodyMd;
}
