package com.beadhub.domain.policy.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 角色行动手册。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RolePlaybook {

    private String title;

    private String playbookMd;
}
