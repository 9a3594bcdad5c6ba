package com.beadhub.domain.policy.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 策略包。
 * <p>
 * invariants 与 roles 为强类型结构；adapters 是各客户端适配器自己的配置，服务端不解释，原样保存。
 * </p>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PolicyBundle {

    private List<PolicyInvariant> invariants = new ArrayList<>();

    private Map<String, RolePlaybook> roles = new LinkedHashMap<>();

    private Map<String, Object> adapters = new LinkedHashMap<>();

    public PolicyBundle copy() {
        List<PolicyInvariant> invariantCopy = new ArrayList<>();
        if (invariants != null) {
            for (PolicyInvariant invariant : invariants) {
                invariantCopy.add(new PolicyInvariant(invariant.getId(), invariant.getTitle(), invariant.getBodyMd()));
            }
        }
        Map<String, RolePlaybook> roleCopy = new LinkedHashMap<>();
        if (roles != null) {
            roles.forEach((id, role) -> roleCopy.put(id, new RolePlaybook(role.getTitle(), role.getPlaybookMd())));
        }
        return new PolicyBundle(invariantCopy, roleCopy,
                adapters == null ? new LinkedHashMap<>() : new LinkedHashMap<>(adapters));
    }
}
