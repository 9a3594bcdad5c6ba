package com.beadhub.domain.policy.service;

import com.beadhub.domain.policy.model.entity.PolicyEntity;
import com.beadhub.domain.policy.model.valobj.PolicyBundle;
import com.beadhub.domain.policy.model.valobj.PolicyInvariant;
import com.beadhub.domain.policy.model.valobj.RolePlaybook;
import com.beadhub.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 策略版本领域服务：策略包校验、乐观并发基线检查、角色选择。
 */
@Service
public class PolicyVersioningDomainService {

    private static final Pattern ROLE_ID = Pattern.compile("^[a-z][a-z0-9_-]{0,49}$");
    private static final int MAX_INVARIANTS = 200;

    public void validateBundle(PolicyBundle bundle) {
        if (bundle == null) {
            throw AppException.illegalParameter("bundle is required");
        }
        if (bundle.getInvariants() != null) {
            if (bundle.getInvariants().size() > MAX_INVARIANTS) {
                throw AppException.illegalParameter("Too many invariants");
            }
            Set<String> ids = new HashSet<>();
            for (PolicyInvariant invariant : bundle.getInvariants()) {
                if (invariant == null || StringUtils.isBlank(invariant.getId())) {
                    throw AppException.illegalParameter("Invariant id is required");
                }
                if (!ids.add(invariant.getId())) {
                    throw AppException.illegalParameter("Duplicate invariant id: " + invariant.getId());
                }
            }
        }
        if (bundle.getRoles() != null) {
            for (Map.Entry<String, RolePlaybook> entry : bundle.getRoles().entrySet()) {
                if (!ROLE_ID.matcher(entry.getKey()).matches()) {
                    throw AppException.illegalParameter("Invalid role id: " + entry.getKey());
                }
                if (entry.getValue() == null) {
                    throw AppException.illegalParameter("Role playbook is required: " + entry.getKey());
                }
            }
        }
    }

    /**
     * 乐观并发检查：basePolicyId 为空时跳过；否则必须等于当前激活版本。
     *
     * @param active 当前激活版本（可能为空）
     */
    public void checkBase(PolicyEntity active, String basePolicyId) {
        if (StringUtils.isBlank(basePolicyId)) {
            return;
        }
        String activeId = active == null ? null : active.getPolicyId();
        if (Objects.equals(activeId, basePolicyId)) {
            return;
        }
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("base_policy_id", basePolicyId);
        detail.put("active_policy_id", activeId);
        detail.put("active_version", active == null ? null : active.getVersion());
        throw AppException.conflict("Active policy has changed since base_policy_id", detail);
    }

    /**
     * 按角色筛选；onlySelected 时只保留所选角色，角色不存在返回 null。
     */
    public PolicyBundle selectRole(PolicyBundle bundle, String role, boolean onlySelected) {
        if (StringUtils.isBlank(role) || !onlySelected) {
            return bundle;
        }
        RolePlaybook playbook = bundle.getRoles() == null ? null : bundle.getRoles().get(role);
        if (playbook == null) {
            return null;
        }
        PolicyBundle selected = bundle.copy();
        Map<String, RolePlaybook> roles = new LinkedHashMap<>();
        roles.put(role, playbook);
        selected.setRoles(roles);
        return selected;
    }
}
