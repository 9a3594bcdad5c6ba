package com.beadhub.test.domain;

import com.beadhub.domain.policy.model.entity.PolicyEntity;
import com.beadhub.domain.policy.model.valobj.PolicyBundle;
import com.beadhub.domain.policy.model.valobj.PolicyInvariant;
import com.beadhub.domain.policy.model.valobj.RolePlaybook;
import com.beadhub.domain.policy.service.PolicyDefaultsDomainService;
import com.beadhub.domain.policy.service.PolicyVersioningDomainService;
import com.beadhub.types.enums.ResponseCode;
import com.beadhub.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Map;

public class PolicyVersioningDomainServiceTest {

    private final PolicyVersioningDomainService service = new PolicyVersioningDomainService();

    @Test
    public void shouldRejectDuplicateInvariantIds() {
        PolicyBundle bundle = new PolicyBundle();
        bundle.getInvariants().add(new PolicyInvariant("a", "A", "body"));
        bundle.getInvariants().add(new PolicyInvariant("a", "A again", "body"));

        AppException ex = Assertions.assertThrows(AppException.class, () -> service.validateBundle(bundle));
        Assertions.assertEquals(ResponseCode.ILLEGAL_PARAMETER.getCode(), ex.getCode());
    }

    @Test
    public void shouldRejectInvalidRoleId() {
        PolicyBundle bundle = new PolicyBundle();
        bundle.getRoles().put("Bad Role", new RolePlaybook("Bad", "x"));

        Assertions.assertThrows(AppException.class, () -> service.validateBundle(bundle));
        Assertions.assertThrows(AppException.class, () -> service.validateBundle(null));
    }

    @Test
    public void shouldPassBaseCheckWhenBaseMatchesOrIsAbsent() {
        PolicyEntity active = policy("pol-2", 2);

        Assertions.assertDoesNotThrow(() -> service.checkBase(active, null));
        Assertions.assertDoesNotThrow(() -> service.checkBase(active, "pol-2"));
    }

    @Test
    public void shouldConflictWithActiveVersionDetail() {
        PolicyEntity active = policy("pol-3", 3);

        AppException ex = Assertions.assertThrows(AppException.class, () -> service.checkBase(active, "pol-2"));

        Assertions.assertEquals(ResponseCode.CONFLICT.getCode(), ex.getCode());
        Map<?, ?> detail = (Map<?, ?>) ex.getDetail();
        Assertions.assertEquals("pol-3", detail.get("active_policy_id"));
        Assertions.assertEquals(3, detail.get("active_version"));
    }

    @Test
    public void shouldSelectSingleRoleWhenRequested() {
        PolicyBundle bundle = new PolicyDefaultsDomainService().defaultBundle();

        PolicyBundle selected = service.selectRole(bundle, "reviewer", true);

        Assertions.assertEquals(1, selected.getRoles().size());
        Assertions.assertTrue(selected.getRoles().containsKey("reviewer"));
        Assertions.assertEquals(bundle.getInvariants().size(), selected.getInvariants().size());
        Assertions.assertEquals(3, bundle.getRoles().size());
        Assertions.assertSame(bundle, service.selectRole(bundle, "reviewer", false));
        Assertions.assertNull(service.selectRole(bundle, "nobody", true));
    }

    private PolicyEntity policy(String policyId, int version) {
        PolicyEntity entity = new PolicyEntity();
        entity.setPolicyId(policyId);
        entity.setVersion(version);
        return entity;
    }
}
