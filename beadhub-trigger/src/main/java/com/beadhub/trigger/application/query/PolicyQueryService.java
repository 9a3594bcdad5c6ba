package com.beadhub.trigger.application.query;

import com.beadhub.api.dto.PolicyDTO;
import com.beadhub.api.dto.PolicyHistoryItemDTO;
import com.beadhub.api.dto.PolicyHistoryResponseDTO;
import com.beadhub.domain.policy.adapter.repository.IPolicyRepository;
import com.beadhub.domain.policy.model.entity.PolicyEntity;
import com.beadhub.domain.policy.model.valobj.PolicyBundle;
import com.beadhub.domain.policy.service.PolicyVersioningDomainService;
import com.beadhub.domain.project.adapter.repository.IProjectRepository;
import com.beadhub.domain.project.model.entity.ProjectEntity;
import com.beadhub.trigger.application.command.PolicyCommandService;
import com.beadhub.trigger.application.common.CoordinationViewAssembler;
import com.beadhub.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

/**
 * 策略读用例。
 */
@Service
public class PolicyQueryService {

    static final int DEFAULT_HISTORY_LIMIT = 20;
    static final int MAX_HISTORY_LIMIT = 100;

    private final IProjectRepository projectRepository;
    private final IPolicyRepository policyRepository;
    private final PolicyVersioningDomainService policyVersioningDomainService;
    private final PolicyCommandService policyCommandService;
    private final CoordinationViewAssembler coordinationViewAssembler;

    public PolicyQueryService(IProjectRepository projectRepository,
                              IPolicyRepository policyRepository,
                              PolicyVersioningDomainService policyVersioningDomainService,
                              PolicyCommandService policyCommandService,
                              CoordinationViewAssembler coordinationViewAssembler) {
        this.projectRepository = projectRepository;
        this.policyRepository = policyRepository;
        this.policyVersioningDomainService = policyVersioningDomainService;
        this.policyCommandService = policyCommandService;
        this.coordinationViewAssembler = coordinationViewAssembler;
    }

    /**
     * 读取激活策略；项目尚无任何策略时先以默认包引导出版本 1。
     */
    @Transactional(rollbackFor = Exception.class)
    public PolicyDTO getActive(String projectId, String role, boolean onlySelected) {
        PolicyEntity active = policyCommandService.ensureActivePolicy(projectId);
        String selectedRole = StringUtils.trimToNull(role);
        PolicyBundle bundle = policyVersioningDomainService.selectRole(active.getBundle(), selectedRole, onlySelected);
        if (bundle == null) {
            throw AppException.notFound("Role not found in active policy: " + selectedRole);
        }
        return coordinationViewAssembler.toPolicyDTO(active, bundle, active.getPolicyId(), selectedRole);
    }

    public PolicyDTO get(String projectId, String policyId) {
        PolicyEntity policy = policyRepository.findById(projectId, policyId);
        if (policy == null) {
            throw AppException.notFound("Policy not found: " + policyId);
        }
        return coordinationViewAssembler.toPolicyDTO(policy, null, activePolicyId(projectId), null);
    }

    public PolicyHistoryResponseDTO history(String projectId, Integer limit) {
        int size = limit == null ? DEFAULT_HISTORY_LIMIT : limit;
        if (size < 1 || size > MAX_HISTORY_LIMIT) {
            throw AppException.illegalParameter("limit must be between 1 and " + MAX_HISTORY_LIMIT);
        }
        String activeId = activePolicyId(projectId);
        List<PolicyHistoryItemDTO> items = new ArrayList<>();
        for (PolicyEntity policy : policyRepository.findHistory(projectId, size)) {
            items.add(coordinationViewAssembler.toPolicyHistoryItemDTO(policy, activeId));
        }
        PolicyHistoryResponseDTO response = new PolicyHistoryResponseDTO();
        response.setPolicies(items);
        return response;
    }

    private String activePolicyId(String projectId) {
        ProjectEntity project = projectRepository.findById(projectId);
        if (project == null) {
            throw AppException.notFound("Project not found: " + projectId);
        }
        return project.getActivePolicyId();
    }
}
