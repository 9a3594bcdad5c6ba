package com.beadhub.trigger.application.command;

import com.beadhub.domain.policy.adapter.repository.IPolicyRepository;
import com.beadhub.domain.policy.model.entity.PolicyEntity;
import com.beadhub.domain.policy.model.valobj.PolicyBundle;
import com.beadhub.domain.policy.service.PolicyDefaultsDomainService;
import com.beadhub.domain.policy.service.PolicyVersioningDomainService;
import com.beadhub.domain.project.adapter.repository.IProjectRepository;
import com.beadhub.domain.project.model.entity.ProjectEntity;
import com.beadhub.trigger.event.ProjectEventPublisher;
import com.beadhub.types.enums.EventTypeEnum;
import com.beadhub.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 策略写用例。
 * <p>
 * 所有版本分配都在项目行的排他锁下完成：先锁项目，再比较 base_policy_id，再取 max(version)+1 插入。
 * 并发的两个写请求中后到者会在锁释放后看到新的激活版本，从而得到冲突而不是覆盖。
 * </p>
 */
@Slf4j
@Service
public class PolicyCommandService {

    private final IProjectRepository projectRepository;
    private final IPolicyRepository policyRepository;
    private final PolicyVersioningDomainService policyVersioningDomainService;
    private final PolicyDefaultsDomainService policyDefaultsDomainService;
    private final ProjectEventPublisher projectEventPublisher;

    public PolicyCommandService(IProjectRepository projectRepository,
                                IPolicyRepository policyRepository,
                                PolicyVersioningDomainService policyVersioningDomainService,
                                PolicyDefaultsDomainService policyDefaultsDomainService,
                                ProjectEventPublisher projectEventPublisher) {
        this.projectRepository = projectRepository;
        this.policyRepository = policyRepository;
        this.policyVersioningDomainService = policyVersioningDomainService;
        this.policyDefaultsDomainService = policyDefaultsDomainService;
        this.projectEventPublisher = projectEventPublisher;
    }

    @Transactional(rollbackFor = Exception.class)
    public PolicyEntity create(String projectId, PolicyBundle bundle, String basePolicyId,
                               boolean activate, String createdByWorkspaceId) {
        policyVersioningDomainService.validateBundle(bundle);
        ProjectEntity project = lockProject(projectId);
        PolicyEntity active = findActive(project);
        policyVersioningDomainService.checkBase(active, basePolicyId);
        PolicyEntity created = insertNextVersion(projectId, bundle, createdByWorkspaceId);
        if (activate) {
            activateLocked(project, created);
        }
        log.info("Policy version created. projectId={}, policyId={}, version={}, activated={}",
                projectId, created.getPolicyId(), created.getVersion(), activate);
        return created;
    }

    /**
     * 重新激活一个历史版本（回滚）。
     */
    @Transactional(rollbackFor = Exception.class)
    public PolicyEntity activate(String projectId, String policyId, String basePolicyId) {
        ProjectEntity project = lockProject(projectId);
        PolicyEntity target = policyRepository.findById(projectId, policyId);
        if (target == null) {
            throw AppException.notFound("Policy not found: " + policyId);
        }
        PolicyEntity active = findActive(project);
        policyVersioningDomainService.checkBase(active, basePolicyId);
        if (active == null || !StringUtils.equals(active.getPolicyId(), target.getPolicyId())) {
            activateLocked(project, target);
        }
        return target;
    }

    @Transactional(rollbackFor = Exception.class)
    public PolicyEntity resetToDefaults(String projectId, String basePolicyId, String createdByWorkspaceId) {
        PolicyBundle defaults = policyDefaultsDomainService.defaultBundle();
        return create(projectId, defaults, basePolicyId, true, createdByWorkspaceId);
    }

    /**
     * 确保项目存在激活策略；没有任何策略时以默认包创建版本 1 并激活。
     * 调用方需要处于事务中（与初始化、读取激活策略共用同一个事务）。
     */
    @Transactional(rollbackFor = Exception.class)
    public PolicyEntity ensureActivePolicy(String projectId) {
        ProjectEntity unlocked = projectRepository.findById(projectId);
        if (unlocked == null) {
            throw AppException.notFound("Project not found: " + projectId);
        }
        PolicyEntity active = findActive(unlocked);
        if (active != null) {
            return active;
        }
        ProjectEntity project = lockProject(projectId);
        active = findActive(project);
        if (active != null) {
            return active;
        }
        PolicyEntity created = insertNextVersion(projectId, policyDefaultsDomainService.defaultBundle(), null);
        activateLocked(project, created);
        log.info("Default policy bootstrapped. projectId={}, policyId={}, version={}",
                projectId, created.getPolicyId(), created.getVersion());
        return created;
    }

    private ProjectEntity lockProject(String projectId) {
        ProjectEntity project = projectRepository.lockById(projectId);
        if (project == null) {
            throw AppException.notFound("Project not found: " + projectId);
        }
        return project;
    }

    private PolicyEntity findActive(ProjectEntity project) {
        if (StringUtils.isBlank(project.getActivePolicyId())) {
            return null;
        }
        return policyRepository.findById(project.getId(), project.getActivePolicyId());
    }

    private PolicyEntity insertNextVersion(String projectId, PolicyBundle bundle, String createdByWorkspaceId) {
        PolicyEntity entity = new PolicyEntity();
        entity.setProjectId(projectId);
        entity.setVersion(policyRepository.findMaxVersion(projectId) + 1);
        entity.setBundle(bundle);
        entity.setCreatedByWorkspaceId(createdByWorkspaceId);
        entity.setCreatedAt(LocalDateTime.now());
        return policyRepository.insert(entity);
    }

    private void activateLocked(ProjectEntity project, PolicyEntity policy) {
        if (!projectRepository.updateActivePolicy(project.getId(), policy.getPolicyId())) {
            throw AppException.notFound("Project not found: " + project.getId());
        }
        project.setActivePolicyId(policy.getPolicyId());
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("policy_id", policy.getPolicyId());
        payload.put("version", policy.getVersion());
        projectEventPublisher.publishAfterCommit(EventTypeEnum.POLICY_ACTIVATED, project.getId(), null, payload);
    }
}
