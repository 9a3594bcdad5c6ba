package com.beadhub.infrastructure.repository.policy;

import com.beadhub.domain.policy.adapter.repository.IPolicyRepository;
import com.beadhub.domain.policy.model.entity.PolicyEntity;
import com.beadhub.domain.policy.model.valobj.PolicyBundle;
import com.beadhub.infrastructure.dao.ProjectPolicyDao;
import com.beadhub.infrastructure.dao.po.ProjectPolicyPO;
import com.beadhub.infrastructure.util.JsonCodec;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * 项目策略仓储实现，版本一经写入不再修改。
 */
@Repository
public class PolicyRepositoryImpl implements IPolicyRepository {

    private final ProjectPolicyDao projectPolicyDao;
    private final JsonCodec jsonCodec;

    public PolicyRepositoryImpl(ProjectPolicyDao projectPolicyDao, JsonCodec jsonCodec) {
        this.projectPolicyDao = projectPolicyDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public PolicyEntity insert(PolicyEntity entity) {
        ProjectPolicyPO po = ProjectPolicyPO.builder()
                .policyId(entity.getPolicyId() == null ? UUID.randomUUID().toString() : entity.getPolicyId())
                .projectId(entity.getProjectId())
                .version(entity.getVersion())
                .bundleJson(jsonCodec.writeValue(entity.getBundle()))
                .createdByWorkspaceId(entity.getCreatedByWorkspaceId())
                .createdAt(entity.getCreatedAt() == null ? LocalDateTime.now() : entity.getCreatedAt())
                .build();
        projectPolicyDao.insert(po);
        return toEntity(po);
    }

    @Override
    public PolicyEntity findById(String projectId, String policyId) {
        return toEntity(projectPolicyDao.selectById(projectId, policyId));
    }

    @Override
    public int findMaxVersion(String projectId) {
        return projectPolicyDao.selectMaxVersion(projectId);
    }

    @Override
    public List<PolicyEntity> findHistory(String projectId, int limit) {
        List<ProjectPolicyPO> rows = projectPolicyDao.selectHistory(projectId, limit);
        if (rows == null || rows.isEmpty()) {
            return Collections.emptyList();
        }
        return rows.stream().map(this::toEntity).collect(Collectors.toList());
    }

    private PolicyEntity toEntity(ProjectPolicyPO po) {
        if (po == null) {
            return null;
        }
        PolicyEntity entity = new PolicyEntity();
        entity.setPolicyId(po.getPolicyId());
        entity.setProjectId(po.getProjectId());
        entity.setVersion(po.getVersion());
        PolicyBundle bundle = jsonCodec.readValue(po.getBundleJson(), PolicyBundle.class);
        entity.setBundle(bundle == null ? new PolicyBundle() : bundle);
        entity.setCreatedByWorkspaceId(po.getCreatedByWorkspaceId());
        entity.setCreatedAt(po.getCreatedAt());
        return entity;
    }
}
