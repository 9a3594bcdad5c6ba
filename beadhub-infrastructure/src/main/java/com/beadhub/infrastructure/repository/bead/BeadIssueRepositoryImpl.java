package com.beadhub.infrastructure.repository.bead;

import com.beadhub.domain.bead.adapter.repository.IBeadIssueRepository;
import com.beadhub.domain.bead.model.entity.BeadIssueEntity;
import com.beadhub.domain.bead.model.valobj.BeadRef;
import com.beadhub.infrastructure.dao.BeadIssueDao;
import com.beadhub.infrastructure.dao.po.BeadIssuePO;
import com.beadhub.infrastructure.util.JsonCodec;
import com.fasterxml.jackson.core.type.TypeReference;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * 工作项镜像仓储实现。
 * <p>
 * blocked_by / parent_id 以 {repo, branch, bead_id} 对象形式落库。
 * </p>
 */
@Repository
public class BeadIssueRepositoryImpl implements IBeadIssueRepository {

    private static final TypeReference<List<Map<String, Object>>> REF_LIST =
            new TypeReference<List<Map<String, Object>>>() {};

    private final BeadIssueDao beadIssueDao;
    private final JsonCodec jsonCodec;

    public BeadIssueRepositoryImpl(BeadIssueDao beadIssueDao, JsonCodec jsonCodec) {
        this.beadIssueDao = beadIssueDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public BeadIssueEntity findForUpdate(String projectId, String repo, String branch, String beadId) {
        return toEntity(beadIssueDao.selectForUpdate(projectId, repo, branch, beadId));
    }

    @Override
    public void upsert(BeadIssueEntity entity) {
        BeadIssuePO po = toPO(entity);
        if (po.getId() == null) {
            po.setId(UUID.randomUUID().toString());
        }
        if (po.getSyncedAt() == null) {
            po.setSyncedAt(LocalDateTime.now());
        }
        beadIssueDao.upsert(po);
    }

    @Override
    public int deleteByBeadIds(String projectId, String repo, String branch, List<String> beadIds) {
        if (beadIds == null || beadIds.isEmpty()) {
            return 0;
        }
        return beadIssueDao.deleteByBeadIds(projectId, repo, branch, beadIds);
    }

    @Override
    public List<BeadIssueEntity> findByBeadId(String projectId, String beadId) {
        List<BeadIssuePO> rows = beadIssueDao.selectByBeadId(projectId, beadId);
        if (rows == null || rows.isEmpty()) {
            return Collections.emptyList();
        }
        return rows.stream().map(this::toEntity).collect(Collectors.toList());
    }

    @Override
    public List<BeadIssueEntity> findByStatus(String projectId, String repo, String branch, String status, int limit) {
        List<BeadIssuePO> rows = beadIssueDao.selectByStatus(projectId, repo, branch, status, limit);
        if (rows == null || rows.isEmpty()) {
            return Collections.emptyList();
        }
        return rows.stream().map(this::toEntity).collect(Collectors.toList());
    }

    private BeadIssueEntity toEntity(BeadIssuePO po) {
        if (po == null) {
            return null;
        }
        BeadIssueEntity entity = new BeadIssueEntity();
        entity.setId(po.getId());
        entity.setProjectId(po.getProjectId());
        entity.setBeadId(po.getBeadId());
        entity.setRepo(po.getRepo());
        entity.setBranch(po.getBranch());
        entity.setTitle(po.getTitle());
        entity.setDescription(po.getDescription());
        entity.setStatus(po.getStatus());
        entity.setPriority(po.getPriority());
        entity.setIssueType(po.getIssueType());
        entity.setAssignee(po.getAssignee());
        entity.setCreatedBy(po.getCreatedBy());
        entity.setLabels(jsonCodec.readStringList(po.getLabels()));
        entity.setBlockedBy(readRefs(po.getBlockedBy()));
        entity.setParentId(readRef(jsonCodec.readMap(po.getParentId())));
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        entity.setSyncedAt(po.getSyncedAt());
        return entity;
    }

    private BeadIssuePO toPO(BeadIssueEntity entity) {
        List<Map<String, Object>> blockedBy = new ArrayList<>();
        if (entity.getBlockedBy() != null) {
            for (BeadRef ref : entity.getBlockedBy()) {
                blockedBy.add(writeRef(ref));
            }
        }
        return BeadIssuePO.builder()
                .id(entity.getId())
                .projectId(entity.getProjectId())
                .beadId(entity.getBeadId())
                .repo(entity.getRepo())
                .branch(entity.getBranch())
                .title(entity.getTitle())
                .description(entity.getDescription())
                .status(entity.getStatus())
                .priority(entity.getPriority())
                .issueType(entity.getIssueType())
                .assignee(entity.getAssignee())
                .createdBy(entity.getCreatedBy())
                .labels(jsonCodec.writeValue(entity.getLabels()))
                .blockedBy(jsonCodec.writeValue(blockedBy))
                .parentId(entity.getParentId() == null ? null : jsonCodec.writeValue(writeRef(entity.getParentId())))
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .syncedAt(entity.getSyncedAt())
                .build();
    }

    private List<BeadRef> readRefs(String json) {
        List<Map<String, Object>> raw = jsonCodec.readValue(json, REF_LIST);
        if (raw == null) {
            return new ArrayList<>();
        }
        List<BeadRef> refs = new ArrayList<>(raw.size());
        for (Map<String, Object> item : raw) {
            BeadRef ref = readRef(item);
            if (ref != null) {
                refs.add(ref);
            }
        }
        return refs;
    }

    private BeadRef readRef(Map<String, Object> raw) {
        if (raw == null || raw.get("bead_id") == null) {
            return null;
        }
        return new BeadRef(asString(raw.get("repo")), asString(raw.get("branch")), asString(raw.get("bead_id")));
    }

    private Map<String, Object> writeRef(BeadRef ref) {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("repo", ref.getRepo());
        raw.put("branch", ref.getBranch());
        raw.put("bead_id", ref.getBeadId());
        return raw;
    }

    private String asString(Object value) {
        return value == null ? null : String.valueOf(value);
    }
}
