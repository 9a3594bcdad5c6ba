package com.beadhub.test.support;

import com.beadhub.domain.bead.adapter.repository.IBeadIssueRepository;
import com.beadhub.domain.bead.model.entity.BeadIssueEntity;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 内存条目仓储，按 (project, repo, branch, bead_id) 寻址。
 */
public class InMemoryBeadIssueRepository implements IBeadIssueRepository {

    private final Map<String, BeadIssueEntity> store = new LinkedHashMap<>();

    @Override
    public BeadIssueEntity findForUpdate(String projectId, String repo, String branch, String beadId) {
        return store.get(key(projectId, repo, branch, beadId));
    }

    @Override
    public void upsert(BeadIssueEntity entity) {
        store.put(key(entity.getProjectId(), entity.getRepo(), entity.getBranch(), entity.getBeadId()), entity);
    }

    @Override
    public int deleteByBeadIds(String projectId, String repo, String branch, List<String> beadIds) {
        int removed = 0;
        for (String beadId : beadIds) {
            if (store.remove(key(projectId, repo, branch, beadId)) != null) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public List<BeadIssueEntity> findByBeadId(String projectId, String beadId) {
        List<BeadIssueEntity> result = new ArrayList<>();
        for (BeadIssueEntity issue : store.values()) {
            if (issue.getProjectId().equals(projectId) && issue.getBeadId().equals(beadId)) {
                result.add(issue);
            }
        }
        return result;
    }

    @Override
    public List<BeadIssueEntity> findByStatus(String projectId, String repo, String branch, String status, int limit) {
        return store.values().stream()
                .filter(issue -> issue.getProjectId().equals(projectId))
                .filter(issue -> status.equals(issue.getStatus()))
                .filter(issue -> repo == null || repo.equals(issue.getRepo()))
                .filter(issue -> branch == null || branch.equals(issue.getBranch()))
                .sorted(Comparator.comparing(BeadIssueEntity::getPriority, Comparator.nullsLast(Comparator.naturalOrder()))
                        .thenComparing(BeadIssueEntity::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()))
                        .thenComparing(BeadIssueEntity::getBeadId))
                .limit(limit)
                .toList();
    }

    private String key(String projectId, String repo, String branch, String beadId) {
        return projectId + "|" + repo + "|" + branch + "|" + beadId;
    }
}
