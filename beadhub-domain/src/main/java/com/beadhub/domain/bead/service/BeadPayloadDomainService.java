package com.beadhub.domain.bead.service;

import com.beadhub.domain.bead.model.entity.BeadIssueEntity;
import com.beadhub.domain.bead.model.valobj.BeadRef;
import com.beadhub.domain.bead.model.valobj.IncomingBead;
import com.beadhub.domain.project.service.RepoOriginDomainService;
import com.google.common.primitives.Ints;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 入站条目载荷领域服务：校验条目、解析依赖引用、补齐默认作用域。
 * <p>
 * 无效条目（缺少 id、id 非法、非对象）跳过并记录告警，不影响同批次其他条目。
 * </p>
 */
@Slf4j
@Service
public class BeadPayloadDomainService {

    private static final Pattern BEAD_ID = Pattern.compile("^[a-zA-Z0-9][a-zA-Z0-9_.-]{0,99}$");
    private static final Pattern BRANCH = Pattern.compile("^[a-zA-Z0-9][a-zA-Z0-9/_.-]{0,254}$");
    private static final int CREATED_BY_MAX_LENGTH = 255;
    private static final int MAX_APEX_DEPTH = 32;

    private final RepoOriginDomainService repoOriginDomainService;

    public BeadPayloadDomainService(RepoOriginDomainService repoOriginDomainService) {
        this.repoOriginDomainService = repoOriginDomainService;
    }

    public boolean isValidBeadId(String beadId) {
        return beadId != null && BEAD_ID.matcher(beadId).matches();
    }

    public boolean isValidBranch(String branch) {
        return branch != null && BRANCH.matcher(branch).matches();
    }

    /**
     * 把原始记录转换为入站条目，按 id 去重（后出现的覆盖先出现的），保持首次出现顺序。
     */
    public List<IncomingBead> toIncoming(String projectId, String repo, String branch,
                                         List<Map<String, Object>> records) {
        Map<String, Map<String, Object>> byId = new LinkedHashMap<>();
        if (records != null) {
            for (int idx = 0; idx < records.size(); idx++) {
                Map<String, Object> record = records.get(idx);
                if (record == null) {
                    log.warn("Skipping non-object issue. index={}", idx);
                    continue;
                }
                Object rawId = record.get("id");
                if (!(rawId instanceof String beadId) || StringUtils.isBlank(beadId)) {
                    log.warn("Skipping issue without id. index={}", idx);
                    continue;
                }
                if (!isValidBeadId(beadId)) {
                    log.warn("Skipping issue with invalid bead id. index={}, beadId={}", idx, StringUtils.left(beadId, 50));
                    continue;
                }
                byId.put(beadId, record);
            }
        }

        List<IncomingBead> result = new ArrayList<>(byId.size());
        for (Map.Entry<String, Map<String, Object>> entry : byId.entrySet()) {
            try {
                result.add(toIncoming(projectId, repo, branch, entry.getKey(), entry.getValue(), byId));
            } catch (RuntimeException ex) {
                log.warn("Skipping malformed issue. beadId={}, error={}", entry.getKey(), ex.getMessage());
            }
        }
        return result;
    }

    /**
     * 过滤出合法的删除 ID，保持顺序并去重。
     */
    public List<String> validDeletedIds(Collection<String> deletedIds) {
        List<String> result = new ArrayList<>();
        if (deletedIds == null) {
            return result;
        }
        Set<String> seen = new HashSet<>();
        for (String id : deletedIds) {
            if (!isValidBeadId(id)) {
                log.warn("Skipping invalid deleted id. beadId={}", StringUtils.left(id, 50));
                continue;
            }
            if (seen.add(id)) {
                result.add(id);
            }
        }
        return result;
    }

    /**
     * 沿 parent-child 关系向上查找同批次中的根条目；父条目不在本批次时停在已知的最高层。
     */
    public String resolveApex(IncomingBead incoming, Map<String, IncomingBead> batch) {
        String current = incoming.getBeadId();
        BeadRef parent = incoming.getIssue().getParentId();
        Set<String> visited = new HashSet<>();
        visited.add(current);
        int depth = 0;
        while (parent != null && depth++ < MAX_APEX_DEPTH) {
            String parentId = parent.getBeadId();
            if (!visited.add(parentId)) {
                break;
            }
            current = parentId;
            IncomingBead parentBead = batch.get(parentId);
            parent = parentBead == null ? null : parentBead.getIssue().getParentId();
        }
        return current;
    }

    private IncomingBead toIncoming(String projectId, String repo, String branch, String beadId,
                                    Map<String, Object> record, Map<String, Map<String, Object>> batch) {
        BeadIssueEntity issue = new BeadIssueEntity();
        issue.setProjectId(projectId);
        issue.setBeadId(beadId);
        issue.setRepo(repo);
        issue.setBranch(branch);
        issue.setTitle(asString(record.get("title")));
        issue.setDescription(asString(record.get("description")));
        issue.setStatus(asString(record.get("status")));
        issue.setPriority(asInteger(record.get("priority")));
        issue.setIssueType(asString(record.get("issue_type")));
        issue.setAssignee(asString(record.get("assignee")));
        issue.setCreatedBy(normalizeCreatedBy(beadId, record.get("created_by")));
        issue.setLabels(asStringList(record.get("labels")));
        issue.setCreatedAt(parseTimestamp(record.get("created_at")));
        issue.setUpdatedAt(parseTimestamp(record.get("updated_at")));

        List<BeadRef> blockedBy = parseBlockedBy(record.get("blocked_by"), repo, branch);
        BeadRef parentId = null;
        if (record.get("dependencies") instanceof List<?> dependencies) {
            for (Object dependency : dependencies) {
                if (!(dependency instanceof Map<?, ?> dep)) {
                    continue;
                }
                String dependsOn = asString(dep.get("depends_on_id"));
                if (StringUtils.isBlank(dependsOn)) {
                    continue;
                }
                BeadRef ref = parseStringRef(dependsOn, repo, branch);
                if (ref == null) {
                    continue;
                }
                String type = asString(dep.get("type"));
                if ("parent-child".equals(type)) {
                    if (parentId == null) {
                        parentId = ref;
                    }
                    continue;
                }
                if (!"blocks".equals(type)) {
                    continue;
                }
                Map<String, Object> target = batch.get(dependsOn);
                if (target == null || !"closed".equals(asString(target.get("status")))) {
                    blockedBy.add(ref);
                }
            }
        }
        issue.setBlockedBy(blockedBy);
        issue.setParentId(parentId);
        return new IncomingBead(issue, Boolean.TRUE.equals(record.get("coordinated")));
    }

    /**
     * 解析 blocked_by：支持 "bd-1"、"other/repo:bd-1" 与 {repo, branch, bead_id} 三种形式。
     */
    public List<BeadRef> parseBlockedBy(Object blockedBy, String repo, String branch) {
        List<BeadRef> refs = new ArrayList<>();
        if (!(blockedBy instanceof List<?> items)) {
            return refs;
        }
        for (Object item : items) {
            BeadRef ref = null;
            if (item instanceof String text) {
                ref = parseStringRef(text, repo, branch);
            } else if (item instanceof Map<?, ?> structured) {
                ref = parseStructuredRef(structured, repo, branch);
            } else {
                log.warn("Unexpected blocked_by entry type. type={}", item == null ? "null" : item.getClass().getSimpleName());
            }
            if (ref != null) {
                refs.add(ref);
            }
        }
        return refs;
    }

    private BeadRef parseStringRef(String dependsOn, String repo, String branch) {
        String value = dependsOn.trim();
        if (value.isEmpty()) {
            return null;
        }
        if (value.contains(":")) {
            String refRepo = StringUtils.substringBefore(value, ":").trim();
            String refBeadId = StringUtils.substringAfter(value, ":").trim();
            if (refRepo.isEmpty() || !isValidBeadId(refBeadId) || !repoOriginDomainService.isCanonical(refRepo)) {
                log.warn("Malformed cross-repo dependency ref. ref={}", StringUtils.left(value, 100));
                return null;
            }
            return new BeadRef(refRepo, branch, refBeadId);
        }
        if (!isValidBeadId(value)) {
            log.warn("Invalid bead id in dependency ref. ref={}", StringUtils.left(value, 100));
            return null;
        }
        return new BeadRef(repo, branch, value);
    }

    private BeadRef parseStructuredRef(Map<?, ?> item, String repo, String branch) {
        String beadId = asString(item.get("bead_id"));
        if (!isValidBeadId(beadId)) {
            log.warn("Invalid bead_id in structured blocked_by. beadId={}", StringUtils.left(beadId, 50));
            return null;
        }
        String refRepo = asString(item.get("repo"));
        if (StringUtils.isNotBlank(refRepo) && !repoOriginDomainService.isCanonical(refRepo)) {
            log.warn("Invalid repo in structured blocked_by. repo={}", StringUtils.left(refRepo, 100));
            return null;
        }
        String refBranch = asString(item.get("branch"));
        if (StringUtils.isNotBlank(refBranch) && !isValidBranch(refBranch)) {
            log.warn("Invalid branch in structured blocked_by. branch={}", StringUtils.left(refBranch, 100));
            return null;
        }
        return new BeadRef(StringUtils.defaultIfBlank(refRepo, repo), StringUtils.defaultIfBlank(refBranch, branch), beadId);
    }

    private String normalizeCreatedBy(String beadId, Object value) {
        String createdBy = value == null ? null : StringUtils.trimToNull(String.valueOf(value));
        if (createdBy != null && createdBy.length() > CREATED_BY_MAX_LENGTH) {
            log.warn("Truncating created_by. beadId={}, length={}", beadId, createdBy.length());
            createdBy = createdBy.substring(0, CREATED_BY_MAX_LENGTH);
        }
        return createdBy;
    }

    /**
     * 解析 ISO-8601 时间；带时区偏移的值换算为本地时区。无法解析时返回 null。
     */
    LocalDateTime parseTimestamp(Object value) {
        String text = asString(value);
        if (StringUtils.isBlank(text)) {
            return null;
        }
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(text, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime offsetDateTime) {
                return offsetDateTime.atZoneSameInstant(ZoneId.systemDefault()).toLocalDateTime();
            }
            return (LocalDateTime) parsed;
        } catch (DateTimeParseException ex) {
            log.debug("Unparseable timestamp ignored. value={}", StringUtils.left(text, 50));
            return null;
        }
    }

    private String asString(Object value) {
        if (value == null) {
            return null;
        }
        return value instanceof String text ? text : String.valueOf(value);
    }

    /**
     * 超出 int 范围或无法解析的值按缺省处理，不影响同批次其它条目。
     */
    private Integer asInteger(Object value) {
        if (value instanceof Integer number) {
            return number;
        }
        if (value instanceof Number number) {
            long widened = number.longValue();
            return widened < Integer.MIN_VALUE || widened > Integer.MAX_VALUE ? null : (int) widened;
        }
        if (value instanceof String text) {
            return Ints.tryParse(text.trim());
        }
        return null;
    }

    private List<String> asStringList(Object value) {
        if (!(value instanceof List<?> items) || items.isEmpty()) {
            return null;
        }
        List<String> result = new ArrayList<>(items.size());
        for (Object item : items) {
            if (item != null) {
                result.add(String.valueOf(item));
            }
        }
        return result;
    }
}
