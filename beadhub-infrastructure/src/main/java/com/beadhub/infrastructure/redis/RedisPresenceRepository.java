package com.beadhub.infrastructure.redis;

import com.beadhub.domain.presence.adapter.repository.IPresenceRepository;
import com.beadhub.domain.presence.model.valobj.PresenceFilter;
import com.beadhub.domain.presence.model.valobj.PresenceRecord;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 基于 Redis 的在线状态缓存。
 * <p>
 * 每个工作区一个 hash（presence:{ws}），并按项目、仓库、分支、别名维护二级索引集合。
 * 索引 TTL 为记录 TTL 的若干倍，记录过期后索引中残留的成员在查询时惰性清理。
 * </p>
 */
@Slf4j
@Repository
public class RedisPresenceRepository implements IPresenceRepository {

    private static final String F_WORKSPACE_ID = "workspace_id";
    private static final String F_PROJECT_ID = "project_id";
    private static final String F_REPO_ID = "repo_id";
    private static final String F_BRANCH = "branch";
    private static final String F_ALIAS = "alias";
    private static final String F_HUMAN_NAME = "human_name";
    private static final String F_ROLE = "role";
    private static final String F_CURRENT_BEAD = "current_bead";
    private static final String F_COMMAND_LINE = "command_line";
    private static final String F_LAST_SEEN = "last_seen";

    private final StringRedisTemplate redisTemplate;
    private final int indexTtlMultiplier;

    public RedisPresenceRepository(StringRedisTemplate redisTemplate,
                                   @Value("${beadhub.presence.index-ttl-multiplier:2}") int indexTtlMultiplier) {
        this.redisTemplate = redisTemplate;
        this.indexTtlMultiplier = Math.max(1, indexTtlMultiplier);
    }

    /**
     * 主记录替换、TTL 与索引刷新放在同一个 MULTI/EXEC 中，任何时刻都不存在没有 TTL 的 presence 键。
     */
    @Override
    public void heartbeat(PresenceRecord record, int ttlSeconds) {
        String key = RedisKeys.presence(record.getWorkspaceId());
        Map<String, String> hash = toHash(record);
        Duration ttl = Duration.ofSeconds(ttlSeconds);
        Duration indexTtl = Duration.ofSeconds((long) ttlSeconds * indexTtlMultiplier);
        List<String> indexKeys = indexKeys(record);
        List<Object> results = redisTemplate.execute(new SessionCallback<List<Object>>() {
            @Override
            @SuppressWarnings("unchecked")
            public <K, V> List<Object> execute(RedisOperations<K, V> operations) throws DataAccessException {
                RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;
                ops.multi();
                ops.delete(key);
                ops.opsForHash().putAll(key, hash);
                ops.expire(key, ttl);
                for (String indexKey : indexKeys) {
                    ops.opsForSet().add(indexKey, record.getWorkspaceId());
                    ops.expire(indexKey, indexTtl);
                }
                return ops.exec();
            }
        });
        if (results == null || results.isEmpty()) {
            throw new IllegalStateException("Presence transaction discarded for workspace " + record.getWorkspaceId());
        }
    }

    @Override
    public int clear(Collection<String> workspaceIds) {
        if (workspaceIds == null || workspaceIds.isEmpty()) {
            return 0;
        }
        List<String> keys = new ArrayList<>(workspaceIds.size());
        for (String workspaceId : workspaceIds) {
            keys.add(RedisKeys.presence(workspaceId));
        }
        Long removed = redisTemplate.delete(keys);
        return removed == null ? 0 : removed.intValue();
    }

    @Override
    public PresenceRecord find(String workspaceId) {
        Map<Object, Object> hash = redisTemplate.opsForHash().entries(RedisKeys.presence(workspaceId));
        if (hash == null || hash.isEmpty()) {
            return null;
        }
        return fromHash(hash);
    }

    @Override
    public List<PresenceRecord> lookup(PresenceFilter filter) {
        String indexKey = selectIndex(filter);
        Set<String> members = redisTemplate.opsForSet().members(indexKey);
        List<PresenceRecord> records = new ArrayList<>();
        if (members == null || members.isEmpty()) {
            return records;
        }
        for (String workspaceId : members) {
            PresenceRecord record = find(workspaceId);
            if (record == null) {
                redisTemplate.opsForSet().remove(indexKey, workspaceId);
                log.debug("Removed stale presence index member. index={}, workspaceId={}", indexKey, workspaceId);
                continue;
            }
            if (matches(record, filter)) {
                records.add(record);
            }
        }
        records.sort((a, b) -> StringUtils.compare(a.getAlias(), b.getAlias()));
        return records;
    }

    private String selectIndex(PresenceFilter filter) {
        if (StringUtils.isNotBlank(filter.getAlias())) {
            return RedisKeys.aliasIndex(filter.getProjectId(), filter.getAlias());
        }
        if (StringUtils.isNotBlank(filter.getRepoId()) && StringUtils.isNotBlank(filter.getBranch())) {
            return RedisKeys.branchIndex(filter.getProjectId(), filter.getRepoId(), filter.getBranch());
        }
        if (StringUtils.isNotBlank(filter.getRepoId())) {
            return RedisKeys.repoIndex(filter.getProjectId(), filter.getRepoId());
        }
        return RedisKeys.projectIndex(filter.getProjectId());
    }

    private boolean matches(PresenceRecord record, PresenceFilter filter) {
        if (!StringUtils.equals(record.getProjectId(), filter.getProjectId())) {
            return false;
        }
        if (StringUtils.isNotBlank(filter.getRepoId()) && !filter.getRepoId().equals(record.getRepoId())) {
            return false;
        }
        if (StringUtils.isNotBlank(filter.getBranch()) && !filter.getBranch().equals(record.getBranch())) {
            return false;
        }
        return StringUtils.isBlank(filter.getAlias()) || filter.getAlias().equals(record.getAlias());
    }

    private List<String> indexKeys(PresenceRecord record) {
        List<String> keys = new ArrayList<>();
        keys.add(RedisKeys.projectIndex(record.getProjectId()));
        if (StringUtils.isNotBlank(record.getRepoId())) {
            keys.add(RedisKeys.repoIndex(record.getProjectId(), record.getRepoId()));
            if (StringUtils.isNotBlank(record.getBranch())) {
                keys.add(RedisKeys.branchIndex(record.getProjectId(), record.getRepoId(), record.getBranch()));
            }
        }
        if (StringUtils.isNotBlank(record.getAlias())) {
            keys.add(RedisKeys.aliasIndex(record.getProjectId(), record.getAlias()));
        }
        return keys;
    }

    private Map<String, String> toHash(PresenceRecord record) {
        Map<String, String> hash = new LinkedHashMap<>();
        putIfPresent(hash, F_WORKSPACE_ID, record.getWorkspaceId());
        putIfPresent(hash, F_PROJECT_ID, record.getProjectId());
        putIfPresent(hash, F_REPO_ID, record.getRepoId());
        putIfPresent(hash, F_BRANCH, record.getBranch());
        putIfPresent(hash, F_ALIAS, record.getAlias());
        putIfPresent(hash, F_HUMAN_NAME, record.getHumanName());
        putIfPresent(hash, F_ROLE, record.getRole());
        putIfPresent(hash, F_CURRENT_BEAD, record.getCurrentBead());
        putIfPresent(hash, F_COMMAND_LINE, record.getCommandLine());
        putIfPresent(hash, F_LAST_SEEN, record.getLastSeen());
        return hash;
    }

    private void putIfPresent(Map<String, String> hash, String field, String value) {
        if (value != null) {
            hash.put(field, value);
        }
    }

    private PresenceRecord fromHash(Map<Object, Object> hash) {
        return PresenceRecord.builder()
                .workspaceId(field(hash, F_WORKSPACE_ID))
                .projectId(field(hash, F_PROJECT_ID))
                .repoId(field(hash, F_REPO_ID))
                .branch(field(hash, F_BRANCH))
                .alias(field(hash, F_ALIAS))
                .humanName(field(hash, F_HUMAN_NAME))
                .role(field(hash, F_ROLE))
                .currentBead(field(hash, F_CURRENT_BEAD))
                .commandLine(field(hash, F_COMMAND_LINE))
                .lastSeen(field(hash, F_LAST_SEEN))
                .build();
    }

    private String field(Map<Object, Object> hash, String name) {
        Object value = hash.get(name);
        return value == null ? null : value.toString();
    }
}
