package com.beadhub.infrastructure.redis;

/**
 * Redis key 约定。
 */
public final class RedisKeys {

    private RedisKeys() {
    }

    public static String presence(String workspaceId) {
        return "presence:" + workspaceId;
    }

    public static String projectIndex(String projectId) {
        return "idx:presence:project:" + projectId;
    }

    public static String repoIndex(String projectId, String repoId) {
        return "idx:presence:repo:" + projectId + ":" + repoId;
    }

    public static String branchIndex(String projectId, String repoId, String branch) {
        return "idx:presence:branch:" + projectId + ":" + repoId + ":" + branch;
    }

    public static String aliasIndex(String projectId, String alias) {
        return "idx:presence:alias:" + projectId + ":" + alias;
    }

    public static String eventChannel(String projectId) {
        return "events:" + projectId;
    }

    public static String rateLimit(String bucket) {
        return "ratelimit:" + bucket;
    }
}
