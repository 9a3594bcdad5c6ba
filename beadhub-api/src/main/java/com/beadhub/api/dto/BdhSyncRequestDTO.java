package com.beadhub.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * bdh 同步请求 DTO。
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BdhSyncRequestDTO {

    /**
     * 调用方工作区 ID，必须与认证身份一致
     */
    private String workspaceId;

    private String repoId;
    private String repoOrigin;

    /**
     * 分支，缺省 main
     */
    private String branch;

    private String alias;
    private String humanName;
    private String role;

    /**
     * full / incremental
     */
    private String syncMode;

    /**
     * 全量模式下的 JSONL 文本
     */
    private String issuesJsonl;

    /**
     * 增量模式下的 JSONL 文本
     */
    private String changedIssues;

    /**
     * 已解析的条目数组，与 JSONL 二选一
     */
    private List<Map<String, Object>> issues;

    private List<String> deletedIds;

    /**
     * 触发本次同步的 bd 命令行，仅用于日志与在线状态
     */
    private String commandLine;

}
