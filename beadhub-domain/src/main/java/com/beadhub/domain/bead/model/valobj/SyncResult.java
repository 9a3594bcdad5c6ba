package com.beadhub.domain.bead.model.valobj;

import com.beadhub.types.enums.SyncModeEnum;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 一次同步调用的结果统计。
 */
@Data
public class SyncResult {

    private SyncModeEnum syncMode;

    private String repo;

    private String branch;

    private int issuesSynced;

    private int issuesAdded;

    private int issuesUpdated;

    private int issuesDeleted;

    /**
     * 陈旧更新而跳过的条目
     */
    private List<String> conflicts = new ArrayList<>();

    private List<ClaimDecision> claimDecisions = new ArrayList<>();

    private List<BeadStatusChange> statusChanges = new ArrayList<>();

    private int notificationsQueued;

    private LocalDateTime syncedAt;
}
