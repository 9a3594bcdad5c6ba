package com.beadhub.trigger.application.command;

import com.beadhub.api.dto.BdhSyncRequestDTO;
import com.beadhub.domain.auth.model.valobj.AuthIdentity;
import com.beadhub.domain.bead.adapter.repository.IBeadClaimRepository;
import com.beadhub.domain.bead.adapter.repository.IBeadIssueRepository;
import com.beadhub.domain.bead.model.entity.BeadClaimEntity;
import com.beadhub.domain.bead.model.entity.BeadIssueEntity;
import com.beadhub.domain.bead.model.valobj.BeadStatusChange;
import com.beadhub.domain.bead.model.valobj.ClaimDecision;
import com.beadhub.domain.bead.model.valobj.IncomingBead;
import com.beadhub.domain.bead.model.valobj.SyncResult;
import com.beadhub.domain.bead.service.BeadPayloadDomainService;
import com.beadhub.domain.bead.service.ClaimArbitrationDomainService;
import com.beadhub.domain.notification.adapter.repository.IOutboxRepository;
import com.beadhub.domain.notification.adapter.repository.ISubscriptionRepository;
import com.beadhub.domain.notification.model.entity.OutboxEntryEntity;
import com.beadhub.domain.notification.service.OutboxDomainService;
import com.beadhub.domain.project.adapter.repository.IRepoRepository;
import com.beadhub.domain.project.adapter.repository.IWorkspaceRepository;
import com.beadhub.domain.project.model.entity.RepoEntity;
import com.beadhub.domain.project.model.entity.WorkspaceEntity;
import com.beadhub.domain.project.service.RepoOriginDomainService;
import com.beadhub.trigger.application.common.JsonlPayloadParser;
import com.beadhub.trigger.application.common.WorkspaceGuard;
import com.beadhub.trigger.event.ProjectEventPublisher;
import com.beadhub.types.common.Constants;
import com.beadhub.types.enums.EventTypeEnum;
import com.beadhub.types.enums.SyncModeEnum;
import com.beadhub.types.exception.AppException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * 工作项同步写用例。
 * <p>
 * 一次调用是一个事务：条目 upsert、认领变更、发件箱写入一起提交或一起回滚。
 * 需要仲裁的条目（认领尝试、closed、显式删除）先按 bead_id 排序获取事务级咨询锁，
 * 两个并发认领同一条目的调用因此被串行化，后到者看到先到者的认领并被拒绝。
 * </p>
 */
@Slf4j
@Service
public class BeadSyncCommandService {

    private final WorkspaceGuard workspaceGuard;
    private final IRepoRepository repoRepository;
    private final IWorkspaceRepository workspaceRepository;
    private final IBeadIssueRepository beadIssueRepository;
    private final IBeadClaimRepository beadClaimRepository;
    private final ISubscriptionRepository subscriptionRepository;
    private final IOutboxRepository outboxRepository;
    private final BeadPayloadDomainService beadPayloadDomainService;
    private final ClaimArbitrationDomainService claimArbitrationDomainService;
    private final OutboxDomainService outboxDomainService;
    private final RepoOriginDomainService repoOriginDomainService;
    private final JsonlPayloadParser jsonlPayloadParser;
    private final ProjectEventPublisher projectEventPublisher;

    private final Counter syncCounter;
    private final Counter claimRejectedCounter;
    private final Counter notificationsQueuedCounter;
    private final Timer syncTimer;

    public BeadSyncCommandService(WorkspaceGuard workspaceGuard,
                                  IRepoRepository repoRepository,
                                  IWorkspaceRepository workspaceRepository,
                                  IBeadIssueRepository beadIssueRepository,
                                  IBeadClaimRepository beadClaimRepository,
                                  ISubscriptionRepository subscriptionRepository,
                                  IOutboxRepository outboxRepository,
                                  BeadPayloadDomainService beadPayloadDomainService,
                                  ClaimArbitrationDomainService claimArbitrationDomainService,
                                  OutboxDomainService outboxDomainService,
                                  RepoOriginDomainService repoOriginDomainService,
                                  JsonlPayloadParser jsonlPayloadParser,
                                  ProjectEventPublisher projectEventPublisher) {
        this.workspaceGuard = workspaceGuard;
        this.repoRepository = repoRepository;
        this.workspaceRepository = workspaceRepository;
        this.beadIssueRepository = beadIssueRepository;
        this.beadClaimRepository = beadClaimRepository;
        this.subscriptionRepository = subscriptionRepository;
        this.outboxRepository = outboxRepository;
        this.beadPayloadDomainService = beadPayloadDomainService;
        this.claimArbitrationDomainService = claimArbitrationDomainService;
        this.outboxDomainService = outboxDomainService;
        this.repoOriginDomainService = repoOriginDomainService;
        this.jsonlPayloadParser = jsonlPayloadParser;
        this.projectEventPublisher = projectEventPublisher;
        this.syncCounter = Counter.builder("beadhub.sync.total").register(Metrics.globalRegistry);
        this.claimRejectedCounter = Counter.builder("beadhub.claim.rejected.total").register(Metrics.globalRegistry);
        this.notificationsQueuedCounter = Counter.builder("beadhub.sync.notifications.queued.total").register(Metrics.globalRegistry);
        this.syncTimer = Timer.builder("beadhub.sync.duration").register(Metrics.globalRegistry);
    }

    @Transactional(rollbackFor = Exception.class)
    public SyncOutcome sync(AuthIdentity identity, BdhSyncRequestDTO request) {
        if (request == null) {
            throw AppException.illegalParameter("Request body is required");
        }
        WorkspaceEntity workspace = workspaceGuard.requireActingWorkspace(identity, request.getWorkspaceId());
        Timer.Sample sample = Timer.start(Metrics.globalRegistry);
        try {
            return doSync(workspace, request);
        } finally {
            sample.stop(syncTimer);
        }
    }

    private SyncOutcome doSync(WorkspaceEntity workspace, BdhSyncRequestDTO request) {
        String projectId = workspace.getProjectId();
        RepoEntity repo = resolveRepo(workspace, request);
        String repoScope = repo.getCanonicalOrigin();
        String branch = StringUtils.defaultIfBlank(StringUtils.trimToNull(request.getBranch()), Constants.DEFAULT_BRANCH);
        if (!beadPayloadDomainService.isValidBranch(branch)) {
            throw AppException.illegalParameter("Invalid branch: " + StringUtils.left(branch, 100));
        }
        SyncModeEnum syncMode = resolveSyncMode(request);
        List<Map<String, Object>> records = resolveRecords(request, syncMode);
        List<IncomingBead> incoming = beadPayloadDomainService.toIncoming(projectId, repoScope, branch, records);
        List<String> deletedIds = beadPayloadDomainService.validDeletedIds(request.getDeletedIds());

        Map<String, IncomingBead> batch = new LinkedHashMap<>();
        for (IncomingBead bead : incoming) {
            batch.put(bead.getBeadId(), bead);
        }
        lockArbitratedBeads(projectId, workspace, incoming, deletedIds);

        LocalDateTime now = LocalDateTime.now();
        SyncResult result = new SyncResult();
        result.setSyncMode(syncMode);
        result.setRepo(repoScope);
        result.setBranch(branch);
        String currentBead = null;

        for (IncomingBead bead : incoming) {
            BeadIssueEntity issue = bead.getIssue();
            String beadId = bead.getBeadId();
            BeadIssueEntity stored = beadIssueRepository.findForUpdate(projectId, repoScope, branch, beadId);
            if (issue.isStaleComparedTo(stored)) {
                log.info("Stale bead update skipped. projectId={}, beadId={}, incomingUpdatedAt={}, storedUpdatedAt={}",
                        projectId, beadId, issue.getUpdatedAt(), stored.getUpdatedAt());
                result.getConflicts().add(beadId);
                continue;
            }

            if (claimArbitrationDomainService.isClaimAttempt(bead, workspace)) {
                ClaimDecision decision = arbitrate(workspace, bead, batch);
                result.getClaimDecisions().add(decision);
                if (decision.isRejected()) {
                    claimRejectedCounter.increment();
                    log.info("Claim rejected. projectId={}, beadId={}, workspaceId={}, holderWorkspaceId={}",
                            projectId, beadId, workspace.getWorkspaceId(), decision.getHolder().getWorkspaceId());
                    continue;
                }
                if (currentBead == null) {
                    currentBead = beadId;
                }
            } else if (claimArbitrationDomainService.releasesAllClaims(issue.getStatus())) {
                if (beadClaimRepository.deleteByBead(projectId, beadId) > 0) {
                    recordRelease(result, workspace, beadId);
                }
            } else if (!Constants.STATUS_IN_PROGRESS.equals(issue.getStatus())) {
                if (beadClaimRepository.deleteByWorkspaceAndBead(projectId, workspace.getWorkspaceId(), beadId)) {
                    recordRelease(result, workspace, beadId);
                }
            }

            issue.setSyncedAt(now);
            beadIssueRepository.upsert(issue);
            result.setIssuesSynced(result.getIssuesSynced() + 1);
            if (stored == null) {
                result.setIssuesAdded(result.getIssuesAdded() + 1);
                continue;
            }
            result.setIssuesUpdated(result.getIssuesUpdated() + 1);
            if (!Objects.equals(stored.getStatus(), issue.getStatus())) {
                queueStatusChange(result, workspace, BeadStatusChange.builder()
                        .beadId(beadId)
                        .repo(repoScope)
                        .branch(branch)
                        .oldStatus(stored.getStatus())
                        .newStatus(issue.getStatus())
                        .title(issue.getTitle())
                        .build());
            }
        }

        if (!deletedIds.isEmpty()) {
            result.setIssuesDeleted(beadIssueRepository.deleteByBeadIds(projectId, repoScope, branch, deletedIds));
            for (String beadId : deletedIds) {
                if (beadClaimRepository.deleteByBead(projectId, beadId) > 0) {
                    recordRelease(result, workspace, beadId);
                }
            }
        }

        workspaceRepository.touchLastSeen(workspace.getWorkspaceId(), now);
        result.setSyncedAt(now);
        syncCounter.increment();
        notificationsQueuedCounter.increment(result.getNotificationsQueued());
        log.info("Sync completed. projectId={}, workspaceId={}, repo={}, branch={}, mode={}, synced={}, added={}, updated={}, deleted={}, conflicts={}, claims={}, notifications={}",
                projectId, workspace.getWorkspaceId(), repoScope, branch, syncMode.getCode(),
                result.getIssuesSynced(), result.getIssuesAdded(), result.getIssuesUpdated(), result.getIssuesDeleted(),
                result.getConflicts().size(), result.getClaimDecisions().size(), result.getNotificationsQueued());
        return new SyncOutcome(workspace, result, branch, currentBead);
    }

    private RepoEntity resolveRepo(WorkspaceEntity workspace, BdhSyncRequestDTO request) {
        String projectId = workspace.getProjectId();
        if (StringUtils.isNotBlank(request.getRepoId())) {
            RepoEntity repo = repoRepository.findById(request.getRepoId().trim());
            if (repo == null || !Objects.equals(repo.getProjectId(), projectId) || repo.isDeleted()) {
                throw AppException.notFound("Repo not found: " + request.getRepoId());
            }
            return repo;
        }
        if (StringUtils.isNotBlank(request.getRepoOrigin())) {
            String canonical;
            try {
                canonical = repoOriginDomainService.canonicalize(request.getRepoOrigin());
            } catch (IllegalArgumentException ex) {
                throw AppException.illegalParameter(ex.getMessage());
            }
            RepoEntity repo = repoRepository.findByCanonicalOrigin(projectId, canonical);
            if (repo != null && !repo.isDeleted()) {
                return repo;
            }
            RepoEntity draft = new RepoEntity();
            draft.setId(repo == null ? null : repo.getId());
            draft.setProjectId(projectId);
            draft.setOriginUrl(request.getRepoOrigin().trim());
            draft.setCanonicalOrigin(canonical);
            draft.setName(repoOriginDomainService.extractRepoName(canonical));
            return repoRepository.ensure(draft);
        }
        RepoEntity repo = repoRepository.findById(workspace.getRepoId());
        if (repo == null || repo.isDeleted()) {
            throw AppException.notFound("Repo not found for workspace: " + workspace.getWorkspaceId());
        }
        return repo;
    }

    private SyncModeEnum resolveSyncMode(BdhSyncRequestDTO request) {
        if (StringUtils.isBlank(request.getSyncMode())) {
            return request.getChangedIssues() != null ? SyncModeEnum.INCREMENTAL : SyncModeEnum.FULL;
        }
        try {
            return SyncModeEnum.fromCode(request.getSyncMode().trim().toLowerCase());
        } catch (IllegalArgumentException ex) {
            throw AppException.illegalParameter("Invalid sync_mode: " + StringUtils.left(request.getSyncMode(), 32));
        }
    }

    private List<Map<String, Object>> resolveRecords(BdhSyncRequestDTO request, SyncModeEnum syncMode) {
        if (request.getIssues() != null) {
            return request.getIssues();
        }
        if (syncMode == SyncModeEnum.INCREMENTAL) {
            return jsonlPayloadParser.parse(StringUtils.defaultString(request.getChangedIssues(), request.getIssuesJsonl()));
        }
        return jsonlPayloadParser.parse(request.getIssuesJsonl());
    }

    /**
     * 仅对会读写他人认领的条目加锁；释放自身认领是单行删除，不需要条目锁。
     */
    private void lockArbitratedBeads(String projectId, WorkspaceEntity workspace,
                                     List<IncomingBead> incoming, List<String> deletedIds) {
        Set<String> lockKeys = new TreeSet<>(deletedIds);
        for (IncomingBead bead : incoming) {
            if (claimArbitrationDomainService.isClaimAttempt(bead, workspace)
                    || claimArbitrationDomainService.releasesAllClaims(bead.getIssue().getStatus())) {
                lockKeys.add(bead.getBeadId());
            }
        }
        for (String beadId : lockKeys) {
            beadClaimRepository.lockBead(projectId, beadId);
        }
    }

    private ClaimDecision arbitrate(WorkspaceEntity workspace, IncomingBead bead, Map<String, IncomingBead> batch) {
        String projectId = workspace.getProjectId();
        String beadId = bead.getBeadId();
        List<BeadClaimEntity> existing = beadClaimRepository.findByBead(projectId, beadId);
        Set<String> liveIds = existing.isEmpty()
                ? Set.of()
                : workspaceRepository.findLiveIds(existing.stream()
                .map(BeadClaimEntity::getWorkspaceId)
                .collect(Collectors.toList()));
        ClaimDecision decision = claimArbitrationDomainService.arbitrate(beadId,
                beadPayloadDomainService.resolveApex(bead, batch), workspace, bead.isCoordinated(), existing, liveIds);
        if (decision.isRejected()) {
            return decision;
        }
        for (BeadClaimEntity stale : decision.getStaleClaims()) {
            beadClaimRepository.deleteById(stale.getId());
            log.info("Stale claim replaced. projectId={}, beadId={}, staleWorkspaceId={}, workspaceId={}",
                    projectId, beadId, stale.getWorkspaceId(), workspace.getWorkspaceId());
        }
        if (decision.isNewClaim()) {
            BeadClaimEntity saved = beadClaimRepository.save(decision.getClaim());
            decision.setClaim(saved);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("bead_id", beadId);
            payload.put("alias", workspace.getAlias());
            payload.put("coordinated", saved.isCoordinated());
            projectEventPublisher.publishAfterCommit(EventTypeEnum.BEAD_CLAIMED, projectId, workspace.getWorkspaceId(), payload);
        }
        return decision;
    }

    private void recordRelease(SyncResult result, WorkspaceEntity workspace, String beadId) {
        result.getClaimDecisions().add(claimArbitrationDomainService.released(beadId));
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("bead_id", beadId);
        payload.put("alias", workspace.getAlias());
        projectEventPublisher.publishAfterCommit(EventTypeEnum.BEAD_RELEASED, workspace.getProjectId(),
                workspace.getWorkspaceId(), payload);
    }

    private void queueStatusChange(SyncResult result, WorkspaceEntity workspace, BeadStatusChange change) {
        String projectId = workspace.getProjectId();
        result.getStatusChanges().add(change);
        List<OutboxEntryEntity> entries = outboxDomainService.buildStatusChangeEntries(projectId, change,
                subscriptionRepository.findByBead(projectId, change.getBeadId()), workspace.getWorkspaceId());
        for (OutboxEntryEntity entry : entries) {
            outboxRepository.save(entry);
        }
        result.setNotificationsQueued(result.getNotificationsQueued() + entries.size());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("bead_id", change.getBeadId());
        payload.put("repo", change.getRepo());
        payload.put("branch", change.getBranch());
        payload.put("old_status", change.getOldStatus());
        payload.put("new_status", change.getNewStatus());
        payload.put("title", change.getTitle());
        projectEventPublisher.publishAfterCommit(EventTypeEnum.BEAD_STATUS_CHANGED, projectId,
                workspace.getWorkspaceId(), payload);
    }

    /**
     * 同步结果及提交后刷新在线状态所需的上下文。
     */
    public record SyncOutcome(WorkspaceEntity workspace, SyncResult result, String branch, String currentBead) {
    }
}
