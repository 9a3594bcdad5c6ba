package com.beadhub.trigger.application.command;

import com.beadhub.api.dto.SubscriptionCreateRequestDTO;
import com.beadhub.domain.auth.model.valobj.AuthIdentity;
import com.beadhub.domain.bead.service.BeadPayloadDomainService;
import com.beadhub.domain.notification.adapter.repository.ISubscriptionRepository;
import com.beadhub.domain.notification.model.entity.SubscriptionEntity;
import com.beadhub.domain.project.model.entity.WorkspaceEntity;
import com.beadhub.domain.project.service.RepoOriginDomainService;
import com.beadhub.trigger.application.common.WorkspaceGuard;
import com.beadhub.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 订阅写用例。
 */
@Slf4j
@Service
public class SubscriptionCommandService {

    static final Set<String> SUPPORTED_EVENT_TYPES = Set.of(SubscriptionEntity.EVENT_STATUS_CHANGE);

    private final WorkspaceGuard workspaceGuard;
    private final ISubscriptionRepository subscriptionRepository;
    private final BeadPayloadDomainService beadPayloadDomainService;
    private final RepoOriginDomainService repoOriginDomainService;

    public SubscriptionCommandService(WorkspaceGuard workspaceGuard,
                                      ISubscriptionRepository subscriptionRepository,
                                      BeadPayloadDomainService beadPayloadDomainService,
                                      RepoOriginDomainService repoOriginDomainService) {
        this.workspaceGuard = workspaceGuard;
        this.subscriptionRepository = subscriptionRepository;
        this.beadPayloadDomainService = beadPayloadDomainService;
        this.repoOriginDomainService = repoOriginDomainService;
    }

    @Transactional(rollbackFor = Exception.class)
    public SubscriptionEntity subscribe(AuthIdentity identity, SubscriptionCreateRequestDTO request) {
        if (request == null) {
            throw AppException.illegalParameter("Request body is required");
        }
        WorkspaceEntity workspace = workspaceGuard.requireActingWorkspace(identity, request.getWorkspaceId());
        String beadId = StringUtils.trimToNull(request.getBeadId());
        if (!beadPayloadDomainService.isValidBeadId(beadId)) {
            throw AppException.illegalParameter("Invalid bead_id");
        }
        String repo = normalizeRepo(request.getRepo());
        List<String> eventTypes = normalizeEventTypes(request.getEventTypes());

        SubscriptionEntity existing = subscriptionRepository.findExisting(workspace.getProjectId(),
                workspace.getWorkspaceId(), beadId, repo);
        if (existing != null) {
            Map<String, Object> detail = new LinkedHashMap<>();
            detail.put("subscription_id", existing.getId());
            throw AppException.conflict("Subscription already exists", detail);
        }
        SubscriptionEntity subscription = new SubscriptionEntity();
        subscription.setProjectId(workspace.getProjectId());
        subscription.setWorkspaceId(workspace.getWorkspaceId());
        subscription.setAlias(workspace.getAlias());
        subscription.setBeadId(beadId);
        subscription.setRepo(repo);
        subscription.setEventTypes(eventTypes);
        subscription.setCreatedAt(LocalDateTime.now());
        SubscriptionEntity saved = subscriptionRepository.save(subscription);
        log.info("Subscription created. projectId={}, workspaceId={}, beadId={}, repo={}",
                saved.getProjectId(), saved.getWorkspaceId(), beadId, repo);
        return saved;
    }

    @Transactional(rollbackFor = Exception.class)
    public void unsubscribe(AuthIdentity identity, String workspaceId, String subscriptionId) {
        WorkspaceEntity workspace = workspaceGuard.requireActingWorkspace(identity, workspaceId);
        SubscriptionEntity subscription = subscriptionRepository.findById(workspace.getProjectId(), subscriptionId);
        if (subscription == null || !StringUtils.equals(subscription.getWorkspaceId(), workspace.getWorkspaceId())) {
            throw AppException.notFound("Subscription not found: " + subscriptionId);
        }
        subscriptionRepository.deleteById(workspace.getProjectId(), subscriptionId);
    }

    private String normalizeRepo(String repo) {
        if (StringUtils.isBlank(repo)) {
            return null;
        }
        try {
            return repoOriginDomainService.canonicalize(repo);
        } catch (IllegalArgumentException ex) {
            throw AppException.illegalParameter("Invalid repo: " + StringUtils.left(repo, 100));
        }
    }

    private List<String> normalizeEventTypes(List<String> eventTypes) {
        if (eventTypes == null || eventTypes.isEmpty()) {
            return new ArrayList<>(List.of(SubscriptionEntity.EVENT_STATUS_CHANGE));
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (String eventType : eventTypes) {
            String value = StringUtils.trimToEmpty(eventType);
            if (!SUPPORTED_EVENT_TYPES.contains(value)) {
                throw AppException.illegalParameter("Unsupported event type: " + StringUtils.left(value, 50));
            }
            normalized.add(value);
        }
        return new ArrayList<>(normalized);
    }
}
