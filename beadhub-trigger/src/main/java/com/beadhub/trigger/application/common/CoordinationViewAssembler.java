package com.beadhub.trigger.application.common;

import com.beadhub.api.dto.BeadIssueDTO;
import com.beadhub.api.dto.BeadRefDTO;
import com.beadhub.api.dto.ClaimChangeDTO;
import com.beadhub.api.dto.ClaimDTO;
import com.beadhub.api.dto.EscalationDTO;
import com.beadhub.api.dto.InvariantDTO;
import com.beadhub.api.dto.OutboxEntryDTO;
import com.beadhub.api.dto.PolicyBundleDTO;
import com.beadhub.api.dto.PolicyDTO;
import com.beadhub.api.dto.PolicyHistoryItemDTO;
import com.beadhub.api.dto.RolePlaybookDTO;
import com.beadhub.api.dto.SubscriptionDTO;
import com.beadhub.api.dto.WorkspaceDTO;
import com.beadhub.domain.bead.model.entity.BeadClaimEntity;
import com.beadhub.domain.bead.model.entity.BeadIssueEntity;
import com.beadhub.domain.bead.model.valobj.BeadRef;
import com.beadhub.domain.bead.model.valobj.ClaimDecision;
import com.beadhub.domain.escalation.model.entity.EscalationEntity;
import com.beadhub.domain.notification.model.entity.OutboxEntryEntity;
import com.beadhub.domain.notification.model.entity.SubscriptionEntity;
import com.beadhub.domain.policy.model.entity.PolicyEntity;
import com.beadhub.domain.policy.model.valobj.PolicyBundle;
import com.beadhub.domain.policy.model.valobj.PolicyInvariant;
import com.beadhub.domain.policy.model.valobj.RolePlaybook;
import com.beadhub.domain.presence.model.valobj.PresenceRecord;
import com.beadhub.domain.project.model.entity.WorkspaceEntity;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 协调视图装配器：实体到 DTO 的转换，公开只读访问者的个人字段脱敏在此统一处理。
 */
@Component
public class CoordinationViewAssembler {

    public String formatTime(LocalDateTime time) {
        if (time == null) {
            return null;
        }
        return time.atZone(ZoneId.systemDefault()).toOffsetDateTime().toString();
    }

    public BeadIssueDTO toBeadIssueDTO(BeadIssueEntity issue) {
        BeadIssueDTO dto = new BeadIssueDTO();
        dto.setBeadId(issue.getBeadId());
        dto.setRepo(issue.getRepo());
        dto.setBranch(issue.getBranch());
        dto.setTitle(issue.getTitle());
        dto.setDescription(issue.getDescription());
        dto.setStatus(issue.getStatus());
        dto.setPriority(issue.getPriority());
        dto.setIssueType(issue.getIssueType());
        dto.setAssignee(issue.getAssignee());
        dto.setLabels(issue.getLabels() == null ? new ArrayList<>() : new ArrayList<>(issue.getLabels()));
        List<BeadRefDTO> blockedBy = new ArrayList<>();
        if (issue.getBlockedBy() != null) {
            for (BeadRef ref : issue.getBlockedBy()) {
                blockedBy.add(toBeadRefDTO(ref));
            }
        }
        dto.setBlockedBy(blockedBy);
        dto.setParentId(issue.getParentId() == null ? null : toBeadRefDTO(issue.getParentId()));
        dto.setCreatedAt(formatTime(issue.getCreatedAt()));
        dto.setUpdatedAt(formatTime(issue.getUpdatedAt()));
        dto.setSyncedAt(formatTime(issue.getSyncedAt()));
        return dto;
    }

    private BeadRefDTO toBeadRefDTO(BeadRef ref) {
        BeadRefDTO dto = new BeadRefDTO();
        dto.setRepo(ref.getRepo());
        dto.setBranch(ref.getBranch());
        dto.setBeadId(ref.getBeadId());
        return dto;
    }

    public WorkspaceDTO toWorkspaceDTO(WorkspaceEntity workspace, PresenceRecord presence, boolean redact) {
        WorkspaceDTO dto = new WorkspaceDTO();
        dto.setWorkspaceId(workspace.getWorkspaceId());
        dto.setProjectId(workspace.getProjectId());
        dto.setRepoId(workspace.getRepoId());
        dto.setAlias(workspace.getAlias());
        dto.setRole(workspace.getRole());
        if (!redact) {
            dto.setHumanName(workspace.getHumanName());
            dto.setHostname(workspace.getHostname());
            dto.setWorkspacePath(workspace.getWorkspacePath());
        }
        dto.setOnline(presence != null);
        if (presence != null) {
            dto.setBranch(presence.getBranch());
            dto.setLastSeen(presence.getLastSeen());
        } else {
            dto.setLastSeen(formatTime(workspace.getLastSeenAt()));
        }
        dto.setCreatedAt(formatTime(workspace.getCreatedAt()));
        return dto;
    }

    /**
     * 仅有在线记录（数据库行已不可见或未加载）时的工作区视图。
     */
    public WorkspaceDTO toWorkspaceDTO(PresenceRecord presence, boolean redact) {
        WorkspaceDTO dto = new WorkspaceDTO();
        dto.setWorkspaceId(presence.getWorkspaceId());
        dto.setProjectId(presence.getProjectId());
        dto.setRepoId(presence.getRepoId());
        dto.setAlias(presence.getAlias());
        dto.setRole(presence.getRole());
        if (!redact) {
            dto.setHumanName(presence.getHumanName());
        }
        dto.setOnline(true);
        dto.setBranch(presence.getBranch());
        dto.setLastSeen(presence.getLastSeen());
        return dto;
    }

    public ClaimDTO toClaimDTO(BeadClaimEntity claim, boolean redact) {
        ClaimDTO dto = new ClaimDTO();
        dto.setBeadId(claim.getBeadId());
        dto.setApexBeadId(claim.getApexBeadId());
        dto.setWorkspaceId(claim.getWorkspaceId());
        dto.setAlias(claim.getAlias());
        dto.setHumanName(redact ? null : claim.getHumanName());
        dto.setCoordinated(claim.isCoordinated());
        dto.setClaimedAt(formatTime(claim.getClaimedAt()));
        return dto;
    }

    public List<ClaimDTO> toClaimDTOs(List<BeadClaimEntity> claims, boolean redact) {
        List<ClaimDTO> result = new ArrayList<>();
        if (claims == null) {
            return result;
        }
        for (BeadClaimEntity claim : claims) {
            result.add(toClaimDTO(claim, redact));
        }
        return result;
    }

    public ClaimChangeDTO toClaimChangeDTO(ClaimDecision decision) {
        ClaimChangeDTO dto = new ClaimChangeDTO();
        dto.setBeadId(decision.getBeadId());
        dto.setClaimed(decision.isClaimed());
        dto.setAction(decision.getAction() == null ? null : decision.getAction().getCode());
        BeadClaimEntity shown = decision.isRejected() ? decision.getHolder() : decision.getClaim();
        if (shown != null) {
            dto.setHeldBy(shown.getAlias());
            dto.setHeldByWorkspaceId(shown.getWorkspaceId());
            dto.setHeldByHumanName(shown.getHumanName());
            dto.setClaimedAt(formatTime(shown.getClaimedAt()));
        }
        return dto;
    }

    public EscalationDTO toEscalationDTO(EscalationEntity escalation, boolean redact) {
        EscalationDTO dto = new EscalationDTO();
        dto.setEscalationId(escalation.getId());
        dto.setProjectId(escalation.getProjectId());
        dto.setWorkspaceId(escalation.getWorkspaceId());
        dto.setAlias(escalation.getAlias());
        dto.setHumanName(redact ? null : escalation.getHumanName());
        dto.setSubject(escalation.getSubject());
        dto.setSituation(escalation.getSituation());
        dto.setOptions(escalation.getOptions() == null ? new ArrayList<>() : new ArrayList<>(escalation.getOptions()));
        dto.setStatus(escalation.getStatus() == null ? null : escalation.getStatus().getCode());
        dto.setResponse(escalation.getResponse());
        dto.setResponseNote(escalation.getResponseNote());
        dto.setCreatedAt(formatTime(escalation.getCreatedAt()));
        dto.setRespondedAt(formatTime(escalation.getRespondedAt()));
        dto.setExpiresAt(formatTime(escalation.getExpiresAt()));
        return dto;
    }

    public SubscriptionDTO toSubscriptionDTO(SubscriptionEntity subscription) {
        SubscriptionDTO dto = new SubscriptionDTO();
        dto.setSubscriptionId(subscription.getId());
        dto.setWorkspaceId(subscription.getWorkspaceId());
        dto.setAlias(subscription.getAlias());
        dto.setBeadId(subscription.getBeadId());
        dto.setRepo(subscription.getRepo());
        dto.setEventTypes(subscription.getEventTypes());
        dto.setCreatedAt(formatTime(subscription.getCreatedAt()));
        return dto;
    }

    public OutboxEntryDTO toOutboxEntryDTO(OutboxEntryEntity entry) {
        OutboxEntryDTO dto = new OutboxEntryDTO();
        dto.setEntryId(entry.getId());
        dto.setEventType(entry.getEventType());
        dto.setRecipientWorkspaceId(entry.getRecipientWorkspaceId());
        dto.setRecipientAlias(entry.getRecipientAlias());
        dto.setStatus(entry.getStatus() == null ? null : entry.getStatus().getCode());
        dto.setAttempts(entry.normalizedAttempts());
        dto.setLastError(entry.getLastError());
        dto.setNextAttemptAt(formatTime(entry.getNextAttemptAt()));
        dto.setPayload(entry.getPayload());
        dto.setCreatedAt(formatTime(entry.getCreatedAt()));
        dto.setProcessedAt(formatTime(entry.getProcessedAt()));
        return dto;
    }

    public PolicyDTO toPolicyDTO(PolicyEntity policy, PolicyBundle bundle, String activePolicyId, String selectedRole) {
        PolicyDTO dto = new PolicyDTO();
        dto.setPolicyId(policy.getPolicyId());
        dto.setProjectId(policy.getProjectId());
        dto.setVersion(policy.getVersion());
        dto.setIsActive(Objects.equals(policy.getPolicyId(), activePolicyId));
        dto.setBundle(toBundleDTO(bundle == null ? policy.getBundle() : bundle));
        dto.setSelectedRole(selectedRole);
        dto.setCreatedByWorkspaceId(policy.getCreatedByWorkspaceId());
        dto.setCreatedAt(formatTime(policy.getCreatedAt()));
        return dto;
    }

    public PolicyHistoryItemDTO toPolicyHistoryItemDTO(PolicyEntity policy, String activePolicyId) {
        PolicyHistoryItemDTO dto = new PolicyHistoryItemDTO();
        dto.setPolicyId(policy.getPolicyId());
        dto.setVersion(policy.getVersion());
        dto.setIsActive(Objects.equals(policy.getPolicyId(), activePolicyId));
        dto.setCreatedByWorkspaceId(policy.getCreatedByWorkspaceId());
        dto.setCreatedAt(formatTime(policy.getCreatedAt()));
        return dto;
    }

    public PolicyBundleDTO toBundleDTO(PolicyBundle bundle) {
        PolicyBundleDTO dto = new PolicyBundleDTO();
        List<InvariantDTO> invariants = new ArrayList<>();
        Map<String, RolePlaybookDTO> roles = new LinkedHashMap<>();
        if (bundle != null) {
            if (bundle.getInvariants() != null) {
                for (PolicyInvariant invariant : bundle.getInvariants()) {
                    InvariantDTO item = new InvariantDTO();
                    item.setId(invariant.getId());
                    item.setTitle(invariant.getTitle());
                    item.setBodyMd(invariant.getBodyMd());
                    invariants.add(item);
                }
            }
            if (bundle.getRoles() != null) {
                bundle.getRoles().forEach((id, role) -> {
                    RolePlaybookDTO item = new RolePlaybookDTO();
                    item.setTitle(role.getTitle());
                    item.setPlaybookMd(role.getPlaybookMd());
                    roles.put(id, item);
                });
            }
            dto.setAdapters(bundle.getAdapters() == null ? new LinkedHashMap<>() : bundle.getAdapters());
        } else {
            dto.setAdapters(new LinkedHashMap<>());
        }
        dto.setInvariants(invariants);
        dto.setRoles(roles);
        return dto;
    }

    public PolicyBundle toBundle(PolicyBundleDTO dto) {
        if (dto == null) {
            return null;
        }
        List<PolicyInvariant> invariants = new ArrayList<>();
        if (dto.getInvariants() != null) {
            for (InvariantDTO item : dto.getInvariants()) {
                invariants.add(item == null ? null : new PolicyInvariant(item.getId(), item.getTitle(), item.getBodyMd()));
            }
        }
        Map<String, RolePlaybook> roles = new LinkedHashMap<>();
        if (dto.getRoles() != null) {
            dto.getRoles().forEach((id, item) ->
                    roles.put(id, item == null ? null : new RolePlaybook(item.getTitle(), item.getPlaybookMd())));
        }
        Map<String, Object> adapters = dto.getAdapters() == null ? new LinkedHashMap<>() : new LinkedHashMap<>(dto.getAdapters());
        return new PolicyBundle(invariants, roles, adapters);
    }
}
