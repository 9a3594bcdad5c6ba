package com.beadhub.domain.escalation.service;

import com.beadhub.domain.escalation.model.entity.EscalationEntity;
import com.beadhub.domain.project.model.entity.WorkspaceEntity;
import com.beadhub.types.enums.EscalationStatusEnum;
import com.beadhub.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 升级请求领域服务：创建校验、状态过滤参数解析、响应转换。
 */
@Service
public class EscalationDomainService {

    private static final int MAX_SUBJECT_LENGTH = 200;
    private static final int MAX_SITUATION_LENGTH = 10_000;
    private static final int MAX_OPTIONS = 20;

    private final long defaultExpirySeconds;
    private final long maxExpirySeconds;

    public EscalationDomainService(@Value("${beadhub.escalation.default-expiry-seconds:86400}") long defaultExpirySeconds,
                                   @Value("${beadhub.escalation.max-expiry-seconds:604800}") long maxExpirySeconds) {
        this.defaultExpirySeconds = defaultExpirySeconds;
        this.maxExpirySeconds = maxExpirySeconds;
    }

    public EscalationEntity create(WorkspaceEntity raiser, String subject, String situation,
                                   List<String> options, Long expiresInSeconds) {
        if (StringUtils.isBlank(subject) || subject.length() > MAX_SUBJECT_LENGTH) {
            throw AppException.illegalParameter("subject must be 1-" + MAX_SUBJECT_LENGTH + " characters");
        }
        if (situation != null && situation.length() > MAX_SITUATION_LENGTH) {
            throw AppException.illegalParameter("situation is too long");
        }
        List<String> normalizedOptions = new ArrayList<>();
        if (options != null) {
            if (options.size() > MAX_OPTIONS) {
                throw AppException.illegalParameter("Too many options");
            }
            for (String option : options) {
                if (StringUtils.isNotBlank(option)) {
                    normalizedOptions.add(option.trim());
                }
            }
        }
        long expiry = expiresInSeconds == null ? defaultExpirySeconds : expiresInSeconds;
        if (expiry <= 0 || expiry > maxExpirySeconds) {
            throw AppException.illegalParameter("expires_in_seconds must be between 1 and " + maxExpirySeconds);
        }

        LocalDateTime now = LocalDateTime.now();
        EscalationEntity entity = new EscalationEntity();
        entity.setProjectId(raiser.getProjectId());
        entity.setWorkspaceId(raiser.getWorkspaceId());
        entity.setAlias(raiser.getAlias());
        entity.setHumanName(raiser.getHumanName());
        entity.setSubject(subject.trim());
        entity.setSituation(situation);
        entity.setOptions(normalizedOptions);
        entity.setStatus(EscalationStatusEnum.PENDING);
        entity.setCreatedAt(now);
        entity.setExpiresAt(now.plusSeconds(expiry));
        return entity;
    }

    /**
     * 解析状态过滤参数，非法值抛出校验异常。
     */
    public EscalationStatusEnum parseStatusFilter(String status) {
        if (StringUtils.isBlank(status)) {
            return null;
        }
        try {
            return EscalationStatusEnum.fromCode(status.trim().toLowerCase());
        } catch (IllegalArgumentException ex) {
            throw AppException.illegalParameter("Invalid status filter: " + status);
        }
    }

    /**
     * 响应一个升级请求；已到期或已处于终态时返回冲突。
     */
    public void respond(EscalationEntity escalation, String response, String note, LocalDateTime now) {
        if (StringUtils.isBlank(response)) {
            throw AppException.illegalParameter("response is required");
        }
        if (escalation.isExpiredAt(now)) {
            escalation.expire();
        }
        if (escalation.isTerminal()) {
            Map<String, Object> detail = new LinkedHashMap<>();
            detail.put("escalation_id", escalation.getId());
            detail.put("status", escalation.getStatus().getCode());
            throw AppException.conflict("Escalation is already " + escalation.getStatus().getCode(), detail);
        }
        escalation.respond(response.trim(), note);
    }
}
