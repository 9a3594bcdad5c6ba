package com.beadhub.trigger.application.query;

import com.beadhub.api.dto.EscalationDTO;
import com.beadhub.api.dto.EscalationListResponseDTO;
import com.beadhub.domain.auth.model.valobj.AuthIdentity;
import com.beadhub.domain.escalation.adapter.repository.IEscalationRepository;
import com.beadhub.domain.escalation.model.entity.EscalationEntity;
import com.beadhub.domain.escalation.service.EscalationDomainService;
import com.beadhub.trigger.application.common.CoordinationViewAssembler;
import com.beadhub.trigger.application.common.PageCursorCodec;
import com.beadhub.types.enums.EscalationStatusEnum;
import com.beadhub.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 升级请求读用例，按创建时间倒序分页。
 */
@Service
public class EscalationQueryService {

    private final IEscalationRepository escalationRepository;
    private final EscalationDomainService escalationDomainService;
    private final PageCursorCodec pageCursorCodec;
    private final CoordinationViewAssembler coordinationViewAssembler;

    public EscalationQueryService(IEscalationRepository escalationRepository,
                                  EscalationDomainService escalationDomainService,
                                  PageCursorCodec pageCursorCodec,
                                  CoordinationViewAssembler coordinationViewAssembler) {
        this.escalationRepository = escalationRepository;
        this.escalationDomainService = escalationDomainService;
        this.pageCursorCodec = pageCursorCodec;
        this.coordinationViewAssembler = coordinationViewAssembler;
    }

    public EscalationListResponseDTO list(AuthIdentity identity, String status, String workspaceId,
                                          Integer limit, String cursor) {
        EscalationStatusEnum statusFilter = escalationDomainService.parseStatusFilter(status);
        int pageSize = pageCursorCodec.normalizeLimit(limit);
        PageCursorCodec.PageCursor before = pageCursorCodec.decode(cursor);
        List<EscalationEntity> rows = escalationRepository.findPage(identity.getProjectId(), statusFilter,
                StringUtils.trimToNull(workspaceId),
                before == null ? null : before.createdAt(),
                before == null ? null : before.id(),
                pageSize + 1);
        boolean hasMore = rows.size() > pageSize;
        List<EscalationEntity> page = hasMore ? rows.subList(0, pageSize) : rows;

        List<EscalationDTO> escalations = new ArrayList<>();
        for (EscalationEntity escalation : page) {
            escalations.add(coordinationViewAssembler.toEscalationDTO(escalation, identity.isPublicReader()));
        }
        EscalationListResponseDTO response = new EscalationListResponseDTO();
        response.setEscalations(escalations);
        response.setHasMore(hasMore);
        if (hasMore) {
            EscalationEntity last = page.get(page.size() - 1);
            response.setNextCursor(pageCursorCodec.encode(last.getCreatedAt(), last.getId()));
        }
        return response;
    }

    public EscalationDTO get(AuthIdentity identity, String escalationId) {
        EscalationEntity escalation = escalationRepository.findById(identity.getProjectId(), escalationId);
        if (escalation == null) {
            throw AppException.notFound("Escalation not found: " + escalationId);
        }
        return coordinationViewAssembler.toEscalationDTO(escalation, identity.isPublicReader());
    }
}
