package com.beadhub.trigger.application.query;

import com.beadhub.api.dto.OutboxEntryDTO;
import com.beadhub.api.dto.OutboxListResponseDTO;
import com.beadhub.domain.notification.adapter.repository.IOutboxRepository;
import com.beadhub.domain.notification.model.entity.OutboxEntryEntity;
import com.beadhub.trigger.application.common.CoordinationViewAssembler;
import com.beadhub.trigger.application.common.PageCursorCodec;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 发件箱读用例：供运维查看永久失败的条目。
 */
@Service
public class OutboxQueryService {

    private final IOutboxRepository outboxRepository;
    private final PageCursorCodec pageCursorCodec;
    private final CoordinationViewAssembler coordinationViewAssembler;

    public OutboxQueryService(IOutboxRepository outboxRepository,
                              PageCursorCodec pageCursorCodec,
                              CoordinationViewAssembler coordinationViewAssembler) {
        this.outboxRepository = outboxRepository;
        this.pageCursorCodec = pageCursorCodec;
        this.coordinationViewAssembler = coordinationViewAssembler;
    }

    public OutboxListResponseDTO listFailed(String projectId, Integer limit) {
        List<OutboxEntryDTO> entries = new ArrayList<>();
        for (OutboxEntryEntity entry : outboxRepository.findFailed(projectId, pageCursorCodec.normalizeLimit(limit))) {
            entries.add(coordinationViewAssembler.toOutboxEntryDTO(entry));
        }
        OutboxListResponseDTO response = new OutboxListResponseDTO();
        response.setEntries(entries);
        return response;
    }
}
