package com.beadhub.trigger.application.query;

import com.beadhub.api.dto.SubscriptionDTO;
import com.beadhub.api.dto.SubscriptionListResponseDTO;
import com.beadhub.domain.auth.model.valobj.AuthIdentity;
import com.beadhub.domain.notification.adapter.repository.ISubscriptionRepository;
import com.beadhub.domain.notification.model.entity.SubscriptionEntity;
import com.beadhub.trigger.application.common.CoordinationViewAssembler;
import com.beadhub.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 订阅读用例。
 */
@Service
public class SubscriptionQueryService {

    private final ISubscriptionRepository subscriptionRepository;
    private final CoordinationViewAssembler coordinationViewAssembler;

    public SubscriptionQueryService(ISubscriptionRepository subscriptionRepository,
                                    CoordinationViewAssembler coordinationViewAssembler) {
        this.subscriptionRepository = subscriptionRepository;
        this.coordinationViewAssembler = coordinationViewAssembler;
    }

    public SubscriptionListResponseDTO list(AuthIdentity identity, String workspaceId) {
        String target = StringUtils.defaultIfBlank(StringUtils.trimToNull(workspaceId), identity.getActorId());
        if (StringUtils.isBlank(target)) {
            throw AppException.illegalParameter("workspace_id is required");
        }
        List<SubscriptionDTO> subscriptions = new ArrayList<>();
        for (SubscriptionEntity subscription : subscriptionRepository.findByWorkspace(identity.getProjectId(), target)) {
            subscriptions.add(coordinationViewAssembler.toSubscriptionDTO(subscription));
        }
        SubscriptionListResponseDTO response = new SubscriptionListResponseDTO();
        response.setSubscriptions(subscriptions);
        return response;
    }
}
