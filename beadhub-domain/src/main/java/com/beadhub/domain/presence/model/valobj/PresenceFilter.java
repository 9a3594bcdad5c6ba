package com.beadhub.domain.presence.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 在线状态查询条件，projectId 必填；alias 优先于 repo / branch。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PresenceFilter {

    private String projectId;

    private String repoId;

    private String branch;

    private String alias;
}
