package com.beadhub.domain.auth.model.valobj;

import com.beadhub.types.enums.PrincipalKindEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 已解析的调用方身份。
 *
 * @author beadhub
 * @since 2026-01-12
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuthIdentity {

    /**
     * 请求属性名，认证过滤器写入、控制器读取
     */
    public static final String REQUEST_ATTRIBUTE = "beadhub.authIdentity";

    /**
     * 项目 ID
     */
    private String projectId;

    /**
     * 行为主体 ID（Agent 工作区 ID）；公开只读访问者为空
     */
    private String actorId;

    private PrincipalKindEnum principalKind;

    /**
     * 主体 ID：用户 ID 或 API Key ID
     */
    private String principalId;

    public boolean isPublicReader() {
        return principalKind == PrincipalKindEnum.PUBLIC_READER;
    }
}
