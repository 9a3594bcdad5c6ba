package com.beadhub.domain.auth.service;

import com.beadhub.types.enums.PrincipalKindEnum;
import com.google.common.hash.Hashing;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * 代理签名领域服务。
 * <p>
 * 签名头格式：{@code v2:{project_id}:{principal_type}:{principal_id}:{actor_id}:{hex_hmac}}，
 * HMAC-SHA256 覆盖除末尾签名段以外的完整字符串。公开只读访问者的 principal_id 与 actor_id 为空串。
 * </p>
 */
@Service
public class ProxySignatureDomainService {

    static final String VERSION = "v2";
    private static final int PARTS = 6;

    /**
     * 计算签名头完整值。
     */
    public String sign(String secret, String projectId, PrincipalKindEnum kind, String principalId, String actorId) {
        String canonical = canonical(projectId, kind.getSignatureCode(), principalId, actorId);
        return canonical + ":" + hmacHex(secret, canonical);
    }

    /**
     * 解析并校验签名头。签名无效、格式错误时返回 null。
     */
    public SignedClaims verify(String secret, String headerValue) {
        if (StringUtils.isAnyBlank(secret, headerValue)) {
            return null;
        }
        String[] parts = headerValue.trim().split(":", -1);
        if (parts.length != PARTS || !VERSION.equals(parts[0])) {
            return null;
        }
        PrincipalKindEnum kind = PrincipalKindEnum.fromSignatureCode(parts[2]);
        if (kind == null || StringUtils.isBlank(parts[1])) {
            return null;
        }
        String canonical = canonical(parts[1], parts[2], parts[3], parts[4]);
        String expected = hmacHex(secret, canonical);
        boolean matches = MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                parts[5].toLowerCase().getBytes(StandardCharsets.UTF_8));
        if (!matches) {
            return null;
        }
        return new SignedClaims(parts[1], kind, StringUtils.trimToNull(parts[3]), StringUtils.trimToNull(parts[4]));
    }

    private String canonical(String projectId, String kindCode, String principalId, String actorId) {
        return String.join(":", VERSION,
                StringUtils.defaultString(projectId),
                kindCode,
                StringUtils.defaultString(principalId),
                StringUtils.defaultString(actorId));
    }

    private String hmacHex(String secret, String message) {
        return Hashing.hmacSha256(secret.getBytes(StandardCharsets.UTF_8))
                .hashString(message, StandardCharsets.UTF_8)
                .toString();
    }

    /**
     * 签名中声明的身份。
     */
    public record SignedClaims(String projectId, PrincipalKindEnum kind, String principalId, String actorId) {
    }
}
