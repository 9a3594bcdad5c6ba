package com.beadhub.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 调用主体类别枚举。
 * <p>
 * signatureCode 为代理签名头 X-BH-Auth 中的单字母类别标识。
 * </p>
 *
 * @author beadhub
 * @since 2026-01-12
 */
public enum PrincipalKindEnum {

    /** 已认证的人类用户（经由代理） */
    USER("user", "u"),

    /** 已认证的 API Key（直连或经由代理） */
    API_KEY("api_key", "k"),

    /** 公开只读访问者，所有个人身份字段脱敏 */
    PUBLIC_READER("public_reader", "p");

    private final String code;
    private final String signatureCode;

    PrincipalKindEnum(String code, String signatureCode) {
        this.code = code;
        this.signatureCode = signatureCode;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getSignatureCode() {
        return signatureCode;
    }

    public boolean isReadOnly() {
        return this == PUBLIC_READER;
    }

    public static PrincipalKindEnum fromSignatureCode(String signatureCode) {
        if (signatureCode == null) {
            return null;
        }
        for (PrincipalKindEnum value : values()) {
            if (value.signatureCode.equals(signatureCode)) {
                return value;
            }
        }
        return null;
    }
}
