package com.beadhub.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 升级请求状态枚举，终态不可变
 *
 * @author beadhub
 * @since 2026-01-12
 */
public enum EscalationStatusEnum {

    /**
     * 待响应
     */
    PENDING("pending"),

    /**
     * 已响应（终态）
     */
    RESPONDED("responded"),

    /**
     * 已过期（终态）
     */
    EXPIRED("expired");

    private final String code;

    EscalationStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static EscalationStatusEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (EscalationStatusEnum value : EscalationStatusEnum.values()) {
            if (value.code.equals(code)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown escalation status code: " + code);
    }
}
