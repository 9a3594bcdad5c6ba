package com.beadhub.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 同步过程中的认领变更动作
 *
 * @author beadhub
 * @since 2026-01-12
 */
public enum ClaimActionEnum {

    /**
     * 新建认领
     */
    CLAIMED("claimed"),

    /**
     * 调用方已持有，保持不变
     */
    RETAINED("retained"),

    /**
     * 协同认领，与其他持有者共存
     */
    COORDINATED("coordinated"),

    /**
     * 被其他存活工作区持有，拒绝
     */
    REJECTED("rejected"),

    /**
     * 释放认领
     */
    RELEASED("released");

    private final String code;

    ClaimActionEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static ClaimActionEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (ClaimActionEnum value : ClaimActionEnum.values()) {
            if (value.code.equals(code)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown claim action code: " + code);
    }
}
