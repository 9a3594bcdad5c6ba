package com.beadhub.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 项目事件类型枚举（category.action）。
 * <p>
 * 已知事件为封闭集合，无法识别的事件统一归入 {@link #UNKNOWN}，原始载荷保留在事件体中。
 * </p>
 *
 * @author beadhub
 * @since 2026-01-12
 */
public enum EventTypeEnum {

    BEAD_STATUS_CHANGED("bead.status_changed"),
    BEAD_CLAIMED("claim.acquired"),
    BEAD_RELEASED("claim.released"),
    PRESENCE_UPDATED("presence.updated"),
    ESCALATION_CREATED("escalation.created"),
    ESCALATION_RESPONDED("escalation.responded"),
    ESCALATION_EXPIRED("escalation.expired"),
    POLICY_ACTIVATED("policy.activated"),
    UNKNOWN("unknown");

    private final String code;

    EventTypeEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * 事件类别，即 code 中第一个点号之前的部分。
     */
    public String getCategory() {
        int idx = code.indexOf('.');
        return idx < 0 ? code : code.substring(0, idx);
    }

    public static EventTypeEnum fromCode(String code) {
        if (code == null) {
            return UNKNOWN;
        }
        for (EventTypeEnum value : values()) {
            if (value.code.equals(code)) {
                return value;
            }
        }
        return UNKNOWN;
    }
}
