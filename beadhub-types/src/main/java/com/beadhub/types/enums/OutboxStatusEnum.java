package com.beadhub.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 通知发件箱条目状态枚举
 *
 * @author beadhub
 * @since 2026-01-12
 */
public enum OutboxStatusEnum {

    /**
     * 待投递 - 包含等待退避重试的条目
     */
    PENDING("pending"),

    /**
     * 已投递 - 已交付邮件原语
     */
    DELIVERED("delivered"),

    /**
     * 永久失败 - 超过重试预算，等待运维处理
     */
    FAILED("failed");

    private final String code;

    OutboxStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static OutboxStatusEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (OutboxStatusEnum value : OutboxStatusEnum.values()) {
            if (value.code.equals(code)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown outbox status code: " + code);
    }
}
