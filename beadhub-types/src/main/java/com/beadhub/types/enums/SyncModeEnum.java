package com.beadhub.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 同步模式枚举
 *
 * @author beadhub
 * @since 2026-01-12
 */
public enum SyncModeEnum {

    /**
     * 全量 - 完整条目列表，仅显式删除生效
     */
    FULL("full"),

    /**
     * 增量 - 变更条目加删除列表
     */
    INCREMENTAL("incremental");

    private final String code;

    SyncModeEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static SyncModeEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (SyncModeEnum value : SyncModeEnum.values()) {
            if (value.code.equals(code)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown sync mode code: " + code);
    }
}
