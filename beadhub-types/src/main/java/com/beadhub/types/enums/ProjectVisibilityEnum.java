package com.beadhub.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 项目可见性枚举
 *
 * @author beadhub
 * @since 2026-01-12
 */
public enum ProjectVisibilityEnum {

    /**
     * 私有 - 仅认证主体可访问
     */
    PRIVATE("private"),

    /**
     * 公开 - 允许公开只读访问者读取（脱敏）
     */
    PUBLIC("public");

    private final String code;

    ProjectVisibilityEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static ProjectVisibilityEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (ProjectVisibilityEnum value : ProjectVisibilityEnum.values()) {
            if (value.code.equals(code)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown project visibility code: " + code);
    }
}
