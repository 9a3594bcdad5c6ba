package com.beadhub.types.enums;

import lombok.Getter;

/**
 * 统一响应码枚举。
 * <p>
 * 定义系统中所有API响应的响应码、描述信息以及对应的 HTTP 状态码。
 * </p>
 *
 * @author beadhub
 * @since 2026-01-12
 */
@Getter
public enum ResponseCode {

    /** 成功 */
    SUCCESS("0000", "成功", 200),

    /** 未知错误 */
    UN_ERROR("0001", "未知失败", 500),

    /** 非法参数（载荷格式错误、未知作用域） */
    ILLEGAL_PARAMETER("0002", "非法参数", 422),

    /** 未认证 */
    UNAUTHENTICATED("0003", "未认证", 401),

    /** 无权限（身份绑定不匹配、公开只读访问者尝试写入） */
    FORBIDDEN("0004", "无权限", 403),

    /** 资源不存在 */
    NOT_FOUND("0005", "资源不存在", 404),

    /** 冲突（认领被占用、策略基线版本过期、重复订阅） */
    CONFLICT("0006", "冲突", 409),

    /** 工作区已删除 */
    GONE("0007", "资源已删除", 410),

    /** 请求过于频繁 */
    RATE_LIMITED("0008", "请求过于频繁", 429),

    /** 事务失败，可重试 */
    TRANSACTION_FAILED("0009", "事务失败，请重试", 503);

    private final String code;
    private final String info;
    private final int httpStatus;

    ResponseCode(String code, String info, int httpStatus) {
        this.code = code;
        this.info = info;
        this.httpStatus = httpStatus;
    }

    public static ResponseCode fromCode(String code) {
        if (code == null) {
            return UN_ERROR;
        }
        for (ResponseCode value : values()) {
            if (value.code.equals(code)) {
                return value;
            }
        }
        return UN_ERROR;
    }

}
