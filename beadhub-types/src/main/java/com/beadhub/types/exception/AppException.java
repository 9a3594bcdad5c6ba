package com.beadhub.types.exception;

import com.beadhub.types.enums.ResponseCode;
import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * 应用自定义异常类。
 * <p>
 * 统一承载业务异常：异常码、异常描述，以及可选的结构化详情（如冲突时的当前持有者、当前策略版本），
 * 详情会原样放入响应体的 data 字段，调用方无需二次查询即可决定下一步动作。
 * </p>
 *
 * @author beadhub
 * @since 2026-01-12
 */
@EqualsAndHashCode(callSuper = true)
@Data
public class AppException extends RuntimeException {

    private static final long serialVersionUID = 5317680961212299217L;

    /** 异常码 */
    private String code;

    /** 异常信息 */
    private String info;

    /** 结构化详情 */
    private transient Object detail;

    /**
     * 创建包含异常码的 AppException。
     *
     * @param code 异常码
     */
    public AppException(String code) {
        super(code);
        this.code = code;
        this.info = code;
    }

    /**
     * 创建包含异常码和原因的 AppException。
     *
     * @param code 异常码
     * @param cause 异常原因
     */
    public AppException(String code, Throwable cause) {
        super(cause == null ? null : cause.getMessage(), cause);
        this.code = code;
        this.info = cause == null ? null : cause.getMessage();
    }

    /**
     * 创建包含异常码和描述信息的 AppException。
     *
     * @param code 异常码
     * @param message 异常描述信息
     */
    public AppException(String code, String message) {
        super(message);
        this.code = code;
        this.info = message;
    }

    /**
     * 创建包含异常码、描述信息和原因的 AppException。
     *
     * @param code 异常码
     * @param message 异常描述信息
     * @param cause 异常原因
     */
    public AppException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.info = message;
    }

    /**
     * 创建携带结构化详情的 AppException。
     *
     * @param responseCode 响应码
     * @param message 异常描述信息
     * @param detail 结构化详情
     */
    public AppException(ResponseCode responseCode, String message, Object detail) {
        this(responseCode.getCode(), message);
        this.detail = detail;
    }

    public AppException(ResponseCode responseCode, String message) {
        this(responseCode.getCode(), message);
    }

    public static AppException unauthenticated(String message) {
        return new AppException(ResponseCode.UNAUTHENTICATED, message);
    }

    public static AppException forbidden(String message) {
        return new AppException(ResponseCode.FORBIDDEN, message);
    }

    public static AppException notFound(String message) {
        return new AppException(ResponseCode.NOT_FOUND, message);
    }

    public static AppException conflict(String message, Object detail) {
        return new AppException(ResponseCode.CONFLICT, message, detail);
    }

    public static AppException illegalParameter(String message) {
        return new AppException(ResponseCode.ILLEGAL_PARAMETER, message);
    }

    @Override
    public String getMessage() {
        return info != null ? info : super.getMessage();
    }

    /**
     * 将异常转换为字符串表示。
     *
     * @return 包含异常码和描述信息的字符串
     */
    @Override
    public String toString() {
        return "com.beadhub.types.exception.AppException{" +
                "code='" + code + '\'' +
                ", info='" + info + '\'' +
                '}';
    }

}
