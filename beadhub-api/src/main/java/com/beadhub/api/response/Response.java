package com.beadhub.api.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * 统一响应结果封装类。
 * <p>
 * 封装所有API接口的响应结果，包含响应码、响应描述和响应数据。
 * 冲突类错误的结构化详情（当前持有者、当前策略版本）同样放在 data 中。
 * </p>
 *
 * @param <T> 响应数据的类型
 * @author beadhub
 * @since 2026-01-12
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Response<T> implements Serializable {

    private static final long serialVersionUID = 7000723935764546321L;

    /** 响应码，成功为"0000" */
    private String code;

    /** 响应描述信息 */
    private String info;

    /** 响应数据，泛型类型 */
    private T data;

}
