package com.beadhub.types.common;

/**
 * 全局常量定义类。
 *
 * @author beadhub
 * @since 2026-01-12
 */
public class Constants {

    /** 逗号分隔符，用于字符串分割操作 */
    public final static String SPLIT = ",";

    /** 未指定仓库时的默认仓库名 */
    public final static String DEFAULT_REPO = "default";

    /** 未指定分支时的默认分支名 */
    public final static String DEFAULT_BRANCH = "main";

    /** 待处理状态 */
    public final static String STATUS_OPEN = "open";

    /** 认领状态 */
    public final static String STATUS_IN_PROGRESS = "in_progress";

    /** 关闭状态 */
    public final static String STATUS_CLOSED = "closed";

    /** API Key 前缀 */
    public final static String API_KEY_PREFIX = "aw_sk_";

}
