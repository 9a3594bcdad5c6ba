/**
 * Bead 领域 - 工作条目同步与认领
 *
 * <p>职责：客户端推送的工作条目镜像、认领仲裁、状态变化检测</p>
 *
 * <p>服务端不是条目内容的权威来源，只对镜像存储与认领簿记负责。
 * 认领默认至多一个活跃持有者；协同认领需要服务端开关与条目标记同时成立。</p>
 *
 * @author beadhub
 * @since 2026-01-12
 */
package com.beadhub.domain.bead;
