/**
 * Notification 领域 - 通知发件箱与订阅
 *
 * <p>职责：订阅登记、发件箱条目的事务内写入、至少一次投递的重试与退避决策、邮件渲染</p>
 *
 * <h3>核心实体</h3>
 * <ul>
 *   <li>Subscription - 工作区对某个条目的兴趣登记</li>
 *   <li>OutboxEntry - 待投递通知，pending → delivered | failed</li>
 * </ul>
 *
 * @author beadhub
 * @since 2026-01-12
 */
package com.beadhub.domain.notification;
