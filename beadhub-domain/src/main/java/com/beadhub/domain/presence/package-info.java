/**
 * Presence 领域 - 在线状态与项目事件
 *
 * <p>职责：工作区在线记录（带 TTL 的缓存主记录与二级索引）、项目事件广播</p>
 *
 * <p>在线状态只用于可见性，不参与任何正确性判断；缓存丢失时在线状态归零即为正确状态。
 * 事件广播为发后即忘，错过的订阅者在下一次轮询或心跳时恢复。</p>
 *
 * @author beadhub
 * @since 2026-01-12
 */
package com.beadhub.domain.presence;
