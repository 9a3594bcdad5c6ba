/**
 * Policy 领域 - 版本化策略
 *
 * <p>职责：项目级策略包（不变量文档 + 角色手册 + 适配器配置）的版本分配、乐观并发激活与默认引导</p>
 *
 * <ul>
 *   <li>版本号在项目行排他锁下分配，单调递增、永不复用</li>
 *   <li>激活只切换项目上的 active_policy_id，历史版本全部保留</li>
 * </ul>
 *
 * @author beadhub
 * @since 2026-01-12
 */
package com.beadhub.domain.policy;
