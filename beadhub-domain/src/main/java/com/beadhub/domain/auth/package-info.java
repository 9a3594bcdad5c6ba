/**
 * Auth 领域 - 信任边界
 *
 * <p>职责：把入站请求解析为 (project_id, actor_id, principal_kind) 身份三元组，并执行身份绑定</p>
 *
 * <ul>
 *   <li>直连模式：Bearer API Key 经由身份分区访问器校验</li>
 *   <li>代理模式：配置共享密钥后，校验 X-BH-Auth HMAC 签名头</li>
 * </ul>
 *
 * @author beadhub
 * @since 2026-01-12
 */
package com.beadhub.domain.auth;
