/**
 * Project 领域 - 租户与工作区域
 *
 * <p>职责：项目（租户边界）、仓库、工作区的身份与生命周期管理</p>
 *
 * <h3>核心实体</h3>
 * <ul>
 *   <li>Project - 租户边界，其他所有实体按 project_id 过滤</li>
 *   <li>Repo - 被跟踪的源码仓库，canonical_origin 在项目内唯一</li>
 *   <li>Workspace - 单个 Agent 的工作上下文，别名在项目内未删除工作区中唯一</li>
 * </ul>
 *
 * <h3>领域服务</h3>
 * <ul>
 *   <li>RepoOriginDomainService - git origin 规范化</li>
 *   <li>WorkspaceNamingDomainService - 别名 / 人名 / 角色校验与别名建议</li>
 * </ul>
 *
 * @author beadhub
 * @since 2026-01-12
 */
package com.beadhub.domain.project;
