/**
 * Escalation 领域 - 人工介入请求
 *
 * @author beadhub
 * @since 2026-01-12
 */
package com.beadhub.domain.escalation;
