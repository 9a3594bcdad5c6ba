package com.beadhub.domain.notification.adapter.gateway;

import com.beadhub.domain.notification.model.valobj.MailMessage;

/**
 * 邮件原语访问器（身份分区提供）。
 *
 * @author beadhub
 * @since 2026-01-12
 */
public interface IMailGateway {

    /**
     * 投递消息，成功返回消息 ID；失败抛出异常。
     */
    String deliver(MailMessage message);
}
