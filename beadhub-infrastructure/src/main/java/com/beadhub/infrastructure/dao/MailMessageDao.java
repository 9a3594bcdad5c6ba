package com.beadhub.infrastructure.dao;

import com.beadhub.infrastructure.dao.po.MailMessagePO;
import org.apache.ibatis.annotations.Mapper;

/**
 * 站内邮件 DAO，访问 aweb 邮件分区。
 */
@Mapper
public interface MailMessageDao {

    int insert(MailMessagePO po);
}
