package com.beadhub.infrastructure.dao;

import com.beadhub.infrastructure.dao.po.ApiKeyPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

/**
 * API Key DAO，访问 aweb 身份分区。
 */
@Mapper
public interface ApiKeyDao {

    int insert(ApiKeyPO po);

    ApiKeyPO selectByHash(@Param("keyHash") String keyHash);

    ApiKeyPO selectById(@Param("id") String id);
}
