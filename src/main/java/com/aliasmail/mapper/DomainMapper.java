package com.aliasmail.mapper;

import com.aliasmail.domain.Domain;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

@Mapper
public interface DomainMapper {

    /** Non-deleted domain by lower-cased name */
    Domain findActiveByName(@Param("name") String name);
}
