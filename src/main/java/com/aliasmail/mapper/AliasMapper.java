package com.aliasmail.mapper;

import com.aliasmail.domain.Alias;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.Instant;

@Mapper
public interface AliasMapper {

    /** Non-deleted alias for (domain, local part) that has not expired at {@code now} */
    Alias findActive(@Param("domainId") Long domainId,
                     @Param("localPart") String localPart,
                     @Param("now") Instant now);
}
