package com.aliasmail.mapper;

import com.aliasmail.domain.ForwardingRule;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface ForwardingRuleMapper {

    /** Active rules of an alias, ascending priority */
    List<ForwardingRule> findActiveByAliasId(@Param("aliasId") Long aliasId);

    int incrementMatchCount(@Param("id") Long id);
}
