package com.aliasmail.mapper;

import com.aliasmail.domain.NotificationRecipient;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

@Mapper
public interface UserMapper {

    NotificationRecipient findNotificationRecipient(@Param("userId") Long userId);
}
