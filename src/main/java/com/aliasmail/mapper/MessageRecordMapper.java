package com.aliasmail.mapper;

import com.aliasmail.domain.MessageRecord;
import com.aliasmail.domain.MessageStatus;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

@Mapper
public interface MessageRecordMapper {

    void insert(MessageRecord record);

    /**
     * Moves a PROCESSING row to its terminal status.
     * A null domain id keeps the stored one.
     *
     * @return rows updated; 0 when the row already left PROCESSING
     */
    int completeProcessing(@Param("id") Long id,
                           @Param("status") MessageStatus status,
                           @Param("domainId") Long domainId,
                           @Param("forwardedTo") String forwardedTo,
                           @Param("errorMessage") String errorMessage);

    int countByMessageId(@Param("messageId") String messageId);
}
