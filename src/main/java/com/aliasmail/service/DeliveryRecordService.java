package com.aliasmail.service;

import com.aliasmail.domain.MessageRecord;
import com.aliasmail.domain.MessageStatus;
import com.aliasmail.mapper.MessageRecordMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Delivery record persistence (messages table)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeliveryRecordService {

    private final MessageRecordMapper messageRecordMapper;

    /**
     * Insert a record in PROCESSING state.
     * A message id already on file (a resent message) gets a unique suffix.
     */
    @Transactional
    public MessageRecord startProcessing(MessageRecord record) {
        record.setStatus(MessageStatus.PROCESSING);
        String original = record.getMessageId();
        if (messageRecordMapper.countByMessageId(original) > 0) {
            record.setMessageId(original + "#" + UUID.randomUUID());
            log.warn("Message id {} already recorded, storing as {}", original, record.getMessageId());
        }
        messageRecordMapper.insert(record);
        return record;
    }

    /**
     * Write the terminal status once
     *
     * @return false when the record had already left PROCESSING
     */
    @Transactional
    public boolean complete(MessageRecord record, MessageStatus status, String forwardedTo, String errorMessage) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + status);
        }
        int updated = messageRecordMapper.completeProcessing(
                record.getId(), status, record.getDomainId(), forwardedTo, errorMessage);
        if (updated == 0) {
            log.warn("Message record {} was already finalized, ignoring {}", record.getId(), status);
            return false;
        }
        record.setStatus(status);
        record.setForwardedTo(forwardedTo);
        record.setErrorMessage(errorMessage);
        return true;
    }
}
