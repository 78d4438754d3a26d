package com.aliasmail.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Delivery record: one row per (inbound message, recipient)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageRecord {

    private Long id;
    private String messageId;
    private Long domainId;
    private String senderEmail;
    private String recipientEmail;
    private String forwardedTo;
    private String subject;
    private long sizeBytes;
    private boolean hasAttachments;
    private MessageStatus status;
    private String errorMessage;
}
