package com.aliasmail.routing;

import lombok.Builder;
import lombok.Value;

/**
 * Message properties that forwarding rules can test
 */
@Value
@Builder
public class MessageFacts {

    String sender;
    String subject;
    long sizeBytes;
    boolean hasAttachments;
}
