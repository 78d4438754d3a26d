package com.aliasmail.notification;

import lombok.Builder;
import lombok.Value;

/**
 * Published when at least one forward target of an accepted message failed
 */
@Value
@Builder
public class ForwardingFailedEvent {

    /** Owner of the hosted domain */
    Long ownerUserId;
    String alias;
    String sender;
    String subject;
    String error;
}
