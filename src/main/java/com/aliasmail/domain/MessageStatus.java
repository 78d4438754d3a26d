package com.aliasmail.domain;

/**
 * Delivery record state machine:
 * PENDING -> PROCESSING -> {DELIVERED, FAILED, BOUNCED, REJECTED}
 */
public enum MessageStatus {
    PENDING,
    PROCESSING,
    /** Every forward target accepted the message */
    DELIVERED,
    /** At least one target failed after retries */
    FAILED,
    /** Every failed target failed permanently (5xx) */
    BOUNCED,
    /** No route, or blocked by a rule */
    REJECTED;

    public boolean isTerminal() {
        return this != PENDING && this != PROCESSING;
    }
}
