package com.aliasmail.delivery;

public enum DeliveryOutcome {
    SUCCESS,
    /** Permanent failure, not retried */
    BOUNCED,
    /** Temporary failures until retries ran out */
    FAILED
}
