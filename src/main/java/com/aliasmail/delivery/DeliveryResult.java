package com.aliasmail.delivery;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Final result of delivering one message to one recipient
 */
@Value
@Builder
public class DeliveryResult {

    String recipient;
    DeliveryOutcome outcome;
    /** Host that accepted the message */
    String mxHost;
    String error;
    @Singular
    List<DeliveryAttempt> attempts;

    public boolean isSuccess() {
        return outcome == DeliveryOutcome.SUCCESS;
    }

    public boolean isBounced() {
        return outcome == DeliveryOutcome.BOUNCED;
    }
}
