package com.aliasmail.delivery;

import java.time.Instant;

/**
 * One delivery try against one recipient
 *
 * @param mxHost last host tried, null when DNS failed before any connection
 */
public record DeliveryAttempt(Instant timestamp, boolean success, String error, String mxHost) {
}
