package com.aliasmail.delivery;

/**
 * Outbound delivery strategy
 */
public enum DeliveryMode {
    /** Straight to the recipient's MX hosts */
    DIRECT,
    /** Through the configured smart host */
    RELAY,
    /** Direct first, relay for the recipients that failed */
    HYBRID,
    /** Reputation-aware routing; currently routes everything through the relay */
    SMART
}
