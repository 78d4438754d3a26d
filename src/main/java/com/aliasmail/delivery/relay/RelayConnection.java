package com.aliasmail.delivery.relay;

import com.aliasmail.delivery.SmtpDeliveryException;

import java.util.List;

/**
 * Authenticated session with the smart host
 */
public interface RelayConnection {

    /** Health check (NOOP round-trip) */
    boolean isAlive();

    void send(byte[] message, String mailFrom, List<String> recipients) throws SmtpDeliveryException;

    void close();
}
