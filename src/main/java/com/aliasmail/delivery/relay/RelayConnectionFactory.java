package com.aliasmail.delivery.relay;

import com.aliasmail.delivery.SmtpDeliveryException;

@FunctionalInterface
public interface RelayConnectionFactory {

    /**
     * Connect, STARTTLS when configured, and authenticate
     */
    RelayConnection open() throws SmtpDeliveryException;
}
