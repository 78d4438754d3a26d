package com.aliasmail.delivery.direct;

import com.aliasmail.delivery.SmtpDeliveryException;

/**
 * One SMTP transaction against one mail exchanger
 */
@FunctionalInterface
public interface MxTransport {

    /**
     * Connect, EHLO, opportunistic STARTTLS, MAIL FROM / RCPT TO / DATA, QUIT
     *
     * @throws com.aliasmail.delivery.PermanentSmtpException 5xx reply or refused recipient
     * @throws com.aliasmail.delivery.TemporarySmtpException 4xx reply, timeout or connection failure
     */
    void send(String mxHost, byte[] message, String mailFrom, String recipient) throws SmtpDeliveryException;
}
