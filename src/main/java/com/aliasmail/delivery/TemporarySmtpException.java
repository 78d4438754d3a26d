package com.aliasmail.delivery;

/**
 * 4xx reply, timeout or connection failure. Retried with backoff.
 */
public class TemporarySmtpException extends SmtpDeliveryException {

    public TemporarySmtpException(int replyCode, String message) {
        super(replyCode, message, null);
    }

    public TemporarySmtpException(int replyCode, String message, Throwable cause) {
        super(replyCode, message, cause);
    }

    @Override
    public boolean isPermanent() {
        return false;
    }
}
