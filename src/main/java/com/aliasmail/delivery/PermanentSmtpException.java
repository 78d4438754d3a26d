package com.aliasmail.delivery;

/**
 * 5xx reply or refused recipient. Never retried.
 */
public class PermanentSmtpException extends SmtpDeliveryException {

    public PermanentSmtpException(int replyCode, String message) {
        super(replyCode, message, null);
    }

    public PermanentSmtpException(int replyCode, String message, Throwable cause) {
        super(replyCode, message, cause);
    }

    @Override
    public boolean isPermanent() {
        return true;
    }
}
