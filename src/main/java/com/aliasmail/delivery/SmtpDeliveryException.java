package com.aliasmail.delivery;

/**
 * Outbound SMTP failure carrying the server reply code (-1 when there was no reply)
 */
public abstract class SmtpDeliveryException extends Exception {

    private final int replyCode;

    protected SmtpDeliveryException(int replyCode, String message, Throwable cause) {
        super(message, cause);
        this.replyCode = replyCode;
    }

    public int getReplyCode() {
        return replyCode;
    }

    public abstract boolean isPermanent();
}
