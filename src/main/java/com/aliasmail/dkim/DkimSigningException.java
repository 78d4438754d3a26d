package com.aliasmail.dkim;

/**
 * DKIM key or signature failure. Callers fall back to sending unsigned.
 */
public class DkimSigningException extends Exception {

    public DkimSigningException(String message) {
        super(message);
    }

    public DkimSigningException(String message, Throwable cause) {
        super(message, cause);
    }
}
