package com.aliasmail.routing;

/**
 * A stored forwarding rule has a condition or action the server does not know
 */
public class RuleDecodeException extends Exception {

    public RuleDecodeException(String message) {
        super(message);
    }

    public RuleDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
