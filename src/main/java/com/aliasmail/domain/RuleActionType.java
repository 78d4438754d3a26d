package com.aliasmail.domain;

/**
 * What happens when a forwarding rule matches
 */
public enum RuleActionType {
    /** Forward to the alias's own targets */
    FORWARD,
    /** Reject the message */
    BLOCK,
    /** Forward to the rule's action value instead */
    REDIRECT
}
