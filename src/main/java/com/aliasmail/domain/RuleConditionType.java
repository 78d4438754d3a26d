package com.aliasmail.domain;

/**
 * What a forwarding rule inspects
 */
public enum RuleConditionType {
    SENDER_CONTAINS,
    SENDER_EQUALS,
    SENDER_DOMAIN,
    SUBJECT_CONTAINS,
    SUBJECT_EQUALS,
    SIZE_GREATER_THAN,
    SIZE_LESS_THAN,
    HAS_ATTACHMENTS
}
