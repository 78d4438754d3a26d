package com.aliasmail.routing;

import com.aliasmail.domain.ForwardingRule;
import com.aliasmail.util.AddressUtil;

/**
 * Evaluates a rule condition against a message. String comparisons ignore case.
 */
public final class RuleMatcher {

    private RuleMatcher() {}

    public static boolean matches(ForwardingRule rule, MessageFacts facts) {
        String value = rule.getConditionValue() == null ? "" : rule.getConditionValue().trim();
        String sender = lower(facts.getSender());
        String subject = lower(facts.getSubject());
        String expected = value.toLowerCase();

        return switch (rule.getConditionType()) {
            case SENDER_CONTAINS -> sender.contains(expected);
            case SENDER_EQUALS -> sender.equals(expected);
            case SENDER_DOMAIN -> expected.equals(lower(AddressUtil.extractDomain(facts.getSender())));
            case SUBJECT_CONTAINS -> subject.contains(expected);
            case SUBJECT_EQUALS -> subject.equals(expected);
            case SIZE_GREATER_THAN -> compareSize(value, facts.getSizeBytes()) < 0;
            case SIZE_LESS_THAN -> compareSize(value, facts.getSizeBytes()) > 0;
            case HAS_ATTACHMENTS -> facts.isHasAttachments() == (value.isEmpty() || Boolean.parseBoolean(value));
        };
    }

    /**
     * Compare threshold with size; a non-numeric threshold never matches (returns 0)
     */
    private static int compareSize(String threshold, long size) {
        try {
            return Long.compare(Long.parseLong(threshold), size);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static String lower(String s) {
        return s == null ? "" : s.trim().toLowerCase();
    }
}
