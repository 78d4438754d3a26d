package com.aliasmail.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Conditional forwarding rule attached to an alias.
 * Lower priority is evaluated first.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ForwardingRule {

    private Long id;
    private Long aliasId;
    private int priority;
    private String name;
    private RuleConditionType conditionType;
    private String conditionValue;
    private RuleActionType actionType;
    private String actionValue;  // Comma-separated targets for REDIRECT
    private boolean active;
    private long matchCount;
}
