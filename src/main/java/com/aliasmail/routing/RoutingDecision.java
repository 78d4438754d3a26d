package com.aliasmail.routing;

import com.aliasmail.domain.Alias;
import com.aliasmail.domain.Domain;
import com.aliasmail.domain.ForwardingRule;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Where a message for one recipient should go
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RoutingDecision {

    public enum Type {
        /** Forward to {@link #getTargets()} */
        ROUTE,
        /** A BLOCK rule matched */
        BLOCKED,
        /** Unknown domain or alias, or nothing to forward to */
        NO_ROUTE
    }

    private final Type type;
    private final List<String> targets;
    private final Domain domain;
    private final Alias alias;
    private final ForwardingRule rule;
    private final String reason;

    public static RoutingDecision route(List<String> targets, Domain domain, Alias alias, ForwardingRule rule) {
        return new RoutingDecision(Type.ROUTE, List.copyOf(targets), domain, alias, rule, null);
    }

    public static RoutingDecision blocked(Domain domain, Alias alias, ForwardingRule rule) {
        String reason = "Blocked by rule '" + rule.getName() + "'";
        return new RoutingDecision(Type.BLOCKED, List.of(), domain, alias, rule, reason);
    }

    public static RoutingDecision noRoute(Domain domain, String reason) {
        return new RoutingDecision(Type.NO_ROUTE, List.of(), domain, null, null, reason);
    }

    public boolean isRoute() {
        return type == Type.ROUTE;
    }
}
