package com.aliasmail.routing;

import com.aliasmail.domain.Alias;
import com.aliasmail.domain.Domain;
import com.aliasmail.domain.ForwardingRule;
import com.aliasmail.mapper.AliasMapper;
import com.aliasmail.mapper.DomainMapper;
import com.aliasmail.mapper.ForwardingRuleMapper;
import com.aliasmail.util.AddressUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Resolves an inbound recipient to forwarding targets
 * - Hosted domain lookup, alias before catch-all
 * - Expired aliases are ignored
 * - Active rules in priority order, first match wins (BLOCK / FORWARD / REDIRECT)
 * - Invalid target addresses are dropped
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AliasRuleResolver {

    private final DomainMapper domainMapper;
    private final AliasMapper aliasMapper;
    private final ForwardingRuleMapper ruleMapper;
    private final Clock clock;

    public RoutingDecision resolve(String recipient, MessageFacts facts) throws RuleDecodeException {
        String address = AddressUtil.stripAngleBrackets(recipient);
        if (!AddressUtil.isValid(address)) {
            log.warn("Invalid recipient email format: {}", recipient);
            return RoutingDecision.noRoute(null, "Invalid recipient address");
        }

        String localPart = AddressUtil.extractLocalPart(address).toLowerCase();
        String domainName = AddressUtil.extractDomain(address);

        Domain domain = domainMapper.findActiveByName(domainName);
        if (domain == null) {
            return RoutingDecision.noRoute(null, "Domain not hosted: " + domainName);
        }

        Alias alias = aliasMapper.findActive(domain.getId(), localPart, clock.instant());
        if (alias == null) {
            if (domain.hasCatchAll()) {
                List<String> catchAll = validTargets(List.of(domain.getCatchAllEmail().trim()));
                if (!catchAll.isEmpty()) {
                    log.debug("{} routed to catch-all {}", address, catchAll);
                    return RoutingDecision.route(catchAll, domain, null, null);
                }
            }
            return RoutingDecision.noRoute(domain, "No alias for " + address);
        }

        List<ForwardingRule> rules = loadRules(alias);
        for (ForwardingRule rule : rules) {
            if (!RuleMatcher.matches(rule, facts)) {
                continue;
            }
            ruleMapper.incrementMatchCount(rule.getId());
            log.info("Rule '{}' ({} -> {}) matched for {}",
                    rule.getName(), rule.getConditionType(), rule.getActionType(), address);

            switch (rule.getActionType()) {
                case BLOCK -> {
                    return RoutingDecision.blocked(domain, alias, rule);
                }
                case REDIRECT -> {
                    List<String> redirectTargets = validTargets(AddressUtil.splitList(rule.getActionValue()));
                    if (!redirectTargets.isEmpty()) {
                        return RoutingDecision.route(redirectTargets, domain, alias, rule);
                    }
                    log.warn("Rule '{}' has no valid redirect target, using alias targets", rule.getName());
                    return aliasRoute(domain, alias, rule);
                }
                case FORWARD -> {
                    return aliasRoute(domain, alias, rule);
                }
            }
        }

        return aliasRoute(domain, alias, null);
    }

    private RoutingDecision aliasRoute(Domain domain, Alias alias, ForwardingRule rule) {
        List<String> targets = validTargets(AddressUtil.splitList(alias.getTargets()));
        if (targets.isEmpty()) {
            return RoutingDecision.noRoute(domain, "Alias has no valid targets");
        }
        return RoutingDecision.route(targets, domain, alias, rule);
    }

    private List<ForwardingRule> loadRules(Alias alias) throws RuleDecodeException {
        List<ForwardingRule> rules;
        try {
            rules = ruleMapper.findActiveByAliasId(alias.getId());
        } catch (DataAccessException e) {
            Throwable cause = NestedExceptionUtils.getMostSpecificCause(e);
            if (cause instanceof IllegalArgumentException) {
                throw new RuleDecodeException("Unreadable forwarding rule on alias " + alias.getId()
                        + ": " + cause.getMessage(), e);
            }
            throw e;
        }
        for (ForwardingRule rule : rules) {
            if (rule.getConditionType() == null || rule.getActionType() == null) {
                throw new RuleDecodeException("Forwarding rule " + rule.getId() + " has no condition or action");
            }
        }
        return rules;
    }

    private List<String> validTargets(List<String> candidates) {
        List<String> valid = new ArrayList<>();
        for (String candidate : candidates) {
            if (AddressUtil.isValid(candidate)) {
                valid.add(candidate);
            } else {
                log.warn("Invalid target email dropped: {}", candidate);
            }
        }
        return valid;
    }
}
