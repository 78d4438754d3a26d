package com.aliasmail.config;

import org.springframework.context.annotation.Condition;
import org.springframework.context.annotation.ConditionContext;
import org.springframework.core.env.Environment;
import org.springframework.core.type.AnnotatedTypeMetadata;

/**
 * Matches when relay credentials are set and the delivery mode can use the relay
 */
public class RelayConfiguredCondition implements Condition {

    @Override
    public boolean matches(ConditionContext context, AnnotatedTypeMetadata metadata) {
        Environment env = context.getEnvironment();
        String username = env.getProperty("aliasmail.relay.username", "");
        String password = env.getProperty("aliasmail.relay.password", "");
        String mode = env.getProperty("aliasmail.delivery.mode", "direct");
        return !username.isBlank() && !password.isBlank() && !"direct".equalsIgnoreCase(mode.trim());
    }
}
