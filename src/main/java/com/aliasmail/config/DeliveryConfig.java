package com.aliasmail.config;

import com.aliasmail.delivery.HybridDeliveryCoordinator;
import com.aliasmail.delivery.Sleeper;
import com.aliasmail.delivery.SlidingWindowRateLimiter;
import com.aliasmail.delivery.direct.DirectDeliveryService;
import com.aliasmail.delivery.direct.JakartaMailMxTransport;
import com.aliasmail.delivery.relay.JakartaMailRelayConnectionFactory;
import com.aliasmail.delivery.relay.RelayConnectionPool;
import com.aliasmail.delivery.relay.RelayService;
import com.aliasmail.dkim.DkimKeyProvider;
import com.aliasmail.dkim.DkimSigner;
import com.aliasmail.dns.DnsJavaMxLookup;
import com.aliasmail.dns.MxResolver;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Conditional;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Outbound delivery wiring: MX resolver, DKIM, direct delivery, relay and the coordinator
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class DeliveryConfig {

    private final AliasMailProperties properties;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MxResolver mxResolver(Clock clock, MeterRegistry meterRegistry) {
        AliasMailProperties.Dns dns = properties.getDns();
        return new MxResolver(new DnsJavaMxLookup(dns.getTimeout()), dns.getMxCacheTtl(), clock, meterRegistry);
    }

    @Bean
    public DkimSigner dkimSigner(DkimKeyProvider keyProvider, Clock clock, MeterRegistry meterRegistry) {
        return new DkimSigner(keyProvider, clock, meterRegistry);
    }

    @Bean
    public DirectDeliveryService directDeliveryService(MxResolver mxResolver, Clock clock,
                                                       MeterRegistry meterRegistry) {
        AliasMailProperties.Delivery delivery = properties.getDelivery();
        JakartaMailMxTransport transport = new JakartaMailMxTransport(
                properties.getHostname(), delivery.getPort(),
                delivery.getConnectTimeout(), delivery.getReadTimeout());
        SlidingWindowRateLimiter perDomainLimiter = new SlidingWindowRateLimiter(
                delivery.getRateLimitPerDomain(), SlidingWindowRateLimiter.DEFAULT_WINDOW, clock, Sleeper.system());
        return new DirectDeliveryService(mxResolver, transport, perDomainLimiter,
                delivery.getMaxRetries(), delivery.getRetryBaseDelay(), Sleeper.system(), clock, meterRegistry);
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    @Conditional(RelayConfiguredCondition.class)
    public RelayService relayService(Clock clock, MeterRegistry meterRegistry) {
        AliasMailProperties.Relay relay = properties.getRelay();
        JakartaMailRelayConnectionFactory factory = new JakartaMailRelayConnectionFactory(
                relay.getHost(), relay.getPort(), relay.getUsername(), relay.getPassword(),
                relay.isUseTls(), properties.getHostname(), relay.getTimeout());
        RelayConnectionPool pool = new RelayConnectionPool(factory, relay.getPoolSize(), relay.getConnectionWait());
        SlidingWindowRateLimiter globalLimiter = new SlidingWindowRateLimiter(
                relay.getRateLimit(), SlidingWindowRateLimiter.DEFAULT_WINDOW, clock, Sleeper.system());
        log.info("Relay configured: {}:{} as {}", relay.getHost(), relay.getPort(), relay.getUsername());
        return new RelayService(pool, globalLimiter, relay.getMaxQueueSize(), relay.getWorkers(),
                relay.getMaxRetries(), relay.getRetryBaseDelay(), clock, meterRegistry);
    }

    @Bean
    public HybridDeliveryCoordinator hybridDeliveryCoordinator(DirectDeliveryService directDeliveryService,
                                                               ObjectProvider<RelayService> relayService,
                                                               DkimSigner dkimSigner,
                                                               MeterRegistry meterRegistry) {
        AliasMailProperties.Delivery delivery = properties.getDelivery();
        return new HybridDeliveryCoordinator(directDeliveryService, relayService.getIfAvailable(), dkimSigner,
                delivery.getMode(), delivery.isDkimEnabled(), properties.getRelay().hasCredentials(),
                meterRegistry);
    }
}
