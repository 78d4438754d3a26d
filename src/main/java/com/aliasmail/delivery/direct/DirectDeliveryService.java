package com.aliasmail.delivery.direct;

import com.aliasmail.delivery.DeliveryAttempt;
import com.aliasmail.delivery.DeliveryOutcome;
import com.aliasmail.delivery.DeliveryResult;
import com.aliasmail.delivery.Sleeper;
import com.aliasmail.delivery.SlidingWindowRateLimiter;
import com.aliasmail.delivery.SmtpDeliveryException;
import com.aliasmail.dns.DnsResolutionException;
import com.aliasmail.dns.MxResolver;
import com.aliasmail.util.AddressUtil;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Delivers straight to the recipient domain's mail exchangers
 * - MX lookup (cached), hosts tried in preference order
 * - Per-domain connection rate limit
 * - 5xx / refused recipient bounces immediately
 * - Temporary failures retried with backoff 2^attempt * base
 * - Reactive: blocking SMTP work runs on boundedElastic
 */
@Slf4j
public class DirectDeliveryService {

    private final MxResolver mxResolver;
    private final MxTransport transport;
    private final SlidingWindowRateLimiter rateLimiter;
    private final int maxRetries;
    private final Duration retryBaseDelay;
    private final Sleeper sleeper;
    private final Clock clock;

    private final Counter sentCounter;
    private final Counter failedCounter;
    private final Counter deferredCounter;
    private final Counter bouncedCounter;

    public DirectDeliveryService(MxResolver mxResolver, MxTransport transport, SlidingWindowRateLimiter rateLimiter,
                                 int maxRetries, Duration retryBaseDelay, Sleeper sleeper, Clock clock,
                                 MeterRegistry meterRegistry) {
        this.mxResolver = mxResolver;
        this.transport = transport;
        this.rateLimiter = rateLimiter;
        this.maxRetries = Math.max(1, maxRetries);
        this.retryBaseDelay = retryBaseDelay;
        this.sleeper = sleeper;
        this.clock = clock;
        this.sentCounter = counter(meterRegistry, "sent", "Messages accepted by a remote MX");
        this.failedCounter = counter(meterRegistry, "failed", "Deliveries that ran out of retries");
        this.deferredCounter = counter(meterRegistry, "deferred", "Attempts deferred for a later retry");
        this.bouncedCounter = counter(meterRegistry, "bounced", "Deliveries failed permanently");
    }

    private static Counter counter(MeterRegistry registry, String name, String description) {
        return Counter.builder("aliasmail.delivery.direct." + name)
                .description(description)
                .register(registry);
    }

    /**
     * Deliver one message to one recipient (Reactive)
     */
    public Mono<DeliveryResult> deliver(byte[] message, String recipient, String mailFrom) {
        return Mono.fromCallable(() -> deliverBlocking(message, recipient, mailFrom))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnSuccess(result -> log.info("Direct delivery to {} : {}", recipient, result.getOutcome()))
                .onErrorResume(e -> {
                    log.error("Direct delivery to {} failed unexpectedly", recipient, e);
                    failedCounter.increment();
                    return Mono.just(DeliveryResult.builder()
                            .recipient(recipient)
                            .outcome(DeliveryOutcome.FAILED)
                            .error(e.getMessage())
                            .build());
                });
    }

    /**
     * Deliver to several recipients concurrently; the map keeps the input order
     */
    public Mono<Map<String, DeliveryResult>> deliverAll(byte[] message, List<String> recipients, String mailFrom) {
        return Flux.fromIterable(recipients)
                .flatMap(recipient -> deliver(message, recipient, mailFrom))
                .collectMap(DeliveryResult::getRecipient)
                .map(results -> {
                    Map<String, DeliveryResult> ordered = new LinkedHashMap<>();
                    for (String recipient : recipients) {
                        ordered.put(recipient, results.get(recipient));
                    }
                    return ordered;
                });
    }

    DeliveryResult deliverBlocking(byte[] message, String recipient, String mailFrom) {
        DeliveryResult.DeliveryResultBuilder result = DeliveryResult.builder().recipient(recipient);

        String domain = AddressUtil.extractDomain(recipient);
        if (domain == null) {
            bouncedCounter.increment();
            return result.outcome(DeliveryOutcome.BOUNCED)
                    .error("Invalid recipient address: " + recipient)
                    .build();
        }

        String lastError = null;
        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            List<String> mxHosts;
            try {
                mxHosts = mxResolver.resolve(domain);
            } catch (DnsResolutionException e) {
                result.attempt(new DeliveryAttempt(clock.instant(), false, e.getMessage(), null));
                if (e.isPermanent()) {
                    log.error("Delivery to {} bounced: {}", recipient, e.getMessage());
                    bouncedCounter.increment();
                    return result.outcome(DeliveryOutcome.BOUNCED).error(e.getMessage()).build();
                }
                lastError = e.getMessage();
                if (!backoff(recipient, attempt, lastError)) {
                    break;
                }
                continue;
            }

            rateLimiter.acquire(domain);

            String lastHost = null;
            for (String mxHost : mxHosts) {
                lastHost = mxHost;
                try {
                    log.debug("Attempting delivery to {} via {} (attempt {})", recipient, mxHost, attempt);
                    transport.send(mxHost, message, mailFrom, recipient);
                    result.attempt(new DeliveryAttempt(clock.instant(), true, null, mxHost));
                    sentCounter.increment();
                    log.info("Mail sent to {} via MX host {}", recipient, mxHost);
                    return result.outcome(DeliveryOutcome.SUCCESS).mxHost(mxHost).build();
                } catch (SmtpDeliveryException e) {
                    if (e.isPermanent()) {
                        result.attempt(new DeliveryAttempt(clock.instant(), false, e.getMessage(), mxHost));
                        log.error("Permanent failure delivering to {} via {}: {}", recipient, mxHost, e.getMessage());
                        bouncedCounter.increment();
                        return result.outcome(DeliveryOutcome.BOUNCED).mxHost(mxHost).error(e.getMessage()).build();
                    }
                    log.warn("Failed to deliver to {} via {}: {}", recipient, mxHost, e.getMessage());
                    lastError = e.getMessage();
                }
            }
            result.attempt(new DeliveryAttempt(clock.instant(), false, lastError, lastHost));

            if (!backoff(recipient, attempt, lastError)) {
                break;
            }
        }

        log.error("Delivery to {} failed after {} attempts: {}", recipient, maxRetries, lastError);
        failedCounter.increment();
        return result.outcome(DeliveryOutcome.FAILED).error(lastError).build();
    }

    /**
     * Sleeps before the next attempt
     *
     * @return false when no attempt is left or the wait was interrupted
     */
    private boolean backoff(String recipient, int attempt, String error) {
        if (attempt >= maxRetries) {
            return false;
        }
        Duration wait = calculateBackoff(attempt);
        deferredCounter.increment();
        log.warn("Delivery to {} failed (attempt {}/{}), retrying in {} ms: {}",
                recipient, attempt, maxRetries, wait.toMillis(), error);
        try {
            sleeper.sleep(wait);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Retry wait for {} interrupted", recipient);
            return false;
        }
    }

    /**
     * Wait before attempt n + 1: 2^n * base
     */
    public Duration calculateBackoff(int attempt) {
        return retryBaseDelay.multipliedBy(1L << attempt);
    }

    public long sentCount() {
        return (long) sentCounter.count();
    }

    public long failedCount() {
        return (long) failedCounter.count();
    }

    public long deferredCount() {
        return (long) deferredCounter.count();
    }

    public long bouncedCount() {
        return (long) bouncedCounter.count();
    }

    public long mxLookupCount() {
        return mxResolver.lookupCount();
    }

    public long mxCacheHitCount() {
        return mxResolver.cacheHitCount();
    }
}
