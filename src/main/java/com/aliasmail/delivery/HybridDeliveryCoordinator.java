package com.aliasmail.delivery;

import com.aliasmail.delivery.direct.DirectDeliveryService;
import com.aliasmail.delivery.relay.RelayService;
import com.aliasmail.dkim.DkimSigner;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outbound entry point: DKIM-signs once, then routes by delivery mode
 * - DIRECT: recipient MX hosts
 * - RELAY / SMART: smart host, one job per recipient
 * - HYBRID: direct first, relay for recipients that failed (relay outcome wins)
 * Without relay credentials every mode falls back to DIRECT.
 */
@Slf4j
public class HybridDeliveryCoordinator {

    private final DirectDeliveryService directService;
    private final RelayService relayService;
    private final DkimSigner dkimSigner;
    private final DeliveryMode configuredMode;
    private final DeliveryMode mode;
    private final boolean dkimEnabled;
    private final boolean hasRelay;

    private final Counter directSentCounter;
    private final Counter directFailedCounter;
    private final Counter relaySentCounter;
    private final Counter relayFailedCounter;

    /**
     * @param relayService null when no relay is configured
     */
    public HybridDeliveryCoordinator(DirectDeliveryService directService, RelayService relayService,
                                     DkimSigner dkimSigner, DeliveryMode mode, boolean dkimEnabled,
                                     boolean hasRelay, MeterRegistry meterRegistry) {
        this.directService = directService;
        this.relayService = relayService;
        this.dkimSigner = dkimSigner;
        this.configuredMode = mode;
        this.dkimEnabled = dkimEnabled;
        this.hasRelay = hasRelay && relayService != null;

        if (!this.hasRelay && mode != DeliveryMode.DIRECT) {
            log.warn("External relay not configured, forcing mode to DIRECT (was {})", mode);
            this.mode = DeliveryMode.DIRECT;
        } else {
            this.mode = mode;
        }

        this.directSentCounter = counter(meterRegistry, "direct.sent");
        this.directFailedCounter = counter(meterRegistry, "direct.failed");
        this.relaySentCounter = counter(meterRegistry, "relay.sent");
        this.relayFailedCounter = counter(meterRegistry, "relay.failed");

        log.info("Delivery coordinator initialized: mode={}, dkim={}, hasRelay={}",
                this.mode, dkimEnabled, this.hasRelay);
    }

    private static Counter counter(MeterRegistry registry, String name) {
        return Counter.builder("aliasmail.delivery.recipients." + name)
                .description("Recipients per delivery path and outcome")
                .register(registry);
    }

    /**
     * Deliver to every recipient; true means the message was accepted for that recipient
     */
    public Mono<Map<String, Boolean>> send(byte[] message, List<String> recipients, String mailFrom,
                                           EmailPriority priority) {
        return sendWithOutcomes(message, recipients, mailFrom, priority)
                .map(outcomes -> {
                    Map<String, Boolean> results = new LinkedHashMap<>();
                    outcomes.forEach((recipient, outcome) -> results.put(recipient, outcome == DeliveryOutcome.SUCCESS));
                    return results;
                });
    }

    /**
     * Same as {@link #send} but keeps bounce versus temporary failure apart
     */
    public Mono<Map<String, DeliveryOutcome>> sendWithOutcomes(byte[] message, List<String> recipients,
                                                               String mailFrom, EmailPriority priority) {
        if (recipients == null || recipients.isEmpty()) {
            return Mono.just(Map.of());
        }
        return Mono.fromCallable(() -> sign(message, mailFrom))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(signed -> switch (mode) {
                    case DIRECT -> sendDirect(signed, recipients, mailFrom);
                    case RELAY -> sendRelay(signed, recipients, mailFrom, priority);
                    case HYBRID -> sendHybrid(signed, recipients, mailFrom, priority);
                    // Reputation-based routing is not implemented; everything goes through the relay
                    case SMART -> sendRelay(signed, recipients, mailFrom, priority);
                });
    }

    private byte[] sign(byte[] message, String mailFrom) {
        if (!dkimEnabled) {
            dkimSigner.recordUnsigned();
            return message;
        }
        return dkimSigner.sign(message, mailFrom);
    }

    private Mono<Map<String, DeliveryOutcome>> sendDirect(byte[] message, List<String> recipients, String mailFrom) {
        return directService.deliverAll(message, recipients, mailFrom)
                .map(results -> {
                    Map<String, DeliveryOutcome> outcomes = new LinkedHashMap<>();
                    results.forEach((recipient, result) -> {
                        if (result.isSuccess()) {
                            directSentCounter.increment();
                        } else {
                            directFailedCounter.increment();
                        }
                        outcomes.put(recipient, result.getOutcome());
                    });
                    return outcomes;
                });
    }

    private Mono<Map<String, DeliveryOutcome>> sendRelay(byte[] message, List<String> recipients, String mailFrom,
                                                         EmailPriority priority) {
        return Flux.fromIterable(recipients)
                .flatMapSequential(recipient -> relayService.send(message, List.of(recipient), mailFrom, priority)
                        .onErrorResume(e -> {
                            log.error("Relay rejected message for {}: {}", recipient, e.getMessage());
                            return Mono.just(false);
                        })
                        .map(success -> {
                            if (success) {
                                relaySentCounter.increment();
                            } else {
                                relayFailedCounter.increment();
                            }
                            return Map.entry(recipient, success ? DeliveryOutcome.SUCCESS : DeliveryOutcome.FAILED);
                        }))
                .collectList()
                .map(entries -> {
                    Map<String, DeliveryOutcome> outcomes = new LinkedHashMap<>();
                    entries.forEach(entry -> outcomes.put(entry.getKey(), entry.getValue()));
                    return outcomes;
                });
    }

    private Mono<Map<String, DeliveryOutcome>> sendHybrid(byte[] message, List<String> recipients, String mailFrom,
                                                          EmailPriority priority) {
        return sendDirect(message, recipients, mailFrom)
                .flatMap(results -> {
                    List<String> failed = new ArrayList<>();
                    results.forEach((recipient, outcome) -> {
                        if (outcome != DeliveryOutcome.SUCCESS) {
                            failed.add(recipient);
                        }
                    });
                    if (failed.isEmpty()) {
                        return Mono.just(results);
                    }
                    log.info("Direct delivery failed for {} recipients, trying relay fallback", failed.size());
                    return sendRelay(message, failed, mailFrom, priority)
                            .map(relayResults -> {
                                Map<String, DeliveryOutcome> merged = new LinkedHashMap<>(results);
                                merged.putAll(relayResults);
                                return merged;
                            });
                });
    }

    public DeliveryMode getMode() {
        return mode;
    }

    public DeliveryMode getConfiguredMode() {
        return configuredMode;
    }

    public boolean isDkimEnabled() {
        return dkimEnabled;
    }

    public boolean hasRelay() {
        return hasRelay;
    }

    /**
     * Coordinator counters plus the nested service statistics
     */
    public Map<String, Object> stats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("mode", mode.name().toLowerCase());
        stats.put("direct_sent", (long) directSentCounter.count());
        stats.put("direct_failed", (long) directFailedCounter.count());
        stats.put("relay_sent", (long) relaySentCounter.count());
        stats.put("relay_failed", (long) relayFailedCounter.count());
        stats.put("dkim_signed", dkimSigner.signedCount());
        stats.put("dkim_unsigned", dkimSigner.unsignedCount());

        Map<String, Object> direct = new LinkedHashMap<>();
        direct.put("sent", directService.sentCount());
        direct.put("failed", directService.failedCount());
        direct.put("deferred", directService.deferredCount());
        direct.put("bounced", directService.bouncedCount());
        direct.put("mx_lookups", directService.mxLookupCount());
        direct.put("cache_hits", directService.mxCacheHitCount());
        stats.put("direct_service", direct);

        if (relayService != null) {
            stats.put("relay_service", relayService.stats());
        }
        return stats;
    }
}
