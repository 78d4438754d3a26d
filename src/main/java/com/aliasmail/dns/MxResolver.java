package com.aliasmail.dns;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves a recipient domain to its mail exchangers, ascending preference.
 * Results are cached for a fixed TTL; a hit returns the same list instance.
 */
@Slf4j
public class MxResolver {

    private record CacheEntry(List<String> hosts, Instant cachedAt) {
    }

    private final MxLookup mxLookup;
    private final Duration ttl;
    private final Clock clock;
    private final Map<String, CacheEntry> cache = new ConcurrentHashMap<>();
    private final Counter lookupCounter;
    private final Counter cacheHitCounter;

    public MxResolver(MxLookup mxLookup, Duration ttl, Clock clock, MeterRegistry meterRegistry) {
        this.mxLookup = mxLookup;
        this.ttl = ttl;
        this.clock = clock;
        this.lookupCounter = Counter.builder("aliasmail.dns.mx.lookups")
                .description("MX queries sent to DNS")
                .register(meterRegistry);
        this.cacheHitCounter = Counter.builder("aliasmail.dns.mx.cache.hits")
                .description("MX lookups answered from cache")
                .register(meterRegistry);
    }

    /**
     * MX hosts for the domain, lowest preference first.
     * A domain without MX records resolves to itself (implicit A record delivery).
     *
     * @throws DnsResolutionException NXDOMAIN (permanent, no fallback) or a temporary resolver error
     */
    public List<String> resolve(String domain) throws DnsResolutionException {
        String key = domain.toLowerCase();
        Instant now = clock.instant();

        CacheEntry cached = cache.get(key);
        if (cached != null && now.isBefore(cached.cachedAt().plus(ttl))) {
            cacheHitCounter.increment();
            log.debug("MX cache hit for {}", key);
            return cached.hosts();
        }

        lookupCounter.increment();
        List<MxRecordEntry> records = mxLookup.lookup(key);

        List<String> hosts;
        if (records.isEmpty()) {
            log.warn("No MX records for {}, falling back to A record", key);
            hosts = List.of(key);
        } else {
            hosts = records.stream()
                    .sorted(Comparator.comparingInt(MxRecordEntry::preference))
                    .map(MxRecordEntry::host)
                    .toList();
        }

        cache.put(key, new CacheEntry(hosts, now));
        log.info("MX lookup for {}: {}", key, hosts);
        return hosts;
    }

    public void clear() {
        cache.clear();
        log.info("MX cache cleared");
    }

    public int cacheSize() {
        return cache.size();
    }

    public long lookupCount() {
        return (long) lookupCounter.count();
    }

    public long cacheHitCount() {
        return (long) cacheHitCounter.count();
    }
}
