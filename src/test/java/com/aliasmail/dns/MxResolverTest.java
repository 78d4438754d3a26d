package com.aliasmail.dns;

import com.aliasmail.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * MX resolution and caching tests
 */
class MxResolverTest {

    private MutableClock clock;
    private List<String> queried;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        queried = new ArrayList<>();
    }

    private MxResolver resolver(MxLookup lookup) {
        return new MxResolver(domain -> {
            queried.add(domain);
            return lookup.lookup(domain);
        }, Duration.ofMinutes(5), clock, new SimpleMeterRegistry());
    }

    @Test
    @DisplayName("Hosts are returned in ascending preference order")
    void testSortedByPreference() throws Exception {
        MxResolver resolver = resolver(domain -> List.of(
                new MxRecordEntry(20, "mx2.example.com"),
                new MxRecordEntry(5, "mx0.example.com"),
                new MxRecordEntry(10, "mx1.example.com")));

        assertThat(resolver.resolve("example.com"))
                .containsExactly("mx0.example.com", "mx1.example.com", "mx2.example.com");
    }

    @Test
    @DisplayName("A domain without MX records falls back to itself")
    void testNoMxFallsBackToDomain() throws Exception {
        MxResolver resolver = resolver(domain -> List.of());

        assertThat(resolver.resolve("Example.COM")).containsExactly("example.com");
    }

    @Test
    @DisplayName("NXDOMAIN is a permanent error")
    void testNxdomainIsPermanent() {
        MxResolver resolver = resolver(domain -> {
            throw DnsResolutionException.nxdomain(domain);
        });

        assertThatThrownBy(() -> resolver.resolve("nowhere.invalid"))
                .isInstanceOf(DnsResolutionException.class)
                .satisfies(e -> assertThat(((DnsResolutionException) e).isPermanent()).isTrue());
    }

    @Test
    @DisplayName("Cache hit inside the TTL returns the identical list without a query")
    void testCacheHitReturnsSameInstance() throws Exception {
        MxResolver resolver = resolver(domain -> List.of(new MxRecordEntry(10, "mx.example.com")));

        List<String> first = resolver.resolve("example.com");
        clock.advance(Duration.ofMinutes(4));
        List<String> second = resolver.resolve("EXAMPLE.com");

        assertThat(second).isSameAs(first);
        assertThat(queried).hasSize(1);
        assertThat(resolver.lookupCount()).isEqualTo(1);
        assertThat(resolver.cacheHitCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Entries older than the TTL are looked up again")
    void testExpiredEntryRequeried() throws Exception {
        MxResolver resolver = resolver(domain -> List.of(new MxRecordEntry(10, "mx.example.com")));

        resolver.resolve("example.com");
        clock.advance(Duration.ofMinutes(5));
        resolver.resolve("example.com");

        assertThat(queried).hasSize(2);
    }

    @Test
    @DisplayName("Failures are not cached")
    void testTemporaryFailureNotCached() {
        MxResolver resolver = resolver(domain -> {
            throw new DnsResolutionException(domain, "SERVFAIL", false);
        });

        assertThatThrownBy(() -> resolver.resolve("example.com")).isInstanceOf(DnsResolutionException.class);
        assertThatThrownBy(() -> resolver.resolve("example.com")).isInstanceOf(DnsResolutionException.class);
        assertThat(queried).hasSize(2);
        assertThat(resolver.cacheSize()).isZero();
    }

    @Test
    @DisplayName("clear() empties the cache")
    void testClear() throws Exception {
        MxResolver resolver = resolver(domain -> List.of(new MxRecordEntry(10, "mx." + domain)));
        resolver.resolve("a.com");
        resolver.resolve("b.com");
        assertThat(resolver.cacheSize()).isEqualTo(2);

        resolver.clear();

        assertThat(resolver.cacheSize()).isZero();
        resolver.resolve("a.com");
        assertThat(queried).hasSize(3);
    }
}
