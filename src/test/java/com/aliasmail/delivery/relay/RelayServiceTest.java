package com.aliasmail.delivery.relay;

import com.aliasmail.delivery.EmailPriority;
import com.aliasmail.delivery.PermanentSmtpException;
import com.aliasmail.delivery.SlidingWindowRateLimiter;
import com.aliasmail.delivery.TemporarySmtpException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Relay queue, worker and retry tests
 */
class RelayServiceTest {

    private static final byte[] MESSAGE = "Subject: relay\r\n\r\nbody\r\n".getBytes(StandardCharsets.UTF_8);
    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private ScriptedRelay relay;
    private RelayService service;

    @BeforeEach
    void setUp() {
        relay = new ScriptedRelay();
    }

    @AfterEach
    void tearDown() {
        if (service != null) {
            service.stop();
        }
    }

    private RelayService newService(int maxQueueSize, int workers, int maxRetries) {
        return newService(maxQueueSize, workers, maxRetries, Duration.ofMillis(5));
    }

    private RelayService newService(int maxQueueSize, int workers, int maxRetries, Duration retryBaseDelay) {
        RelayConnectionPool pool = new RelayConnectionPool(relay, 2, Duration.ofMillis(100));
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(10_000);
        return new RelayService(pool, limiter, maxQueueSize, workers, maxRetries, retryBaseDelay,
                Clock.systemUTC(), new SimpleMeterRegistry());
    }

    @Test
    @DisplayName("Queued message is relayed and completes true")
    void testSend() {
        service = newService(10, 1, 3);
        service.start();

        Boolean result = service.send(MESSAGE, List.of("dest@target.com"), "alias@hosted.com",
                EmailPriority.NORMAL).block(TIMEOUT);

        assertThat(result).isTrue();
        assertThat(relay.delivered).containsExactly(List.of("dest@target.com"));
        assertThat(service.stats().sent()).isEqualTo(1);
        assertThat(service.stats().queued()).isEqualTo(1);
    }

    @Test
    @DisplayName("Failed send is re-queued and succeeds on retry")
    void testRetryThenSuccess() {
        relay.failNext(new TemporarySmtpException(421, "busy"));
        service = newService(10, 1, 3);
        service.start();

        Boolean result = service.send(MESSAGE, List.of("dest@target.com"), "alias@hosted.com",
                EmailPriority.NORMAL).block(TIMEOUT);

        assertThat(result).isTrue();
        assertThat(relay.sendCalls.get()).isEqualTo(2);
        assertThat(service.stats().retried()).isEqualTo(1);
        assertThat(service.stats().failed()).isZero();
    }

    @Test
    @DisplayName("Job fails once retries are exhausted")
    void testRetriesExhausted() {
        for (int i = 0; i < 3; i++) {
            relay.failNext(new PermanentSmtpException(550, "relaying denied"));
        }
        service = newService(10, 1, 2);
        service.start();

        Boolean result = service.send(MESSAGE, List.of("dest@target.com"), "alias@hosted.com",
                EmailPriority.NORMAL).block(TIMEOUT);

        assertThat(result).isFalse();
        assertThat(relay.sendCalls.get()).isEqualTo(3);
        assertThat(service.stats().retried()).isEqualTo(2);
        assertThat(service.stats().failed()).isEqualTo(1);
    }

    @Test
    @DisplayName("Submission beyond capacity is rejected")
    void testQueueFull() throws Exception {
        relay.hold();
        service = newService(2, 1, 3);
        service.start();

        service.submit(MESSAGE, List.of("a@target.com"), "alias@hosted.com", EmailPriority.NORMAL);
        assertThat(relay.awaitFirstSend()).isTrue();
        service.submit(MESSAGE, List.of("b@target.com"), "alias@hosted.com", EmailPriority.NORMAL);
        service.submit(MESSAGE, List.of("c@target.com"), "alias@hosted.com", EmailPriority.NORMAL);

        assertThatThrownBy(() -> service.submit(MESSAGE, List.of("d@target.com"), "alias@hosted.com",
                EmailPriority.NORMAL))
                .isInstanceOf(QueueFullException.class);

        relay.resume();
    }

    @Test
    @DisplayName("Waiting jobs are ordered by priority, then by submission")
    void testPriorityOrder() throws Exception {
        relay.hold();
        service = newService(10, 1, 3);
        service.start();
        service.submit(MESSAGE, List.of("first@target.com"), "alias@hosted.com", EmailPriority.NORMAL);
        assertThat(relay.awaitFirstSend()).isTrue();

        service.submit(MESSAGE, List.of("low@target.com"), "alias@hosted.com", EmailPriority.LOW);
        service.submit(MESSAGE, List.of("normal@target.com"), "alias@hosted.com", EmailPriority.NORMAL);
        service.submit(MESSAGE, List.of("high1@target.com"), "alias@hosted.com", EmailPriority.HIGH);
        service.submit(MESSAGE, List.of("high2@target.com"), "alias@hosted.com", EmailPriority.HIGH);

        assertThat(service.pendingJobs())
                .extracting(job -> job.getRecipients().get(0))
                .containsExactly("high1@target.com", "high2@target.com", "normal@target.com", "low@target.com");

        relay.resume();
    }

    @Test
    @DisplayName("stop() finishes every accepted job before returning")
    void testStopDrainsQueue() throws Exception {
        service = newService(10, 1, 3);
        service.start();
        EmailJob first = service.submit(MESSAGE, List.of("a@target.com"), "alias@hosted.com", EmailPriority.NORMAL);
        EmailJob second = service.submit(MESSAGE, List.of("b@target.com"), "alias@hosted.com", EmailPriority.LOW);

        service.stop();

        assertThat(first.getResult().get(1, TimeUnit.SECONDS)).isTrue();
        assertThat(second.getResult().get(1, TimeUnit.SECONDS)).isTrue();
        assertThat(service.isRunning()).isFalse();
        assertThat(relay.opened).allMatch(connection -> connection.closed);
    }

    @Test
    @DisplayName("Interrupted stop() fails jobs still waiting for a retry")
    void testInterruptedStopFailsPendingRetry() throws Exception {
        relay.failNext(new TemporarySmtpException(421, "busy"));
        service = newService(10, 1, 3, Duration.ofMinutes(1));
        service.start();
        EmailJob job = service.submit(MESSAGE, List.of("a@target.com"), "alias@hosted.com", EmailPriority.NORMAL);

        long deadline = System.currentTimeMillis() + TIMEOUT.toMillis();
        while (service.stats().retried() == 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertThat(service.stats().retried()).isEqualTo(1);

        Thread.currentThread().interrupt();
        try {
            service.stop();
        } finally {
            Thread.interrupted();
        }

        assertThat(job.getResult().get(1, TimeUnit.SECONDS)).isFalse();
        assertThat(service.stats().failed()).isEqualTo(1);
        assertThat(relay.sendCalls.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("Submissions are refused when the service is not running")
    void testSubmitWhenStopped() {
        service = newService(10, 1, 3);

        assertThatThrownBy(() -> service.submit(MESSAGE, List.of("a@target.com"), "alias@hosted.com",
                EmailPriority.NORMAL))
                .isInstanceOf(IllegalStateException.class);

        service.start();
        service.stop();
        service.stop();

        assertThatThrownBy(() -> service.submit(MESSAGE, List.of("a@target.com"), "alias@hosted.com",
                EmailPriority.NORMAL))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("start() pre-warms the connection pool")
    void testStartPrewarmsPool() {
        service = newService(10, 1, 3);
        service.start();
        service.start();

        assertThat(relay.opened).hasSize(2);
        assertThat(service.stats().poolSize()).isEqualTo(2);
        assertThat(service.stats().running()).isTrue();
    }
}
