package com.aliasmail.delivery;

import com.aliasmail.delivery.direct.DirectDeliveryService;
import com.aliasmail.delivery.relay.RelayService;
import com.aliasmail.dkim.DkimSigner;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Delivery mode routing tests
 */
@ExtendWith(MockitoExtension.class)
class HybridDeliveryCoordinatorTest {

    private static final byte[] MESSAGE = "From: a@hosted.com\r\n\r\nbody\r\n".getBytes(StandardCharsets.UTF_8);
    private static final byte[] SIGNED = "DKIM-Signature: x\r\nFrom: a@hosted.com\r\n\r\nbody\r\n"
            .getBytes(StandardCharsets.UTF_8);
    private static final String FROM = "a@hosted.com";

    @Mock
    private DirectDeliveryService directService;

    @Mock
    private RelayService relayService;

    @Mock
    private DkimSigner dkimSigner;

    private HybridDeliveryCoordinator coordinator(DeliveryMode mode, boolean dkim, boolean hasRelay) {
        return new HybridDeliveryCoordinator(directService, hasRelay ? relayService : null, dkimSigner,
                mode, dkim, hasRelay, new SimpleMeterRegistry());
    }

    private static DeliveryResult result(String recipient, DeliveryOutcome outcome) {
        return DeliveryResult.builder().recipient(recipient).outcome(outcome).build();
    }

    private static Map<String, DeliveryResult> results(DeliveryResult... results) {
        Map<String, DeliveryResult> map = new LinkedHashMap<>();
        for (DeliveryResult result : results) {
            map.put(result.getRecipient(), result);
        }
        return map;
    }

    @Test
    @DisplayName("Without relay credentials every mode falls back to DIRECT")
    void testForcedDirectWithoutRelay() {
        HybridDeliveryCoordinator coordinator = coordinator(DeliveryMode.HYBRID, true, false);

        assertThat(coordinator.getMode()).isEqualTo(DeliveryMode.DIRECT);
        assertThat(coordinator.getConfiguredMode()).isEqualTo(DeliveryMode.HYBRID);
        assertThat(coordinator.hasRelay()).isFalse();
    }

    @Test
    @DisplayName("DIRECT signs once and delivers the signed bytes")
    void testDirectSignsOnce() {
        when(dkimSigner.sign(MESSAGE, FROM)).thenReturn(SIGNED);
        when(directService.deliverAll(SIGNED, List.of("x@t.com", "y@t.com"), FROM))
                .thenReturn(Mono.just(results(result("x@t.com", DeliveryOutcome.SUCCESS),
                        result("y@t.com", DeliveryOutcome.BOUNCED))));
        HybridDeliveryCoordinator coordinator = coordinator(DeliveryMode.DIRECT, true, false);

        Map<String, Boolean> sent = coordinator.send(MESSAGE, List.of("x@t.com", "y@t.com"), FROM,
                EmailPriority.NORMAL).block();

        assertThat(sent).containsEntry("x@t.com", true).containsEntry("y@t.com", false);
        assertThat(coordinator.stats()).containsEntry("direct_sent", 1L).containsEntry("direct_failed", 1L);
    }

    @Test
    @DisplayName("HYBRID retries direct failures through the relay and keeps the relay outcome")
    void testHybridFallback() {
        when(dkimSigner.sign(MESSAGE, FROM)).thenReturn(SIGNED);
        when(directService.deliverAll(SIGNED, List.of("x@t.com", "y@t.com"), FROM))
                .thenReturn(Mono.just(results(result("x@t.com", DeliveryOutcome.SUCCESS),
                        result("y@t.com", DeliveryOutcome.FAILED))));
        when(relayService.send(SIGNED, List.of("y@t.com"), FROM, EmailPriority.NORMAL)).thenReturn(Mono.just(true));
        HybridDeliveryCoordinator coordinator = coordinator(DeliveryMode.HYBRID, true, true);

        Map<String, DeliveryOutcome> outcomes = coordinator.sendWithOutcomes(MESSAGE, List.of("x@t.com", "y@t.com"),
                FROM, EmailPriority.NORMAL).block();

        assertThat(outcomes).containsEntry("x@t.com", DeliveryOutcome.SUCCESS)
                .containsEntry("y@t.com", DeliveryOutcome.SUCCESS);
        verify(relayService, never()).send(any(), eq(List.of("x@t.com")), anyString(), any());
    }

    @Test
    @DisplayName("RELAY submits one job per recipient; a rejected submission counts as failed")
    void testRelayPerRecipient() {
        when(dkimSigner.sign(MESSAGE, FROM)).thenReturn(SIGNED);
        when(relayService.send(SIGNED, List.of("x@t.com"), FROM, EmailPriority.HIGH)).thenReturn(Mono.just(true));
        when(relayService.send(SIGNED, List.of("y@t.com"), FROM, EmailPriority.HIGH))
                .thenReturn(Mono.error(new IllegalStateException("Relay service is not running")));
        HybridDeliveryCoordinator coordinator = coordinator(DeliveryMode.RELAY, true, true);

        Map<String, DeliveryOutcome> outcomes = coordinator.sendWithOutcomes(MESSAGE, List.of("x@t.com", "y@t.com"),
                FROM, EmailPriority.HIGH).block();

        assertThat(outcomes.keySet()).containsExactly("x@t.com", "y@t.com");
        assertThat(outcomes).containsEntry("x@t.com", DeliveryOutcome.SUCCESS)
                .containsEntry("y@t.com", DeliveryOutcome.FAILED);
        verify(directService, never()).deliverAll(any(), anyList(), anyString());
    }

    @Test
    @DisplayName("SMART routes through the relay")
    void testSmartUsesRelay() {
        when(dkimSigner.sign(MESSAGE, FROM)).thenReturn(MESSAGE);
        when(relayService.send(MESSAGE, List.of("x@t.com"), FROM, EmailPriority.NORMAL)).thenReturn(Mono.just(true));
        HybridDeliveryCoordinator coordinator = coordinator(DeliveryMode.SMART, true, true);

        Map<String, Boolean> sent = coordinator.send(MESSAGE, List.of("x@t.com"), FROM, EmailPriority.NORMAL)
                .block();

        assertThat(sent).containsEntry("x@t.com", true);
    }

    @Test
    @DisplayName("With DKIM disabled the message goes out unsigned")
    void testDkimDisabled() {
        when(directService.deliverAll(MESSAGE, List.of("x@t.com"), FROM))
                .thenReturn(Mono.just(results(result("x@t.com", DeliveryOutcome.SUCCESS))));
        HybridDeliveryCoordinator coordinator = coordinator(DeliveryMode.DIRECT, false, false);

        coordinator.send(MESSAGE, List.of("x@t.com"), FROM, EmailPriority.NORMAL).block();

        verify(dkimSigner).recordUnsigned();
        verify(dkimSigner, never()).sign(any(byte[].class), anyString());
    }

    @Test
    @DisplayName("No recipients completes with an empty map")
    void testEmptyRecipients() {
        HybridDeliveryCoordinator coordinator = coordinator(DeliveryMode.DIRECT, true, false);

        assertThat(coordinator.send(MESSAGE, List.of(), FROM, EmailPriority.NORMAL).block()).isEmpty();
        verify(directService, never()).deliverAll(any(), anyList(), anyString());
    }
}
