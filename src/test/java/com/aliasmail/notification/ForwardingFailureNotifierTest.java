package com.aliasmail.notification;

import com.aliasmail.config.AliasMailProperties;
import com.aliasmail.delivery.EmailPriority;
import com.aliasmail.delivery.HybridDeliveryCoordinator;
import com.aliasmail.domain.NotificationRecipient;
import com.aliasmail.mapper.UserMapper;
import com.aliasmail.util.EmlParser;
import jakarta.mail.internet.MimeMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Forward failure notification tests
 */
@ExtendWith(MockitoExtension.class)
class ForwardingFailureNotifierTest {

    private static final ForwardingFailedEvent EVENT = ForwardingFailedEvent.builder()
            .ownerUserId(7L)
            .alias("shop@hosted.com")
            .sender("promo@store.example")
            .subject("Spring sale")
            .error("Failed targets: old@defunct.example")
            .build();

    @Mock
    private UserMapper userMapper;

    @Mock
    private HybridDeliveryCoordinator coordinator;

    private AliasMailProperties properties;
    private ForwardingFailureNotifier notifier;

    @BeforeEach
    void setUp() {
        properties = new AliasMailProperties();
        properties.getNotification().setFrom("noreply@hosted.com");
        notifier = new ForwardingFailureNotifier(userMapper, coordinator, properties);
    }

    @Test
    @DisplayName("Opted-in owner is mailed with HIGH priority")
    void testNotifyOwner() {
        when(userMapper.findNotificationRecipient(7L)).thenReturn(NotificationRecipient.builder()
                .userId(7L).email("owner@gmail.com").notifyOnForwardFailure(true).build());
        when(coordinator.send(any(), eq(List.of("owner@gmail.com")), eq("noreply@hosted.com"),
                eq(EmailPriority.HIGH))).thenReturn(Mono.just(Map.of("owner@gmail.com", true)));

        notifier.onForwardingFailed(EVENT);

        verify(coordinator).send(any(), eq(List.of("owner@gmail.com")), eq("noreply@hosted.com"),
                eq(EmailPriority.HIGH));
    }

    @Test
    @DisplayName("Owner who opted out is not mailed")
    void testOptedOut() {
        when(userMapper.findNotificationRecipient(7L)).thenReturn(NotificationRecipient.builder()
                .userId(7L).email("owner@gmail.com").notifyOnForwardFailure(false).build());

        notifier.onForwardingFailed(EVENT);

        verify(coordinator, never()).send(any(), anyList(), anyString(), any());
    }

    @Test
    @DisplayName("Notifications switched off globally")
    void testDisabled() {
        properties.getNotification().setEnabled(false);

        notifier.onForwardingFailed(EVENT);

        verifyNoInteractions(userMapper, coordinator);
    }

    @Test
    @DisplayName("Notification names the alias, sender and error")
    void testBuildMessage() throws Exception {
        MimeMessage message = EmlParser.parse(notifier.buildMessage("owner@gmail.com", EVENT));

        assertThat(message.getSubject()).isEqualTo("Forwarding failed for shop@hosted.com");
        assertThat(message.getHeader("To", null)).isEqualTo("owner@gmail.com");
        assertThat(message.getContent().toString())
                .contains("promo@store.example")
                .contains("Spring sale")
                .contains("Failed targets: old@defunct.example");
    }
}
