package com.aliasmail.notification;

import com.aliasmail.config.AliasMailProperties;
import com.aliasmail.delivery.EmailPriority;
import com.aliasmail.delivery.HybridDeliveryCoordinator;
import com.aliasmail.domain.NotificationRecipient;
import com.aliasmail.mapper.UserMapper;
import com.aliasmail.util.EmlParser;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Date;
import java.util.List;

/**
 * Mails the domain owner about failed forwards, when the owner opted in
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ForwardingFailureNotifier {

    private final UserMapper userMapper;
    private final HybridDeliveryCoordinator coordinator;
    private final AliasMailProperties properties;

    @EventListener
    public void onForwardingFailed(ForwardingFailedEvent event) {
        if (!properties.getNotification().isEnabled() || event.getOwnerUserId() == null) {
            return;
        }
        NotificationRecipient owner = userMapper.findNotificationRecipient(event.getOwnerUserId());
        if (owner == null || owner.getEmail() == null || !owner.isNotifyOnForwardFailure()) {
            log.debug("Owner {} does not receive forward failure notifications", event.getOwnerUserId());
            return;
        }

        byte[] message;
        try {
            message = buildMessage(owner.getEmail(), event);
        } catch (MessagingException e) {
            log.error("Failed to build forward failure notification for {}", owner.getEmail(), e);
            return;
        }

        String from = properties.getNotification().getFrom();
        coordinator.send(message, List.of(owner.getEmail()), from, EmailPriority.HIGH)
                .subscribe(
                        results -> log.info("Forward failure notification to {} : {}", owner.getEmail(), results),
                        e -> log.error("Forward failure notification to {} failed", owner.getEmail(), e));
    }

    byte[] buildMessage(String to, ForwardingFailedEvent event) throws MessagingException {
        MimeMessage message = new MimeMessage(EmlParser.getSession());
        message.setFrom(new InternetAddress(properties.getNotification().getFrom()));
        message.setRecipient(MimeMessage.RecipientType.TO, new InternetAddress(to));
        message.setSubject("Forwarding failed for " + event.getAlias(), "UTF-8");
        message.setSentDate(new Date());
        message.setText("A message to " + event.getAlias() + " could not be forwarded.\n\n"
                + "From: " + event.getSender() + "\n"
                + "Subject: " + event.getSubject() + "\n"
                + "Error: " + event.getError() + "\n", "UTF-8");
        message.saveChanges();
        return EmlParser.toBytes(message);
    }
}
