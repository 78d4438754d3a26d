package com.aliasmail.queue;

import com.aliasmail.config.AliasMailProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jms.core.JmsTemplate;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Hands accepted SMTP envelopes to the inbound ActiveMQ queue
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InboundQueueProducer {

    static final String PROPERTY_SENDER = "sender";
    static final String PROPERTY_RECIPIENTS = "recipients";

    private final JmsTemplate jmsTemplate;
    private final AliasMailProperties properties;

    public void enqueue(byte[] emlData, String sender, List<String> recipients) {
        String destination = properties.getQueue().getInboundDestination();
        jmsTemplate.send(destination, session -> {
            var message = session.createBytesMessage();
            message.writeBytes(emlData);
            message.setStringProperty(PROPERTY_SENDER, sender);
            message.setStringProperty(PROPERTY_RECIPIENTS, String.join(",", recipients));
            return message;
        });
        log.info("Mail enqueued to inbound: {} -> {}", sender, recipients);
    }
}
