package com.aliasmail.queue;

import com.aliasmail.service.InboundDeliveryHandler;
import com.aliasmail.util.AddressUtil;
import jakarta.jms.BytesMessage;
import jakarta.jms.JMSException;
import jakarta.jms.Message;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jms.annotation.JmsListener;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Drains the inbound queue into {@link InboundDeliveryHandler}
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InboundQueueConsumer {

    private final InboundDeliveryHandler deliveryHandler;

    @JmsListener(destination = "${aliasmail.queue.inbound-destination:mail.inbound.queue}")
    public void processInbound(Message message) {
        if (!(message instanceof BytesMessage bytesMessage)) {
            log.warn("Unexpected message type in inbound queue");
            return;
        }

        try {
            byte[] emlData = new byte[(int) bytesMessage.getBodyLength()];
            bytesMessage.readBytes(emlData);

            String sender = bytesMessage.getStringProperty(InboundQueueProducer.PROPERTY_SENDER);
            List<String> recipients = AddressUtil.splitList(
                    bytesMessage.getStringProperty(InboundQueueProducer.PROPERTY_RECIPIENTS));

            log.info("Processing inbound mail: {} -> {}", sender, recipients);
            String reply = deliveryHandler.handleData(sender, recipients, emlData);
            log.info("Inbound mail from {} processed: {}", sender, reply);
        } catch (JMSException e) {
            log.error("Error reading inbound queue message", e);
        }
    }
}
