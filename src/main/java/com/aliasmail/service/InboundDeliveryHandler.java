package com.aliasmail.service;

import com.aliasmail.config.AliasMailProperties;
import com.aliasmail.delivery.DeliveryOutcome;
import com.aliasmail.delivery.EmailPriority;
import com.aliasmail.delivery.HybridDeliveryCoordinator;
import com.aliasmail.domain.MessageRecord;
import com.aliasmail.domain.MessageStatus;
import com.aliasmail.notification.ForwardingFailedEvent;
import com.aliasmail.routing.AliasRuleResolver;
import com.aliasmail.routing.MessageFacts;
import com.aliasmail.routing.RoutingDecision;
import com.aliasmail.util.AddressUtil;
import com.aliasmail.util.EmlParser;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * End-of-DATA processing for an accepted message
 * - One delivery record per envelope recipient (PROCESSING -> terminal)
 * - Alias / rule routing, forwarding headers, delivery through the coordinator
 * - Recipients are handled independently; one failing never affects another
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InboundDeliveryHandler {

    static final String REPLY_ACCEPTED = "250 2.0.0 Message accepted for delivery";
    static final String REPLY_NO_VALID_RECIPIENTS = "554 5.1.1 No valid recipients";
    static final String REPLY_UNPARSEABLE = "554 5.6.0 Message could not be parsed";
    static final String REPLY_TEMPORARY_FAILURE = "451 4.3.0 Temporary processing failure";

    private final AliasRuleResolver resolver;
    private final HybridDeliveryCoordinator coordinator;
    private final DeliveryRecordService recordService;
    private final ApplicationEventPublisher eventPublisher;
    private final AliasMailProperties properties;

    /**
     * Per-message values shared by every recipient
     */
    private record InboundMessage(String mailFrom, byte[] data, String messageId, String subject,
                                  MessageFacts facts) {
    }

    /**
     * Terminal status of one recipient; internalError marks a processing breakdown rather than a delivery result
     */
    private record RecipientResult(MessageStatus status, boolean internalError) {
    }

    /**
     * Blocking entry point; returns the SMTP reply for the DATA command
     */
    public String handleData(String mailFrom, List<String> rcptTos, byte[] data) {
        return process(mailFrom, rcptTos, data).block();
    }

    /**
     * Reactive entry point
     */
    public Mono<String> process(String mailFrom, List<String> rcptTos, byte[] data) {
        InboundMessage message;
        try {
            message = inspect(mailFrom, data);
        } catch (MessagingException e) {
            log.warn("Rejecting unparseable message from {}: {}", mailFrom, e.getMessage());
            return Mono.just(REPLY_UNPARSEABLE);
        }
        log.info("Received {} from {} to {} ({} bytes)", message.messageId(), message.mailFrom(), rcptTos, data.length);

        List<String> recipients = new ArrayList<>(rcptTos);
        return Flux.range(0, recipients.size())
                .flatMap(i -> processRecipient(message, recipients.get(i), i))
                .collectList()
                .map(InboundDeliveryHandler::reply);
    }

    private static String reply(List<RecipientResult> results) {
        if (results.isEmpty() || results.stream().allMatch(r -> r.status() == MessageStatus.REJECTED)) {
            return REPLY_NO_VALID_RECIPIENTS;
        }
        if (results.stream().allMatch(RecipientResult::internalError)) {
            return REPLY_TEMPORARY_FAILURE;
        }
        return REPLY_ACCEPTED;
    }

    private InboundMessage inspect(String mailFrom, byte[] data) throws MessagingException {
        MimeMessage parsed = EmlParser.parse(data);
        String messageId = EmlParser.extractMessageId(parsed, properties.getHostname());
        String subject = EmlParser.extractSubject(parsed);
        boolean hasAttachments;
        try {
            hasAttachments = EmlParser.hasAttachments(parsed);
        } catch (IOException e) {
            log.warn("Could not inspect attachments of {}: {}", messageId, e.getMessage());
            hasAttachments = false;
        }
        String sender = AddressUtil.stripAngleBrackets(mailFrom);
        MessageFacts facts = MessageFacts.builder()
                .sender(sender)
                .subject(subject)
                .sizeBytes(data.length)
                .hasAttachments(hasAttachments)
                .build();
        return new InboundMessage(sender, data, messageId, subject, facts);
    }

    private Mono<RecipientResult> processRecipient(InboundMessage message, String rcptTo, int index) {
        String recipient = AddressUtil.stripAngleBrackets(rcptTo);
        MessageRecord record = MessageRecord.builder()
                .messageId(index == 0 ? message.messageId() : message.messageId() + "#" + recipient)
                .senderEmail(message.mailFrom())
                .recipientEmail(recipient)
                .subject(message.subject())
                .sizeBytes(message.data().length)
                .hasAttachments(message.facts().isHasAttachments())
                .build();

        return Mono.fromCallable(() -> {
                    recordService.startProcessing(record);
                    RoutingDecision decision = resolver.resolve(recipient, message.facts());
                    if (decision.getDomain() != null) {
                        record.setDomainId(decision.getDomain().getId());
                    }
                    return decision;
                })
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(decision -> decision.isRoute()
                        ? forward(message, recipient, record, decision)
                        : Mono.fromCallable(() -> reject(recipient, record, decision)))
                .map(status -> new RecipientResult(status, false))
                .onErrorResume(e -> {
                    log.error("Processing for recipient {} of {} failed", recipient, message.messageId(), e);
                    return Mono.fromCallable(() -> recordFailure(record, e))
                            .onErrorResume(persistError -> {
                                log.error("Could not record failure for {}", recipient, persistError);
                                return Mono.just(new RecipientResult(MessageStatus.FAILED, true));
                            });
                });
    }

    private MessageStatus reject(String recipient, MessageRecord record, RoutingDecision decision) {
        log.warn("Rejected {} for {}: {}", record.getMessageId(), recipient, decision.getReason());
        recordService.complete(record, MessageStatus.REJECTED, null, decision.getReason());
        return MessageStatus.REJECTED;
    }

    private RecipientResult recordFailure(MessageRecord record, Throwable e) {
        if (record.getId() == null) {
            return new RecipientResult(MessageStatus.FAILED, true);
        }
        recordService.complete(record, MessageStatus.FAILED, null, "Processing error: " + e.getMessage());
        return new RecipientResult(MessageStatus.FAILED, false);
    }

    private Mono<MessageStatus> forward(InboundMessage message, String recipient, MessageRecord record,
                                        RoutingDecision decision) {
        List<String> targets = decision.getTargets();
        return Flux.fromIterable(targets)
                .flatMapSequential(target -> Mono.fromCallable(() ->
                                EmlParser.stampForwardingHeaders(message.data(), recipient, message.mailFrom(), target))
                        .subscribeOn(Schedulers.boundedElastic())
                        // Alias address as envelope sender so the hosted domain's DKIM key signs the copy
                        .flatMap(stamped -> coordinator.sendWithOutcomes(
                                stamped, List.of(target), recipient, EmailPriority.NORMAL))
                        .map(outcomes -> Map.entry(target, outcomes.getOrDefault(target, DeliveryOutcome.FAILED))))
                .collectList()
                .map(entries -> {
                    Map<String, DeliveryOutcome> outcomes = new LinkedHashMap<>();
                    entries.forEach(entry -> outcomes.put(entry.getKey(), entry.getValue()));
                    return outcomes;
                })
                .publishOn(Schedulers.boundedElastic())
                .map(outcomes -> complete(message, recipient, record, decision, outcomes));
    }

    private MessageStatus complete(InboundMessage message, String recipient, MessageRecord record,
                                   RoutingDecision decision, Map<String, DeliveryOutcome> outcomes) {
        List<String> failed = new ArrayList<>();
        boolean allPermanent = true;
        for (Map.Entry<String, DeliveryOutcome> entry : outcomes.entrySet()) {
            if (entry.getValue() != DeliveryOutcome.SUCCESS) {
                failed.add(entry.getKey());
                allPermanent &= entry.getValue() == DeliveryOutcome.BOUNCED;
            }
        }

        String forwardedTo = String.join(",", decision.getTargets());
        if (failed.isEmpty()) {
            recordService.complete(record, MessageStatus.DELIVERED, forwardedTo, null);
            log.info("Forwarded {} for {} to {}", message.messageId(), recipient, forwardedTo);
            return MessageStatus.DELIVERED;
        }

        MessageStatus status = allPermanent ? MessageStatus.BOUNCED : MessageStatus.FAILED;
        String error = "Failed targets: " + String.join(", ", failed);
        recordService.complete(record, status, forwardedTo, error);
        log.error("Forwarding {} for {} {}: {}", message.messageId(), recipient, status, error);

        Long ownerUserId = decision.getDomain() != null ? decision.getDomain().getUserId() : null;
        eventPublisher.publishEvent(ForwardingFailedEvent.builder()
                .ownerUserId(ownerUserId)
                .alias(recipient)
                .sender(message.mailFrom())
                .subject(message.subject())
                .error(error)
                .build());
        return status;
    }
}
