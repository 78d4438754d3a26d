package com.aliasmail.delivery.relay;

import com.aliasmail.delivery.EmailPriority;
import lombok.Getter;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Relay queue entry. Ordered by priority, then by submission sequence.
 */
@Getter
public class EmailJob implements Comparable<EmailJob> {

    private static final Comparator<EmailJob> ORDER = Comparator
            .comparing(EmailJob::getPriority)
            .thenComparingLong(EmailJob::getSequence);

    private final byte[] message;
    private final List<String> recipients;
    private final String mailFrom;
    private final EmailPriority priority;
    private final int maxRetries;
    private final Instant createdAt;
    private final long sequence;
    private final CompletableFuture<Boolean> result = new CompletableFuture<>();

    private volatile int retryCount;

    public EmailJob(byte[] message, List<String> recipients, String mailFrom, EmailPriority priority,
                    int maxRetries, Instant createdAt, long sequence) {
        this.message = message;
        this.recipients = List.copyOf(recipients);
        this.mailFrom = mailFrom;
        this.priority = priority;
        this.maxRetries = maxRetries;
        this.createdAt = createdAt;
        this.sequence = sequence;
    }

    boolean canRetry() {
        return retryCount < maxRetries;
    }

    int incrementRetryCount() {
        return ++retryCount;
    }

    @Override
    public int compareTo(EmailJob other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return "EmailJob{seq=" + sequence + ", priority=" + priority + ", recipients=" + recipients
                + ", retry=" + retryCount + "/" + maxRetries + "}";
    }
}
