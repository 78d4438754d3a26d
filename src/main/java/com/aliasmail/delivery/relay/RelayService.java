package com.aliasmail.delivery.relay;

import com.aliasmail.delivery.EmailPriority;
import com.aliasmail.delivery.SlidingWindowRateLimiter;
import com.aliasmail.delivery.SmtpDeliveryException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Smart-host relay
 * - Pooled authenticated connections to one upstream
 * - Bounded priority queue (HIGH before NORMAL before LOW)
 * - Worker threads with a global send rate limit
 * - Failed jobs re-queued after 2^retry * base until maxRetries
 */
@Slf4j
public class RelayService {

    static final String RATE_LIMIT_KEY = "relay";
    private static final long POLL_INTERVAL_MS = 500;

    private final RelayConnectionPool pool;
    private final SlidingWindowRateLimiter rateLimiter;
    private final int maxQueueSize;
    private final int workerCount;
    private final int maxRetries;
    private final Duration retryBaseDelay;
    private final Clock clock;

    private final PriorityBlockingQueue<EmailJob> queue = new PriorityBlockingQueue<>();
    private final AtomicLong sequence = new AtomicLong();
    /** Jobs accepted but not finished: queued, in flight, or waiting for a retry */
    private final AtomicInteger outstanding = new AtomicInteger();
    private final Set<EmailJob> awaitingRetry = ConcurrentHashMap.newKeySet();
    private final Object drainLock = new Object();

    private final Counter sentCounter;
    private final Counter failedCounter;
    private final Counter retriedCounter;
    private final Counter queuedCounter;

    private ExecutorService workers;
    private ScheduledExecutorService retryScheduler;
    private volatile boolean running;
    private volatile boolean accepting;

    public RelayService(RelayConnectionPool pool, SlidingWindowRateLimiter rateLimiter, int maxQueueSize,
                        int workerCount, int maxRetries, Duration retryBaseDelay, Clock clock,
                        MeterRegistry meterRegistry) {
        this.pool = pool;
        this.rateLimiter = rateLimiter;
        this.maxQueueSize = maxQueueSize;
        this.workerCount = Math.max(1, workerCount);
        this.maxRetries = maxRetries;
        this.retryBaseDelay = retryBaseDelay;
        this.clock = clock;
        this.sentCounter = counter(meterRegistry, "sent", "Jobs accepted by the relay");
        this.failedCounter = counter(meterRegistry, "failed", "Jobs dropped after exhausting retries");
        this.retriedCounter = counter(meterRegistry, "retried", "Job retries scheduled");
        this.queuedCounter = counter(meterRegistry, "queued", "Jobs submitted to the relay queue");
        Gauge.builder("aliasmail.delivery.relay.queue.size", queue, PriorityBlockingQueue::size)
                .description("Jobs waiting in the relay queue")
                .register(meterRegistry);
        Gauge.builder("aliasmail.delivery.relay.pool.idle", pool, RelayConnectionPool::idleCount)
                .description("Idle pooled relay connections")
                .register(meterRegistry);
    }

    private static Counter counter(MeterRegistry registry, String name, String description) {
        return Counter.builder("aliasmail.delivery.relay." + name)
                .description(description)
                .register(registry);
    }

    /**
     * Pre-warm the pool and start the workers. No-op when already running.
     */
    public synchronized void start() {
        if (running) {
            return;
        }
        pool.prewarm();
        workers = Executors.newFixedThreadPool(workerCount, namedThreads("relay-worker"));
        retryScheduler = Executors.newSingleThreadScheduledExecutor(namedThreads("relay-retry"));
        running = true;
        accepting = true;
        for (int i = 0; i < workerCount; i++) {
            workers.submit(this::workerLoop);
        }
        log.info("Relay service started ({} workers, queue capacity {})", workerCount, maxQueueSize);
    }

    /**
     * Refuse new jobs, wait for every accepted job to finish, then stop workers and close the pool.
     * No-op when not running.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        accepting = false;
        log.info("Stopping relay service, draining {} outstanding jobs", outstanding.get());

        synchronized (drainLock) {
            while (outstanding.get() > 0) {
                try {
                    drainLock.wait(POLL_INTERVAL_MS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Interrupted while draining relay queue, {} jobs abandoned", outstanding.get());
                    break;
                }
            }
        }

        running = false;
        workers.shutdownNow();
        retryScheduler.shutdownNow();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Relay workers did not terminate in time");
            }
            retryScheduler.awaitTermination(1, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        EmailJob abandoned;
        while ((abandoned = queue.poll()) != null) {
            failedCounter.increment();
            finish(abandoned, false);
        }
        for (EmailJob pending : List.copyOf(awaitingRetry)) {
            if (awaitingRetry.remove(pending)) {
                failedCounter.increment();
                finish(pending, false);
            }
        }
        pool.close();
        log.info("Relay service stopped");
    }

    /**
     * Queue a message for relay
     *
     * @return the accepted job; its result completes with the final outcome
     * @throws QueueFullException the queue is at capacity
     */
    public EmailJob submit(byte[] message, List<String> recipients, String mailFrom, EmailPriority priority)
            throws QueueFullException {
        if (!accepting) {
            throw new IllegalStateException("Relay service is not running");
        }
        EmailJob job = new EmailJob(message, recipients, mailFrom,
                priority != null ? priority : EmailPriority.NORMAL,
                maxRetries, clock.instant(), sequence.incrementAndGet());
        synchronized (queue) {
            if (queue.size() >= maxQueueSize) {
                log.warn("Relay queue full, rejecting message for {}", recipients);
                throw new QueueFullException(maxQueueSize);
            }
            outstanding.incrementAndGet();
            queue.offer(job);
        }
        queuedCounter.increment();
        log.debug("Queued {}", job);
        return job;
    }

    /**
     * Queue a message and complete with its final outcome (Reactive)
     */
    public Mono<Boolean> send(byte[] message, List<String> recipients, String mailFrom, EmailPriority priority) {
        return Mono.fromCallable(() -> submit(message, recipients, mailFrom, priority))
                .flatMap(job -> Mono.fromFuture(job.getResult()));
    }

    private void workerLoop() {
        while (running) {
            EmailJob job;
            try {
                job = queue.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (job != null) {
                process(job);
            }
        }
    }

    void process(EmailJob job) {
        rateLimiter.acquire(RATE_LIMIT_KEY);

        RelayConnection connection = null;
        boolean healthy = false;
        try {
            connection = pool.acquire();
            connection.send(job.getMessage(), job.getMailFrom(), job.getRecipients());
            healthy = true;
            sentCounter.increment();
            log.info("Relayed message to {}", job.getRecipients());
            finish(job, true);
        } catch (SmtpDeliveryException e) {
            // A reply code means the session is still usable
            healthy = e.getReplyCode() > 0;
            handleFailure(job, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            handleFailure(job, "interrupted");
        } catch (RuntimeException e) {
            log.error("Unexpected relay error for {}", job, e);
            handleFailure(job, e.getMessage());
        } finally {
            if (connection != null) {
                pool.release(connection, healthy);
            }
        }
    }

    private void handleFailure(EmailJob job, String error) {
        if (job.canRetry() && !retryScheduler.isShutdown()) {
            int retry = job.incrementRetryCount();
            Duration delay = retryBaseDelay.multipliedBy(1L << retry);
            retriedCounter.increment();
            log.warn("Relay of {} failed ({}), retry {}/{} in {} ms",
                    job.getRecipients(), error, retry, job.getMaxRetries(), delay.toMillis());
            awaitingRetry.add(job);
            try {
                retryScheduler.schedule(() -> {
                    if (awaitingRetry.remove(job)) {
                        queue.offer(job);
                    }
                }, delay.toMillis(), TimeUnit.MILLISECONDS);
                return;
            } catch (RejectedExecutionException e) {
                // stop() shut the scheduler down after the check above
                if (!awaitingRetry.remove(job)) {
                    return;
                }
            }
        }
        log.error("Relay of {} failed after {} retries: {}", job.getRecipients(), job.getRetryCount(), error);
        failedCounter.increment();
        finish(job, false);
    }

    private void finish(EmailJob job, boolean success) {
        job.getResult().complete(success);
        if (outstanding.decrementAndGet() == 0) {
            synchronized (drainLock) {
                drainLock.notifyAll();
            }
        }
    }

    public RelayStats stats() {
        return new RelayStats(
                (long) sentCounter.count(),
                (long) failedCounter.count(),
                (long) retriedCounter.count(),
                (long) queuedCounter.count(),
                queue.size(),
                pool.idleCount(),
                pool.size(),
                running);
    }

    public boolean isRunning() {
        return running;
    }

    /** Jobs waiting in the queue, highest priority first */
    List<EmailJob> pendingJobs() {
        List<EmailJob> jobs = new ArrayList<>(queue);
        jobs.sort(null);
        return jobs;
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
