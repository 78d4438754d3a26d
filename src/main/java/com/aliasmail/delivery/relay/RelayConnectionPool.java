package com.aliasmail.delivery.relay;

import com.aliasmail.delivery.SmtpDeliveryException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed-size pool of relay connections.
 * Idle connections are health-checked on checkout and replaced when dead.
 * When every member is busy past {@code connectionWait}, a temporary connection is opened
 * and closed again on release.
 */
@Slf4j
public class RelayConnectionPool {

    private final RelayConnectionFactory factory;
    private final int poolSize;
    private final Duration connectionWait;

    private final BlockingQueue<RelayConnection> idle;
    private final Set<RelayConnection> members = ConcurrentHashMap.newKeySet();
    private final AtomicInteger memberCount = new AtomicInteger();
    private volatile boolean closed;

    public RelayConnectionPool(RelayConnectionFactory factory, int poolSize, Duration connectionWait) {
        this.factory = factory;
        this.poolSize = Math.max(1, poolSize);
        this.connectionWait = connectionWait;
        this.idle = new LinkedBlockingQueue<>(this.poolSize);
    }

    /**
     * Open connections up to the pool size. Failures are logged; the pool refills on demand.
     */
    public void prewarm() {
        closed = false;
        while (memberCount.get() < poolSize) {
            if (!reserveSlot()) {
                break;
            }
            try {
                RelayConnection connection = factory.open();
                members.add(connection);
                idle.offer(connection);
            } catch (SmtpDeliveryException e) {
                memberCount.decrementAndGet();
                log.warn("Failed to pre-warm relay connection: {}", e.getMessage());
                break;
            }
        }
        log.info("Relay connection pool ready ({}/{} connections)", idle.size(), poolSize);
    }

    public RelayConnection acquire() throws SmtpDeliveryException, InterruptedException {
        RelayConnection connection = idle.poll();
        if (connection == null && reserveSlot()) {
            return openMember();
        }
        if (connection == null) {
            connection = idle.poll(connectionWait.toMillis(), TimeUnit.MILLISECONDS);
        }
        if (connection == null) {
            log.warn("Relay connection pool exhausted after {} ms, opening temporary connection",
                    connectionWait.toMillis());
            return factory.open();
        }

        if (!connection.isAlive()) {
            log.info("Pooled relay connection failed health check, replacing");
            discard(connection);
            return reserveSlot() ? openMember() : factory.open();
        }
        return connection;
    }

    /**
     * Return a connection after use; unhealthy and temporary ones are closed
     */
    public void release(RelayConnection connection, boolean healthy) {
        if (!members.contains(connection)) {
            connection.close();
            return;
        }
        if (!healthy || closed || !idle.offer(connection)) {
            discard(connection);
        }
    }

    public void close() {
        closed = true;
        RelayConnection connection;
        while ((connection = idle.poll()) != null) {
            discard(connection);
        }
        for (RelayConnection member : members) {
            discard(member);
        }
        log.info("Relay connection pool closed");
    }

    public int idleCount() {
        return idle.size();
    }

    public int size() {
        return memberCount.get();
    }

    private RelayConnection openMember() throws SmtpDeliveryException {
        try {
            RelayConnection connection = factory.open();
            members.add(connection);
            return connection;
        } catch (SmtpDeliveryException e) {
            memberCount.decrementAndGet();
            throw e;
        }
    }

    private boolean reserveSlot() {
        while (true) {
            int current = memberCount.get();
            if (current >= poolSize) {
                return false;
            }
            if (memberCount.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    private void discard(RelayConnection connection) {
        if (members.remove(connection)) {
            memberCount.decrementAndGet();
        }
        connection.close();
    }
}
