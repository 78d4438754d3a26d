package com.aliasmail.delivery.relay;

import com.aliasmail.delivery.SmtpDeliveryException;

import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory smart host. Failures queued with {@link #failNext} are thrown by the next sends;
 * {@link #hold()} makes sends block until {@link #resume()}.
 */
class ScriptedRelay implements RelayConnectionFactory {

    final List<List<String>> delivered = new CopyOnWriteArrayList<>();
    final List<Connection> opened = new CopyOnWriteArrayList<>();
    final AtomicInteger sendCalls = new AtomicInteger();
    private final Queue<SmtpDeliveryException> failures = new ConcurrentLinkedQueue<>();
    private volatile CountDownLatch gate;
    private final CountDownLatch entered = new CountDownLatch(1);

    void failNext(SmtpDeliveryException failure) {
        failures.add(failure);
    }

    void hold() {
        gate = new CountDownLatch(1);
    }

    void resume() {
        gate.countDown();
    }

    boolean awaitFirstSend() throws InterruptedException {
        return entered.await(5, TimeUnit.SECONDS);
    }

    @Override
    public RelayConnection open() {
        Connection connection = new Connection();
        opened.add(connection);
        return connection;
    }

    class Connection implements RelayConnection {

        volatile boolean alive = true;
        volatile boolean closed;

        @Override
        public boolean isAlive() {
            return alive && !closed;
        }

        @Override
        public void send(byte[] message, String mailFrom, List<String> recipients) throws SmtpDeliveryException {
            sendCalls.incrementAndGet();
            entered.countDown();
            CountDownLatch current = gate;
            if (current != null) {
                try {
                    current.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            SmtpDeliveryException failure = failures.poll();
            if (failure != null) {
                throw failure;
            }
            delivered.add(recipients);
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
