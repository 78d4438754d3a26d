package com.aliasmail.delivery.relay;

/**
 * Relay queue at capacity; the job was not accepted
 */
public class QueueFullException extends Exception {

    public QueueFullException(int capacity) {
        super("Relay queue is full (capacity " + capacity + ")");
    }
}
