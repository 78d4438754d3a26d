package com.aliasmail.delivery.relay;

/**
 * Point-in-time relay counters
 */
public record RelayStats(long sent, long failed, long retried, long queued,
                         int queueSize, int idleConnections, int poolSize, boolean running) {
}
