package com.aliasmail.delivery;

/**
 * Relay queue priority. Declaration order is dequeue order.
 */
public enum EmailPriority {
    HIGH,
    NORMAL,
    LOW
}
