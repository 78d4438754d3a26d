package com.aliasmail.dns;

/**
 * One MX answer: preference (lower is tried first) and exchange host
 */
public record MxRecordEntry(int preference, String host) {
}
