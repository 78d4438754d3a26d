package com.aliasmail.dns;

/**
 * MX resolution failure.
 * Permanent for NXDOMAIN (the domain does not exist), temporary otherwise.
 */
public class DnsResolutionException extends Exception {

    private final String domain;
    private final boolean permanent;

    public DnsResolutionException(String domain, String message, boolean permanent) {
        super(message);
        this.domain = domain;
        this.permanent = permanent;
    }

    public DnsResolutionException(String domain, String message, boolean permanent, Throwable cause) {
        super(message, cause);
        this.domain = domain;
        this.permanent = permanent;
    }

    public static DnsResolutionException nxdomain(String domain) {
        return new DnsResolutionException(domain, "Domain does not exist: " + domain, true);
    }

    public String getDomain() {
        return domain;
    }

    public boolean isPermanent() {
        return permanent;
    }
}
