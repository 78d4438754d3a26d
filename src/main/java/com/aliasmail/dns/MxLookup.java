package com.aliasmail.dns;

import java.util.List;

/**
 * Raw MX query against DNS.
 */
@FunctionalInterface
public interface MxLookup {

    /**
     * @return the MX answers in any order; empty when the domain exists but has no MX record
     * @throws DnsResolutionException NXDOMAIN (permanent) or any other resolver failure (temporary)
     */
    List<MxRecordEntry> lookup(String domain) throws DnsResolutionException;
}
