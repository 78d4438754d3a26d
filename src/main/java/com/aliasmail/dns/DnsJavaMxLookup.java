package com.aliasmail.dns;

import lombok.extern.slf4j.Slf4j;
import org.xbill.DNS.Lookup;
import org.xbill.DNS.MXRecord;
import org.xbill.DNS.Record;
import org.xbill.DNS.Resolver;
import org.xbill.DNS.SimpleResolver;
import org.xbill.DNS.TextParseException;
import org.xbill.DNS.Type;

import java.net.UnknownHostException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * MX lookup backed by dnsjava, using the system resolver configuration
 */
@Slf4j
public class DnsJavaMxLookup implements MxLookup {

    private final Duration timeout;

    public DnsJavaMxLookup(Duration timeout) {
        this.timeout = timeout;
    }

    @Override
    public List<MxRecordEntry> lookup(String domain) throws DnsResolutionException {
        Lookup lookup;
        try {
            lookup = new Lookup(domain, Type.MX);
            Resolver resolver = new SimpleResolver();
            resolver.setTimeout(timeout);
            lookup.setResolver(resolver);
        } catch (TextParseException e) {
            throw new DnsResolutionException(domain, "Invalid domain name: " + domain, true, e);
        } catch (UnknownHostException e) {
            throw new DnsResolutionException(domain, "No DNS resolver available", false, e);
        }

        Record[] records = lookup.run();
        switch (lookup.getResult()) {
            case Lookup.SUCCESSFUL -> {
                List<MxRecordEntry> entries = new ArrayList<>();
                if (records != null) {
                    for (Record record : records) {
                        if (record instanceof MXRecord mx) {
                            entries.add(new MxRecordEntry(mx.getPriority(), mx.getTarget().toString(true)));
                        }
                    }
                }
                return entries;
            }
            case Lookup.TYPE_NOT_FOUND -> {
                log.debug("No MX records for {}", domain);
                return List.of();
            }
            case Lookup.HOST_NOT_FOUND -> throw DnsResolutionException.nxdomain(domain);
            default -> throw new DnsResolutionException(domain,
                    "MX lookup failed for " + domain + ": " + lookup.getErrorString(), false);
        }
    }
}
