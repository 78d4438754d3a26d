package com.aliasmail.dkim;

import com.aliasmail.util.AddressUtil;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.Signature;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;

/**
 * Adds a {@code DKIM-Signature} header (rsa-sha256, relaxed/relaxed) for the envelope sender's domain.
 * A message whose domain has no key, or that cannot be signed, is returned untouched.
 */
@Slf4j
public class DkimSigner {

    static final List<String> SIGNED_HEADERS =
            List.of("from", "to", "subject", "date", "message-id", "content-type");

    private final DkimKeyProvider keyProvider;
    private final Clock clock;
    private final Counter signedCounter;
    private final Counter unsignedCounter;

    public DkimSigner(DkimKeyProvider keyProvider, Clock clock, MeterRegistry meterRegistry) {
        this.keyProvider = keyProvider;
        this.clock = clock;
        this.signedCounter = Counter.builder("aliasmail.dkim.signed")
                .description("Messages signed with DKIM")
                .register(meterRegistry);
        this.unsignedCounter = Counter.builder("aliasmail.dkim.unsigned")
                .description("Messages sent without a DKIM signature")
                .register(meterRegistry);
    }

    /**
     * Sign {@code message} with the key of {@code mailFrom}'s domain
     *
     * @return the signed message, or the original array when no signature was added
     */
    public byte[] sign(byte[] message, String mailFrom) {
        String domain = AddressUtil.extractDomain(AddressUtil.stripAngleBrackets(mailFrom));
        if (domain == null) {
            log.warn("Could not extract domain from {}, sending unsigned", mailFrom);
            unsignedCounter.increment();
            return message;
        }

        try {
            Optional<DkimKey> key = keyProvider.findKey(domain);
            if (key.isEmpty()) {
                log.debug("No DKIM key found for {}, sending unsigned", domain);
                unsignedCounter.increment();
                return message;
            }
            byte[] signed = sign(message, key.get());
            signedCounter.increment();
            log.info("DKIM signature added for domain {} (selector: {})", domain, key.get().selector());
            return signed;
        } catch (DkimSigningException e) {
            log.error("DKIM signing failed for {}: {}", domain, e.getMessage());
            unsignedCounter.increment();
            return message;
        } catch (RuntimeException e) {
            log.error("Unexpected DKIM signing error for {}, sending unsigned", domain, e);
            unsignedCounter.increment();
            return message;
        }
    }

    /**
     * Count a message that went out unsigned because signing is switched off
     */
    public void recordUnsigned() {
        unsignedCounter.increment();
    }

    public long signedCount() {
        return (long) signedCounter.count();
    }

    public long unsignedCount() {
        return (long) unsignedCounter.count();
    }

    /**
     * Sign with an explicit key. Line endings are normalized to CRLF in the returned message.
     */
    public byte[] sign(byte[] message, DkimKey key) throws DkimSigningException {
        // ISO-8859-1 maps every byte to one char, so the body bytes survive untouched
        String raw = normalizeLineEndings(new String(message, StandardCharsets.ISO_8859_1));
        int split = raw.indexOf("\r\n\r\n");
        String headerSection = split >= 0 ? raw.substring(0, split + 2) : raw;
        String body = split >= 0 ? raw.substring(split + 4) : "";

        List<String[]> headers = parseHeaders(headerSection);

        List<String> signedNames = new ArrayList<>();
        StringBuilder canonicalHeaders = new StringBuilder();
        for (String name : SIGNED_HEADERS) {
            String[] header = lastOccurrence(headers, name);
            if (header != null) {
                signedNames.add(name);
                canonicalHeaders.append(RelaxedCanonicalizer.header(header[0], header[1]));
            }
        }
        if (!signedNames.contains("from")) {
            throw new DkimSigningException("Message has no From header");
        }

        String bodyHash = base64(sha256(RelaxedCanonicalizer.body(body)));

        List<String> tags = List.of(
                "v=1",
                "a=rsa-sha256",
                "c=relaxed/relaxed",
                "d=" + key.domain(),
                "s=" + key.selector(),
                "t=" + clock.instant().getEpochSecond(),
                "bh=" + bodyHash,
                "h=" + String.join(":", signedNames),
                "b=");
        String unsignedValue = String.join("; ", tags);

        // The signature header itself is hashed last, without its trailing CRLF
        String canonicalSignatureHeader = RelaxedCanonicalizer.header("DKIM-Signature", unsignedValue);
        canonicalHeaders.append(canonicalSignatureHeader, 0, canonicalSignatureHeader.length() - 2);

        String signature;
        try {
            Signature rsa = Signature.getInstance("SHA256withRSA");
            rsa.initSign(key.privateKey());
            rsa.update(canonicalHeaders.toString().getBytes(StandardCharsets.ISO_8859_1));
            signature = base64(rsa.sign());
        } catch (Exception e) {
            throw new DkimSigningException("RSA signature failed: " + e.getMessage(), e);
        }

        String header = "DKIM-Signature: " + String.join(";\r\n\t", tags) + signature + "\r\n";
        return (header + raw).getBytes(StandardCharsets.ISO_8859_1);
    }

    /**
     * Header fields as [name, value] pairs; continuation lines stay in the value
     */
    static List<String[]> parseHeaders(String headerSection) {
        List<String[]> headers = new ArrayList<>();
        StringBuilder current = null;
        for (String line : headerSection.split("\r\n")) {
            if (line.isEmpty()) {
                continue;
            }
            if ((line.charAt(0) == ' ' || line.charAt(0) == '\t') && current != null) {
                current.append("\r\n").append(line);
            } else {
                if (current != null) {
                    headers.add(splitField(current.toString()));
                }
                current = new StringBuilder(line);
            }
        }
        if (current != null) {
            headers.add(splitField(current.toString()));
        }
        return headers;
    }

    private static String[] splitField(String field) {
        int colon = field.indexOf(':');
        if (colon < 0) {
            return new String[]{field, ""};
        }
        return new String[]{field.substring(0, colon), field.substring(colon + 1)};
    }

    private static String[] lastOccurrence(List<String[]> headers, String name) {
        for (int i = headers.size() - 1; i >= 0; i--) {
            if (headers.get(i)[0].trim().equalsIgnoreCase(name)) {
                return headers.get(i);
            }
        }
        return null;
    }

    private static String normalizeLineEndings(String s) {
        return s.replace("\r\n", "\n").replace("\r", "\n").replace("\n", "\r\n");
    }

    private static byte[] sha256(String data) throws DkimSigningException {
        try {
            return MessageDigest.getInstance("SHA-256").digest(data.getBytes(StandardCharsets.ISO_8859_1));
        } catch (Exception e) {
            throw new DkimSigningException("SHA-256 unavailable", e);
        }
    }

    private static String base64(byte[] data) {
        return Base64.getEncoder().encodeToString(data);
    }
}
