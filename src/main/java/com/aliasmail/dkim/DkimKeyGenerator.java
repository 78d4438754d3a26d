package com.aliasmail.dkim;

import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * RSA key pairs for DKIM provisioning and the matching DNS TXT record
 */
public final class DkimKeyGenerator {

    public static final int DEFAULT_KEY_SIZE = 2048;
    public static final int MIN_KEY_SIZE = 1024;
    /** Longest character-string a single TXT segment may hold */
    public static final int TXT_SEGMENT_LENGTH = 255;

    private DkimKeyGenerator() {}

    /**
     * PEM encoded pair: PKCS#8 private key and X.509 SubjectPublicKeyInfo public key
     */
    public record PemKeyPair(String privateKeyPem, String publicKeyPem, String publicKeyBase64) {
    }

    public static PemKeyPair generate() {
        return generate(DEFAULT_KEY_SIZE);
    }

    public static PemKeyPair generate(int keySize) {
        if (keySize < MIN_KEY_SIZE) {
            throw new IllegalArgumentException("DKIM key size must be at least " + MIN_KEY_SIZE + " bits");
        }
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
            generator.initialize(keySize);
            KeyPair pair = generator.generateKeyPair();
            String publicBase64 = Base64.getEncoder().encodeToString(pair.getPublic().getEncoded());
            return new PemKeyPair(
                    toPem("PRIVATE KEY", pair.getPrivate().getEncoded()),
                    toPem("PUBLIC KEY", pair.getPublic().getEncoded()),
                    publicBase64);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("RSA not available", e);
        }
    }

    /**
     * TXT value published at {@code selector._domainkey.domain}
     */
    public static String dnsRecordValue(String publicKeyBase64) {
        return "v=DKIM1; k=rsa; p=" + publicKeyBase64;
    }

    public static String dnsRecordName(String selector, String domain) {
        return selector + "._domainkey." + domain;
    }

    /**
     * Split a long TXT value into 255-character strings
     */
    public static List<String> splitTxtValue(String value) {
        List<String> segments = new ArrayList<>();
        for (int i = 0; i < value.length(); i += TXT_SEGMENT_LENGTH) {
            segments.add(value.substring(i, Math.min(value.length(), i + TXT_SEGMENT_LENGTH)));
        }
        return segments;
    }

    static String toPem(String type, byte[] der) {
        String base64 = Base64.getMimeEncoder(64, "\n".getBytes()).encodeToString(der);
        return "-----BEGIN " + type + "-----\n" + base64 + "\n-----END " + type + "-----\n";
    }
}
