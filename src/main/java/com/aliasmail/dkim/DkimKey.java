package com.aliasmail.dkim;

import java.security.PrivateKey;

/**
 * Signing identity: {@code d=} domain, {@code s=} selector and the RSA private key
 */
public record DkimKey(String domain, String selector, PrivateKey privateKey) {
}
