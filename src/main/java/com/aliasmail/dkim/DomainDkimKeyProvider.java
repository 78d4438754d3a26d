package com.aliasmail.dkim;

import com.aliasmail.config.AliasMailProperties;
import com.aliasmail.domain.Domain;
import com.aliasmail.mapper.DomainMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.security.KeyFactory;
import java.security.PrivateKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.util.Base64;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reads the PKCS#8 PEM key stored on the hosted domain.
 * Parsed keys are cached per (domain, selector, PEM), so a rotated key is picked up immediately.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DomainDkimKeyProvider implements DkimKeyProvider {

    private final DomainMapper domainMapper;
    private final AliasMailProperties properties;

    private final Map<String, PrivateKey> parsedKeys = new ConcurrentHashMap<>();

    @Override
    public Optional<DkimKey> findKey(String domainName) throws DkimSigningException {
        Domain domain;
        try {
            domain = domainMapper.findActiveByName(domainName.toLowerCase());
        } catch (DataAccessException e) {
            throw new DkimSigningException("DKIM key lookup failed for " + domainName + ": " + e.getMessage(), e);
        }
        if (domain == null || domain.getDkimPrivateKey() == null || domain.getDkimPrivateKey().isBlank()) {
            return Optional.empty();
        }

        String selector = domain.getDkimSelector() != null && !domain.getDkimSelector().isBlank()
                ? domain.getDkimSelector()
                : properties.getDkim().getDefaultSelector();
        String pem = domain.getDkimPrivateKey();

        String cacheKey = domain.getName() + "|" + selector + "|" + pem;
        PrivateKey privateKey = parsedKeys.get(cacheKey);
        if (privateKey == null) {
            privateKey = parsePrivateKey(pem);
            parsedKeys.put(cacheKey, privateKey);
        }
        return Optional.of(new DkimKey(domain.getName(), selector, privateKey));
    }

    /**
     * Parse an RSA private key from PKCS#8 PEM ("BEGIN PRIVATE KEY")
     */
    static PrivateKey parsePrivateKey(String pem) throws DkimSigningException {
        String base64 = pem
                .replaceAll("-----BEGIN [A-Z ]+-----", "")
                .replaceAll("-----END [A-Z ]+-----", "")
                .replaceAll("\\s", "");
        try {
            byte[] der = Base64.getDecoder().decode(base64);
            return KeyFactory.getInstance("RSA").generatePrivate(new PKCS8EncodedKeySpec(der));
        } catch (Exception e) {
            throw new DkimSigningException("Invalid DKIM private key: " + e.getMessage(), e);
        }
    }
}
