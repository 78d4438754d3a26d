package com.aliasmail.dkim;

import java.util.Optional;

/**
 * Source of DKIM signing keys per sending domain
 */
@FunctionalInterface
public interface DkimKeyProvider {

    /**
     * @return the key for {@code domain}, empty when the domain has none provisioned
     * @throws DkimSigningException the stored key cannot be parsed
     */
    Optional<DkimKey> findKey(String domain) throws DkimSigningException;
}
