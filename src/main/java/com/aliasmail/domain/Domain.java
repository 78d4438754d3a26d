package com.aliasmail.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Hosted mail domain
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Domain {

    private Long id;
    private String name;
    private Long userId;            // Owning user
    private String dkimPrivateKey;  // PKCS#8 PEM, null when not provisioned
    private String dkimSelector;
    private String catchAllEmail;
    private boolean deleted;

    public boolean hasCatchAll() {
        return catchAllEmail != null && !catchAllEmail.isBlank();
    }
}
