package com.aliasmail.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Alias (local part on a hosted domain) and its forwarding targets
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Alias {

    private Long id;
    private Long domainId;
    private String localPart;
    private String targets;     // Comma-separated, ordered
    private Instant expiresAt;
    private boolean deleted;
}
