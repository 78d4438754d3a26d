package com.aliasmail.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Domain owner as seen by the failure notifier
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationRecipient {

    private Long userId;
    private String email;
    private boolean notifyOnForwardFailure;
}
