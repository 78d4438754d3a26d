package com.aliasmail.config;

import com.aliasmail.delivery.DeliveryMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * AliasMail server configuration properties
 */
@Data
@Component
@ConfigurationProperties(prefix = "aliasmail")
public class AliasMailProperties {

    /** Sending hostname (FQDN) used in EHLO and banners */
    private String hostname = "mail.localhost";

    private Smtp smtp = new Smtp();
    private Delivery delivery = new Delivery();
    private Relay relay = new Relay();
    private Dns dns = new Dns();
    private Dkim dkim = new Dkim();
    private Queue queue = new Queue();
    private Notification notification = new Notification();
    private Tls tls = new Tls();

    @Data
    public static class Smtp {
        private boolean enabled = true;
        private int port = 2525;
        private long maxMessageSize = 26214400L; // 25MB
        private int maxRecipients = 100;
        private long timeout = 300000L;
        private String banner = "AliasMail ESMTP Ready";
        /** Hand accepted messages to the inbound queue instead of forwarding in-session */
        private boolean queueInbound = true;
    }

    @Data
    public static class Delivery {
        private DeliveryMode mode = DeliveryMode.DIRECT;
        private boolean dkimEnabled = true;
        /** Destination port for direct MX delivery */
        private int port = 25;
        private Duration connectTimeout = Duration.ofSeconds(30);
        private Duration readTimeout = Duration.ofSeconds(30);
        private int maxRetries = 3;
        /** Backoff unit: attempt n waits 2^n * retryBaseDelay */
        private Duration retryBaseDelay = Duration.ofSeconds(1);
        /** Connection starts per minute per destination domain */
        private int rateLimitPerDomain = 10;
    }

    @Data
    public static class Relay {
        private String host = "localhost";
        private int port = 587;
        private String username;
        private String password;
        private boolean useTls = true;
        private int poolSize = 5;
        private int maxQueueSize = 1000;
        /** Sends per minute across all destinations */
        private int rateLimit = 100;
        private int workers = 3;
        private int maxRetries = 3;
        private Duration retryBaseDelay = Duration.ofSeconds(1);
        private Duration connectionWait = Duration.ofSeconds(30);
        private Duration timeout = Duration.ofSeconds(30);

        public boolean hasCredentials() {
            return username != null && !username.isBlank()
                    && password != null && !password.isBlank();
        }
    }

    @Data
    public static class Dns {
        private Duration mxCacheTtl = Duration.ofHours(1);
        private Duration timeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Dkim {
        private String defaultSelector = "aliasmail";
    }

    @Data
    public static class Queue {
        private String inboundDestination = "mail.inbound.queue";
    }

    @Data
    public static class Notification {
        private boolean enabled = true;
        private String from = "noreply@localhost";
    }

    @Data
    public static class Tls {
        private boolean enabled = false;
        private String keystorePath = "config/keystore.jks";
        private String keystoreType = "PKCS12";
        private String keystorePassword = "changeit";
        private String keyPassword = "changeit";
    }
}
