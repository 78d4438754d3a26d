package com.aliasmail.controller;

import com.aliasmail.config.AliasMailProperties;
import com.aliasmail.delivery.HybridDeliveryCoordinator;
import com.aliasmail.dkim.DkimKeyGenerator;
import com.aliasmail.dns.MxResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Server diagnostic endpoint.
 * GET /api/diagnostic shows configuration, SMTP port status and delivery statistics.
 */
@Slf4j
@RestController
@RequestMapping("/api/diagnostic")
@RequiredArgsConstructor
public class DiagnosticController {

    private final AliasMailProperties properties;
    private final HybridDeliveryCoordinator coordinator;
    private final MxResolver mxResolver;

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> diagnostic() {
        Map<String, Object> result = new LinkedHashMap<>();

        Map<String, Object> config = new LinkedHashMap<>();
        config.put("hostname", properties.getHostname());
        config.put("configuredMode", coordinator.getConfiguredMode().name().toLowerCase());
        config.put("effectiveMode", coordinator.getMode().name().toLowerCase());
        config.put("dkimEnabled", coordinator.isDkimEnabled());
        config.put("hasRelay", coordinator.hasRelay());
        config.put("relayHost", properties.getRelay().getHost() + ":" + properties.getRelay().getPort());
        config.put("queueInbound", properties.getSmtp().isQueueInbound());
        config.put("tlsEnabled", properties.getTls().isEnabled());
        result.put("config", config);

        result.put("smtp", checkPort("SMTP", properties.getSmtp().getPort()));
        result.put("delivery", coordinator.stats());
        result.put("mxCacheSize", mxResolver.cacheSize());

        log.info("Diagnostic check performed");
        return result;
    }

    @PostMapping(path = "/mx-cache/clear", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> clearMxCache() {
        int cleared = mxResolver.cacheSize();
        mxResolver.clear();
        return Map.of("cleared", cleared);
    }

    /**
     * Fresh DKIM key pair and the TXT record to publish for it
     */
    @PostMapping(path = "/dkim/keys", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> generateDkimKeys(@RequestParam String domain,
                                                @RequestParam(required = false) String selector) {
        String effectiveSelector = selector != null && !selector.isBlank()
                ? selector
                : properties.getDkim().getDefaultSelector();
        DkimKeyGenerator.PemKeyPair keyPair = DkimKeyGenerator.generate();

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("selector", effectiveSelector);
        result.put("privateKey", keyPair.privateKeyPem());
        result.put("dnsName", DkimKeyGenerator.dnsRecordName(effectiveSelector, domain));
        String dnsValue = DkimKeyGenerator.dnsRecordValue(keyPair.publicKeyBase64());
        result.put("dnsValue", dnsValue);
        // Most DNS panels want the value pre-split into 255-character strings
        result.put("dnsValueSegments", DkimKeyGenerator.splitTxtValue(dnsValue));
        log.info("Generated DKIM key pair for {} (selector: {})", domain, effectiveSelector);
        return result;
    }

    private Map<String, Object> checkPort(String name, int port) {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("name", name);
        status.put("port", port);

        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress("127.0.0.1", port), 2000);
            status.put("localListening", true);
            status.put("status", "OK - port is listening");
        } catch (IOException e) {
            status.put("localListening", false);
            status.put("status", "FAIL - " + e.getMessage());
        }

        return status;
    }
}
