package com.aliasmail.config;

import io.netty.handler.ssl.ClientAuth;
import io.netty.handler.ssl.OpenSsl;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.SslProvider;
import io.netty.handler.ssl.SupportedCipherSuiteFilter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;

import javax.net.ssl.KeyManagerFactory;
import java.io.FileInputStream;
import java.io.InputStream;
import java.security.KeyStore;

/**
 * Server-side TLS for inbound STARTTLS
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class NettyConfig {

    private final AliasMailProperties properties;

    @Bean
    @ConditionalOnProperty(name = "aliasmail.tls.enabled", havingValue = "true")
    public SslContext sslContext() {
        AliasMailProperties.Tls tls = properties.getTls();
        try {
            KeyStore keyStore = KeyStore.getInstance(tls.getKeystoreType());
            String keystorePath = tls.getKeystorePath();
            if (keystorePath.startsWith("classpath:")) {
                try (InputStream is = new ClassPathResource(keystorePath.substring("classpath:".length()))
                        .getInputStream()) {
                    keyStore.load(is, tls.getKeystorePassword().toCharArray());
                }
            } else {
                try (FileInputStream fis = new FileInputStream(keystorePath)) {
                    keyStore.load(fis, tls.getKeystorePassword().toCharArray());
                }
            }

            KeyManagerFactory kmf = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
            kmf.init(keyStore, tls.getKeyPassword().toCharArray());

            SslProvider provider = OpenSsl.isAvailable() ? SslProvider.OPENSSL : SslProvider.JDK;
            SslContext ctx = SslContextBuilder.forServer(kmf)
                    .sslProvider(provider)
                    .protocols("TLSv1.2", "TLSv1.3")
                    .ciphers(null, SupportedCipherSuiteFilter.INSTANCE)
                    .clientAuth(ClientAuth.NONE)
                    .build();
            log.info("Inbound STARTTLS context initialized (keystore: {}, provider: {})", keystorePath, provider);
            return ctx;
        } catch (Exception e) {
            log.error("Failed to initialize SSL context: {}", e.getMessage());
            throw new IllegalStateException("SSL context initialization failed", e);
        }
    }
}
