package com.aliasmail;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * AliasMail forwarding mail server
 *
 * Inbound SMTP for hosted alias domains, outbound forwarding
 * - Netty-based SMTP acceptor
 * - Alias + forwarding-rule routing (MyBatis + SQLite)
 * - Direct MX delivery and smart-host relay (Jakarta Mail)
 * - DKIM signing of forwarded mail
 * - ActiveMQ inbound queue
 * - Reactor (Reactive) async delivery
 * - Prometheus metrics monitoring
 */
@SpringBootApplication
@MapperScan("com.aliasmail.mapper")
@EnableConfigurationProperties
public class AliasMailApplication {

    public static void main(String[] args) {
        SpringApplication.run(AliasMailApplication.class, args);
    }
}
