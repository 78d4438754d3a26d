package com.aliasmail.smtp;

import com.aliasmail.config.AliasMailProperties;
import com.aliasmail.queue.InboundQueueProducer;
import com.aliasmail.service.InboundDeliveryHandler;
import io.micrometer.core.instrument.MeterRegistry;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import io.netty.handler.ssl.SslContext;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Netty-based inbound SMTP server
 * - ESMTP with SIZE, 8BITMIME, PIPELINING
 * - Optional STARTTLS
 * - Accepted messages go to the inbound queue or straight to the delivery handler
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "aliasmail.smtp.enabled", havingValue = "true", matchIfMissing = true)
public class SmtpServer {

    private final AliasMailProperties properties;
    private final InboundDeliveryHandler deliveryHandler;
    private final InboundQueueProducer queueProducer;
    private final SslContext sslContext;
    private final MeterRegistry meterRegistry;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public SmtpServer(AliasMailProperties properties,
            InboundDeliveryHandler deliveryHandler,
            InboundQueueProducer queueProducer,
            @Autowired(required = false) @Nullable SslContext sslContext,
            MeterRegistry meterRegistry) {
        this.properties = properties;
        this.deliveryHandler = deliveryHandler;
        this.queueProducer = queueProducer;
        this.sslContext = sslContext;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void start() {
        Mono.fromRunnable(this::startServer)
                .subscribeOn(Schedulers.boundedElastic())
                .subscribe();
    }

    private void startServer() {
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();

        try {
            ServerBootstrap bootstrap = new ServerBootstrap();
            bootstrap.group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .handler(new LoggingHandler(LogLevel.INFO))
                    .childHandler(new SmtpServerInitializer(
                            properties, deliveryHandler, queueProducer, sslContext, meterRegistry))
                    .option(ChannelOption.SO_BACKLOG, 128)
                    .childOption(ChannelOption.SO_KEEPALIVE, true)
                    .childOption(ChannelOption.TCP_NODELAY, true);

            serverChannel = bootstrap.bind(properties.getSmtp().getPort()).sync().channel();
            log.info("=== SMTP Server started on port {} ===", properties.getSmtp().getPort());
            log.info("Hostname: {} | STARTTLS: {} | Inbound queue: {}",
                    properties.getHostname(), sslContext != null, properties.getSmtp().isQueueInbound());

            serverChannel.closeFuture().addListener(future -> log.info("SMTP Server channel closed"));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("SMTP Server start interrupted", e);
        }
    }

    @PreDestroy
    public void stop() {
        log.info("Shutting down SMTP Server...");
        if (serverChannel != null) {
            serverChannel.close();
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
        }
    }
}
