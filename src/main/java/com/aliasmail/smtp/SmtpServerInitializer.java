package com.aliasmail.smtp;

import com.aliasmail.config.AliasMailProperties;
import com.aliasmail.queue.InboundQueueProducer;
import com.aliasmail.service.InboundDeliveryHandler;
import io.micrometer.core.instrument.MeterRegistry;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.codec.DelimiterBasedFrameDecoder;
import io.netty.handler.codec.Delimiters;
import io.netty.handler.codec.string.StringDecoder;
import io.netty.handler.codec.string.StringEncoder;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.timeout.IdleStateHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

/**
 * SMTP Netty channel initializer.
 * Plain text on connect, STARTTLS upgrade via SMTP command when a TLS context is configured.
 */
@Slf4j
@RequiredArgsConstructor
public class SmtpServerInitializer extends ChannelInitializer<SocketChannel> {

    /** Longest accepted line; RFC 5321 allows 1000 but real-world mail exceeds it */
    static final int MAX_LINE_LENGTH = 65536;

    private final AliasMailProperties properties;
    private final InboundDeliveryHandler deliveryHandler;
    private final InboundQueueProducer queueProducer;
    private final SslContext sslContext;
    private final MeterRegistry meterRegistry;

    @Override
    protected void initChannel(SocketChannel ch) {
        ChannelPipeline pipeline = ch.pipeline();

        InetSocketAddress remoteAddr = ch.remoteAddress();
        String remoteIp = remoteAddr != null ? remoteAddr.getAddress().getHostAddress() : "unknown";
        pipeline.addLast("tcpLog", new ChannelInboundHandlerAdapter() {
            @Override
            public void channelActive(ChannelHandlerContext ctx) throws Exception {
                log.debug("SMTP TCP connection accepted from {}", remoteIp);
                ctx.fireChannelActive();
            }

            @Override
            public void channelInactive(ChannelHandlerContext ctx) throws Exception {
                log.debug("SMTP TCP connection closed from {}", remoteIp);
                ctx.fireChannelInactive();
            }
        });

        pipeline.addLast("idleState", new IdleStateHandler(
                0, 0, properties.getSmtp().getTimeout(), TimeUnit.MILLISECONDS));

        // ISO-8859-1 keeps 8-bit message bytes intact through the String pipeline
        pipeline.addLast("framer", new DelimiterBasedFrameDecoder(
                MAX_LINE_LENGTH, Delimiters.lineDelimiter()));
        pipeline.addLast("decoder", new StringDecoder(StandardCharsets.ISO_8859_1));
        pipeline.addLast("encoder", new StringEncoder(StandardCharsets.ISO_8859_1));

        pipeline.addLast("handler", new SmtpCommandHandler(
                properties, deliveryHandler, queueProducer, sslContext, meterRegistry));
    }
}
