package com.aliasmail.smtp;

import com.aliasmail.config.AliasMailProperties;
import com.aliasmail.queue.InboundQueueProducer;
import com.aliasmail.service.InboundDeliveryHandler;
import com.aliasmail.util.AddressUtil;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslHandler;
import io.netty.handler.timeout.IdleStateEvent;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.List;

/**
 * Netty-based SMTP command handler for the inbound acceptor
 */
@Slf4j
public class SmtpCommandHandler extends SimpleChannelInboundHandler<String> {

    private final SmtpSession session = new SmtpSession();
    private final AliasMailProperties properties;
    private final InboundDeliveryHandler deliveryHandler;
    private final InboundQueueProducer queueProducer;
    private final SslContext sslContext;
    private final Counter mailReceivedCounter;
    private final Counter mailRejectedCounter;

    public SmtpCommandHandler(AliasMailProperties properties,
            InboundDeliveryHandler deliveryHandler,
            InboundQueueProducer queueProducer,
            SslContext sslContext,
            MeterRegistry meterRegistry) {
        this.properties = properties;
        this.deliveryHandler = deliveryHandler;
        this.queueProducer = queueProducer;
        this.sslContext = sslContext;
        this.mailReceivedCounter = Counter.builder("smtp.mail.received")
                .description("Number of mails received")
                .register(meterRegistry);
        this.mailRejectedCounter = Counter.builder("smtp.mail.rejected")
                .description("Mails refused at end of DATA")
                .register(meterRegistry);
    }

    SmtpSession getSession() {
        return session;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) {
        session.setRemoteIp(ctx.channel().remoteAddress() instanceof InetSocketAddress remoteAddr
                ? remoteAddr.getAddress().getHostAddress()
                : String.valueOf(ctx.channel().remoteAddress()));
        log.info("SMTP connection from: {}", session.getRemoteIp());
        respond(ctx, "220 " + properties.getHostname() + " " + properties.getSmtp().getBanner());
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof IdleStateEvent) {
            log.info("SMTP idle timeout for {}", session.getRemoteIp());
            ctx.writeAndFlush("421 4.4.2 " + properties.getHostname() + " Idle timeout, closing connection\r\n")
                    .addListener(future -> ctx.close());
        } else {
            super.userEventTriggered(ctx, evt);
        }
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, String msg) {
        // DATA state: preserve original line content (RFC 5321 - no trimming)
        if (session.getState() == SmtpState.DATA) {
            handleDataLine(ctx, msg);
            return;
        }

        String line = msg.trim();
        log.debug("SMTP << {}", line);

        String upperLine = line.toUpperCase();
        if (upperLine.startsWith("EHLO") || upperLine.startsWith("HELO")) {
            handleEhlo(ctx, line);
        } else if (upperLine.startsWith("MAIL FROM:")) {
            handleMailFrom(ctx, line);
        } else if (upperLine.startsWith("RCPT TO:")) {
            handleRcptTo(ctx, line);
        } else if (upperLine.equals("DATA")) {
            handleData(ctx);
        } else if (upperLine.equals("STARTTLS")) {
            handleStartTls(ctx);
        } else if (upperLine.equals("RSET")) {
            handleRset(ctx);
        } else if (upperLine.equals("NOOP")) {
            respond(ctx, "250 2.0.0 OK");
        } else if (upperLine.startsWith("VRFY")) {
            respond(ctx, "252 2.5.2 Cannot VRFY user, but will accept message and attempt delivery");
        } else if (upperLine.equals("QUIT")) {
            handleQuit(ctx);
        } else {
            respond(ctx, "500 5.5.1 Unrecognized command");
        }
    }

    // ======== EHLO / HELO ========
    private void handleEhlo(ChannelHandlerContext ctx, String line) {
        String[] parts = line.split("\\s+", 2);
        session.setClientHostname(parts.length > 1 ? parts[1] : "unknown");
        session.resetTransaction();
        session.setState(SmtpState.GREETED);

        boolean isEhlo = line.toUpperCase().startsWith("EHLO");
        if (isEhlo) {
            StringBuilder response = new StringBuilder();
            response.append("250-").append(properties.getHostname()).append(" Hello ")
                    .append(session.getClientHostname()).append("\r\n");
            response.append("250-SIZE ").append(properties.getSmtp().getMaxMessageSize()).append("\r\n");
            response.append("250-8BITMIME\r\n");
            response.append("250-PIPELINING\r\n");
            if (sslContext != null && !session.isTlsActive()) {
                response.append("250-STARTTLS\r\n");
            }
            response.append("250 ENHANCEDSTATUSCODES");
            ctx.writeAndFlush(response + "\r\n");
        } else {
            respond(ctx, "250 " + properties.getHostname() + " Hello " + session.getClientHostname());
        }
    }

    // ======== STARTTLS ========
    private void handleStartTls(ChannelHandlerContext ctx) {
        if (sslContext == null) {
            respond(ctx, "454 4.7.0 TLS not available");
            return;
        }
        if (session.isTlsActive()) {
            respond(ctx, "503 5.5.1 TLS already active");
            return;
        }
        // Send 220 in plain text FIRST, then add SslHandler after write completes
        log.info("SMTP STARTTLS initiated by {}", session.getRemoteIp());
        ctx.writeAndFlush("220 2.0.0 Ready to start TLS\r\n").addListener(future -> {
            if (future.isSuccess()) {
                SslHandler sslHandler = sslContext.newHandler(ctx.alloc());
                ctx.pipeline().addFirst("ssl", sslHandler);
                sslHandler.handshakeFuture().addListener(hsFuture -> {
                    if (hsFuture.isSuccess()) {
                        log.info("SMTP STARTTLS handshake completed for {}", session.getRemoteIp());
                    } else {
                        log.warn("SMTP STARTTLS handshake failed for {}: {}",
                                session.getRemoteIp(), hsFuture.cause().getMessage());
                        ctx.close();
                    }
                });
                session.resetAfterTls();
            } else {
                log.error("SMTP failed to send STARTTLS response to {}", session.getRemoteIp());
                ctx.close();
            }
        });
    }

    // ======== MAIL FROM ========
    private void handleMailFrom(ChannelHandlerContext ctx, String line) {
        if (session.getState() != SmtpState.GREETED) {
            respond(ctx, "503 5.5.1 Bad sequence of commands");
            return;
        }

        String from = extractAddress(line, "MAIL FROM:");
        if (from == null) {
            respond(ctx, "501 5.1.7 Syntax error in MAIL FROM address");
            return;
        }

        Long declaredSize = extractSizeParameter(line);
        if (declaredSize != null && declaredSize > properties.getSmtp().getMaxMessageSize()) {
            respond(ctx, "552 5.3.4 Message size exceeds fixed maximum message size");
            return;
        }

        // Null reverse-path (<>) is allowed for bounces
        session.setMailFrom(AddressUtil.stripAngleBrackets(from));
        session.setState(SmtpState.MAIL_FROM);
        respond(ctx, "250 2.1.0 OK");
    }

    // ======== RCPT TO ========
    private void handleRcptTo(ChannelHandlerContext ctx, String line) {
        if (session.getState() != SmtpState.MAIL_FROM && session.getState() != SmtpState.RCPT_TO) {
            respond(ctx, "503 5.5.1 Bad sequence of commands");
            return;
        }

        if (session.getRecipients().size() >= properties.getSmtp().getMaxRecipients()) {
            respond(ctx, "452 4.5.3 Too many recipients");
            return;
        }

        String to = extractAddress(line, "RCPT TO:");
        String rcptEmail = to != null ? AddressUtil.stripAngleBrackets(to) : null;
        if (rcptEmail == null || !AddressUtil.isValid(rcptEmail)) {
            respond(ctx, "501 5.1.3 Syntax error in RCPT TO address");
            return;
        }

        session.addRecipient(rcptEmail);
        session.setState(SmtpState.RCPT_TO);
        respond(ctx, "250 2.1.5 OK");
    }

    // ======== DATA ========
    private void handleData(ChannelHandlerContext ctx) {
        if (session.getState() != SmtpState.RCPT_TO) {
            respond(ctx, "503 5.5.1 Bad sequence of commands");
            return;
        }
        session.setState(SmtpState.DATA);
        respond(ctx, "354 Start mail input; end with <CRLF>.<CRLF>");
    }

    private void handleDataLine(ChannelHandlerContext ctx, String rawLine) {
        // Strip trailing CR/LF but preserve leading whitespace (RFC 5321)
        String line = rawLine;
        while (line.endsWith("\r") || line.endsWith("\n")) {
            line = line.substring(0, line.length() - 1);
        }

        if (".".equals(line)) {
            if (session.isOversized()) {
                mailRejectedCounter.increment();
                respond(ctx, "552 5.3.4 Message too large");
                session.resetTransaction();
                return;
            }
            processReceivedMail(ctx);
            return;
        }

        // Remove dot-stuffing
        String dataLine = line.startsWith("..") ? line.substring(1) : line;
        if (!session.appendData(dataLine, properties.getSmtp().getMaxMessageSize()) && session.isOversized()) {
            log.debug("SMTP message from {} exceeds {} bytes, discarding",
                    session.getRemoteIp(), properties.getSmtp().getMaxMessageSize());
        }
    }

    private void processReceivedMail(ChannelHandlerContext ctx) {
        byte[] emlData = session.getDataBytes();
        List<String> recipients = List.copyOf(session.getRecipients());
        String sender = session.getMailFrom();
        session.resetTransaction();

        if (properties.getSmtp().isQueueInbound()) {
            try {
                queueProducer.enqueue(emlData, sender, recipients);
                mailReceivedCounter.increment();
                respond(ctx, "250 2.0.0 OK: queued");
            } catch (RuntimeException e) {
                log.error("Failed to enqueue mail from {}", sender, e);
                respond(ctx, "451 4.3.0 Mail processing error");
            }
            return;
        }

        // Forwarding blocks on DB and SMTP; keep it off the event loop
        Mono.fromCallable(() -> deliveryHandler.handleData(sender, recipients, emlData))
                .subscribeOn(Schedulers.boundedElastic())
                .subscribe(
                        reply -> {
                            if (reply.startsWith("2")) {
                                mailReceivedCounter.increment();
                            } else {
                                mailRejectedCounter.increment();
                            }
                            respond(ctx, reply);
                        },
                        e -> {
                            log.error("Failed to process DATA", e);
                            respond(ctx, "451 4.3.0 Mail processing error");
                        });
    }

    // ======== RSET ========
    private void handleRset(ChannelHandlerContext ctx) {
        session.resetTransaction();
        respond(ctx, "250 2.0.0 OK");
    }

    // ======== QUIT ========
    private void handleQuit(ChannelHandlerContext ctx) {
        ctx.writeAndFlush("221 2.0.0 " + properties.getHostname() + " closing connection\r\n")
                .addListener(future -> ctx.close());
    }

    // ======== Utilities ========
    private void respond(ChannelHandlerContext ctx, String response) {
        log.debug("SMTP >> {}", response);
        ctx.writeAndFlush(response + "\r\n");
    }

    static String extractAddress(String line, String prefix) {
        int idx = line.toUpperCase().indexOf(prefix.toUpperCase());
        if (idx < 0)
            return null;
        String addr = line.substring(idx + prefix.length()).trim();
        // Strip ESMTP parameters (SIZE=, BODY=)
        int spaceIdx = addr.indexOf(' ');
        if (spaceIdx > 0)
            addr = addr.substring(0, spaceIdx);
        return addr.isEmpty() ? null : addr;
    }

    static Long extractSizeParameter(String line) {
        for (String token : line.split("\\s+")) {
            if (token.toUpperCase().startsWith("SIZE=")) {
                try {
                    return Long.parseLong(token.substring(5));
                } catch (NumberFormatException e) {
                    return null;
                }
            }
        }
        return null;
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        String ip = session.getRemoteIp();
        if (cause instanceof IOException) {
            log.debug("SMTP connection reset from {}: {}", ip, cause.getMessage());
            ctx.close();
            return;
        }
        log.error("SMTP error from {}: {}", ip, cause.getMessage(), cause);
        if (ctx.channel().isActive()) {
            session.resetTransaction();
            respond(ctx, "451 4.3.0 Internal error, transaction reset");
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) {
        log.info("SMTP connection closed: {}", session.getRemoteIp());
    }
}
