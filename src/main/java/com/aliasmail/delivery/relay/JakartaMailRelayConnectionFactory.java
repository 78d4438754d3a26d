package com.aliasmail.delivery.relay;

import com.aliasmail.delivery.SmtpDeliveryException;
import com.aliasmail.delivery.TemporarySmtpException;
import com.aliasmail.delivery.direct.SmtpErrorClassifier;
import jakarta.mail.Address;
import jakarta.mail.AuthenticationFailedException;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.angus.mail.smtp.SMTPMessage;

import java.io.ByteArrayInputStream;
import java.time.Duration;
import java.util.List;
import java.util.Properties;

/**
 * Smart-host connections over Jakarta Mail with SMTP AUTH
 */
@Slf4j
public class JakartaMailRelayConnectionFactory implements RelayConnectionFactory {

    private static final int SMTPS_PORT = 465;

    private final String host;
    private final int port;
    private final String username;
    private final String password;
    private final Session session;

    public JakartaMailRelayConnectionFactory(String host, int port, String username, String password,
                                             boolean useTls, String heloHostname, Duration timeout) {
        this.host = host;
        this.port = port;
        this.username = username;
        this.password = password;

        Properties props = new Properties();
        props.put("mail.smtp.host", host);
        props.put("mail.smtp.port", String.valueOf(port));
        props.put("mail.smtp.auth", "true");
        props.put("mail.smtp.localhost", heloHostname);
        props.put("mail.smtp.connectiontimeout", String.valueOf(timeout.toMillis()));
        props.put("mail.smtp.timeout", String.valueOf(timeout.toMillis()));
        props.put("mail.smtp.writetimeout", String.valueOf(timeout.toMillis()));
        if (useTls && port == SMTPS_PORT) {
            props.put("mail.smtp.ssl.enable", "true");
        } else if (useTls) {
            props.put("mail.smtp.starttls.enable", "true");
            props.put("mail.smtp.starttls.required", "true");
        }
        this.session = Session.getInstance(props);
    }

    @Override
    public RelayConnection open() throws SmtpDeliveryException {
        try {
            Transport transport = session.getTransport("smtp");
            transport.connect(host, port, username, password);
            log.debug("Relay connection opened to {}:{}", host, port);
            return new TransportRelayConnection(transport);
        } catch (AuthenticationFailedException e) {
            throw new TemporarySmtpException(535, "Relay authentication failed for " + username + "@" + host, e);
        } catch (MessagingException e) {
            throw SmtpErrorClassifier.classify(host, e);
        }
    }

    private final class TransportRelayConnection implements RelayConnection {

        private final Transport transport;

        private TransportRelayConnection(Transport transport) {
            this.transport = transport;
        }

        @Override
        public boolean isAlive() {
            // SMTPTransport.isConnected issues a NOOP
            return transport.isConnected();
        }

        @Override
        public void send(byte[] message, String mailFrom, List<String> recipients) throws SmtpDeliveryException {
            try {
                SMTPMessage smtpMessage = new SMTPMessage(session, new ByteArrayInputStream(message));
                if (mailFrom != null && !mailFrom.isBlank()) {
                    smtpMessage.setEnvelopeFrom(mailFrom);
                }
                Address[] addresses = new Address[recipients.size()];
                for (int i = 0; i < recipients.size(); i++) {
                    addresses[i] = new InternetAddress(recipients.get(i));
                }
                transport.sendMessage(smtpMessage, addresses);
            } catch (MessagingException e) {
                throw SmtpErrorClassifier.classify(host, e);
            }
        }

        @Override
        public void close() {
            try {
                transport.close();
            } catch (MessagingException e) {
                log.debug("Error closing relay connection to {}: {}", host, e.getMessage());
            }
        }
    }
}
