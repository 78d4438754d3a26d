package com.aliasmail.delivery.direct;

import com.aliasmail.delivery.SmtpDeliveryException;
import com.aliasmail.delivery.TemporarySmtpException;
import jakarta.mail.Address;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayInputStream;
import java.time.Duration;
import java.util.Properties;

/**
 * Direct MX transport over Jakarta Mail (Angus SMTP)
 */
@Slf4j
public class JakartaMailMxTransport implements MxTransport {

    private final String heloHostname;
    private final int port;
    private final Duration connectTimeout;
    private final Duration readTimeout;

    public JakartaMailMxTransport(String heloHostname, int port, Duration connectTimeout, Duration readTimeout) {
        this.heloHostname = heloHostname;
        this.port = port;
        this.connectTimeout = connectTimeout;
        this.readTimeout = readTimeout;
    }

    @Override
    public void send(String mxHost, byte[] message, String mailFrom, String recipient) throws SmtpDeliveryException {
        Properties props = new Properties();
        props.put("mail.smtp.host", mxHost);
        props.put("mail.smtp.port", String.valueOf(port));
        props.put("mail.smtp.connectiontimeout", String.valueOf(connectTimeout.toMillis()));
        props.put("mail.smtp.timeout", String.valueOf(readTimeout.toMillis()));
        props.put("mail.smtp.writetimeout", String.valueOf(readTimeout.toMillis()));
        props.put("mail.smtp.localhost", heloHostname);
        props.put("mail.smtp.starttls.enable", "true");
        props.put("mail.smtp.starttls.required", "false");
        if (mailFrom != null && !mailFrom.isBlank()) {
            props.put("mail.smtp.from", mailFrom);
        }

        try {
            Session session = Session.getInstance(props);
            MimeMessage mimeMessage = new MimeMessage(session, new ByteArrayInputStream(message));

            Transport transport = session.getTransport("smtp");
            try {
                transport.connect(mxHost, port, null, null);
                transport.sendMessage(mimeMessage, new Address[]{new InternetAddress(recipient)});
                log.debug("Mail for {} accepted by {}", recipient, mxHost);
            } finally {
                transport.close();
            }
        } catch (MessagingException e) {
            throw SmtpErrorClassifier.classify(mxHost, e);
        } catch (RuntimeException e) {
            throw new TemporarySmtpException(-1, mxHost + ": " + e.getMessage(), e);
        }
    }
}
