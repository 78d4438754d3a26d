package com.aliasmail.delivery.direct;

import com.aliasmail.delivery.SmtpDeliveryException;
import jakarta.mail.Address;
import jakarta.mail.MessagingException;
import jakarta.mail.SendFailedException;
import jakarta.mail.internet.InternetAddress;
import org.eclipse.angus.mail.smtp.SMTPAddressFailedException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.SocketTimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * SMTP failure classification tests
 */
class SmtpErrorClassifierTest {

    @Test
    @DisplayName("5xx recipient rejection is permanent")
    void testPermanentReply() throws Exception {
        SMTPAddressFailedException cause = new SMTPAddressFailedException(
                new InternetAddress("nobody@target.com"), "RCPT TO", 550, "5.1.1 User unknown");
        SendFailedException e = new SendFailedException("Invalid Addresses", cause);

        SmtpDeliveryException result = SmtpErrorClassifier.classify("mx.target.com", e);

        assertThat(result.isPermanent()).isTrue();
        assertThat(result.getReplyCode()).isEqualTo(550);
        assertThat(result.getMessage()).startsWith("mx.target.com: ");
    }

    @Test
    @DisplayName("4xx reply is temporary")
    void testTemporaryReply() throws Exception {
        SMTPAddressFailedException cause = new SMTPAddressFailedException(
                new InternetAddress("user@target.com"), "RCPT TO", 451, "4.7.1 Greylisted");

        SmtpDeliveryException result = SmtpErrorClassifier.classify("mx.target.com",
                new MessagingException("Send failed", cause));

        assertThat(result.isPermanent()).isFalse();
        assertThat(result.getReplyCode()).isEqualTo(451);
    }

    @Test
    @DisplayName("Connection problems without a reply are temporary")
    void testNetworkErrorTemporary() {
        SmtpDeliveryException result = SmtpErrorClassifier.classify("mx.target.com",
                new MessagingException("Could not connect to SMTP host", new SocketTimeoutException("timed out")));

        assertThat(result.isPermanent()).isFalse();
        assertThat(result.getReplyCode()).isEqualTo(-1);
        assertThat(result.getMessage()).contains("timed out");
    }

    @Test
    @DisplayName("Refused recipient without a reply code is permanent")
    void testInvalidAddressesPermanent() throws Exception {
        SendFailedException e = new SendFailedException("Invalid Addresses", null,
                new Address[0], new Address[0], new Address[] {new InternetAddress("nobody@target.com")});

        assertThat(SmtpErrorClassifier.classify("mx.target.com", e).isPermanent()).isTrue();
    }

    @Test
    @DisplayName("Failure text alone does not make an error permanent")
    void testMessageTextIgnored() {
        SmtpDeliveryException result = SmtpErrorClassifier.classify("mx.target.com",
                new MessagingException("Connection refused: Permanent outage notice"));

        assertThat(result.isPermanent()).isFalse();
    }
}
