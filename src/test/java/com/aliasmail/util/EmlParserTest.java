package com.aliasmail.util;

import jakarta.mail.internet.MimeMessage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * EmlParser unit tests
 */
class EmlParserTest {

    private static final String PLAIN = """
            From: sender@remote.example
            To: alias@hosted.com
            Subject: Hello
            Message-ID: <abc@remote.example>

            Plain body
            """.replace("\n", "\r\n");

    private static final String WITH_ATTACHMENT = """
            From: sender@remote.example
            To: alias@hosted.com
            Subject: Report
            MIME-Version: 1.0
            Content-Type: multipart/mixed; boundary="b1"

            --b1
            Content-Type: text/plain

            See attached
            --b1
            Content-Type: application/pdf
            Content-Disposition: attachment; filename="report.pdf"
            Content-Transfer-Encoding: base64

            JVBERi0xLjQK
            --b1--
            """.replace("\n", "\r\n");

    private static MimeMessage parse(String eml) throws Exception {
        return EmlParser.parse(eml.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Message-ID and Subject are read from the headers")
    void testExtractHeaders() throws Exception {
        MimeMessage message = parse(PLAIN);

        assertThat(EmlParser.extractMessageId(message, "mx.hosted.com")).isEqualTo("<abc@remote.example>");
        assertThat(EmlParser.extractSubject(message)).isEqualTo("Hello");
    }

    @Test
    @DisplayName("Missing Message-ID is generated on the local host; missing Subject gets a placeholder")
    void testMissingHeaders() throws Exception {
        MimeMessage message = parse("From: a@b.com\r\n\r\nbody\r\n");

        assertThat(EmlParser.extractMessageId(message, "mx.hosted.com")).startsWith("<").endsWith("@mx.hosted.com>");
        assertThat(EmlParser.extractSubject(message)).isEqualTo("(No Subject)");
    }

    @Test
    @DisplayName("Attachment detection")
    void testHasAttachments() throws Exception {
        assertThat(EmlParser.hasAttachments(parse(PLAIN))).isFalse();
        assertThat(EmlParser.hasAttachments(parse(WITH_ATTACHMENT))).isTrue();
    }

    @Test
    @DisplayName("Forwarding headers are stamped and To is rewritten; body is untouched")
    void testStampForwardingHeaders() throws Exception {
        byte[] stamped = EmlParser.stampForwardingHeaders(PLAIN.getBytes(StandardCharsets.UTF_8),
                "alias@hosted.com", "sender@remote.example", "me@gmail.com");

        MimeMessage message = EmlParser.parse(stamped);
        assertThat(message.getHeader("X-Forwarded-By", null)).isEqualTo(EmlParser.FORWARDED_BY);
        assertThat(message.getHeader("X-Original-To", null)).isEqualTo("alias@hosted.com");
        assertThat(message.getHeader("X-Original-Sender", null)).isEqualTo("sender@remote.example");
        assertThat(message.getHeader("To", null)).isEqualTo("me@gmail.com");
        assertThat(message.getHeader("Message-ID", null)).isEqualTo("<abc@remote.example>");
        assertThat(new String(stamped, StandardCharsets.UTF_8)).endsWith("\r\n\r\nPlain body\r\n");
    }
}
