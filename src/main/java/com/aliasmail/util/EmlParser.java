package com.aliasmail.util;

import jakarta.mail.BodyPart;
import jakarta.mail.MessagingException;
import jakarta.mail.Multipart;
import jakarta.mail.Part;
import jakarta.mail.Session;
import jakarta.mail.internet.MimeMessage;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import java.util.UUID;

/**
 * EML parsing utilities based on Jakarta Mail
 */
@Slf4j
public final class EmlParser {

    public static final String FORWARDED_BY = "AliasMail";

    private static final Session SESSION;

    static {
        Properties props = new Properties();
        props.setProperty("mail.mime.charset", "UTF-8");
        props.setProperty("mail.mime.decodetext.strict", "false");
        SESSION = Session.getInstance(props);
    }

    private EmlParser() {}

    /**
     * Parse a MimeMessage from bytes
     */
    public static MimeMessage parse(byte[] emlData) throws MessagingException {
        try (InputStream is = new ByteArrayInputStream(emlData)) {
            return new MimeMessage(SESSION, is);
        } catch (IOException e) {
            throw new MessagingException("Failed to read message bytes", e);
        }
    }

    /**
     * Serialize a MimeMessage to bytes
     */
    public static byte[] toBytes(MimeMessage message) throws MessagingException {
        ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
        try {
            message.writeTo(outputStream);
        } catch (IOException e) {
            throw new MessagingException("Failed to serialize message", e);
        }
        return outputStream.toByteArray();
    }

    /**
     * Extract Message-ID, generating one on the given host when absent
     */
    public static String extractMessageId(MimeMessage message, String hostname) throws MessagingException {
        String messageId = message.getMessageID();
        if (messageId == null || messageId.isBlank()) {
            messageId = "<" + UUID.randomUUID() + "@" + hostname + ">";
        }
        return messageId.trim();
    }

    /**
     * Extract Subject from a MimeMessage
     */
    public static String extractSubject(MimeMessage message) throws MessagingException {
        String subject = message.getSubject();
        return subject != null ? subject : "(No Subject)";
    }

    /**
     * True when any part is marked as an attachment or carries a filename
     */
    public static boolean hasAttachments(Part part) throws MessagingException, IOException {
        if (Part.ATTACHMENT.equalsIgnoreCase(part.getDisposition())) {
            return true;
        }
        if (part.isMimeType("multipart/*")) {
            Object content = part.getContent();
            if (content instanceof Multipart multipart) {
                for (int i = 0; i < multipart.getCount(); i++) {
                    BodyPart bodyPart = multipart.getBodyPart(i);
                    if (hasAttachments(bodyPart) || bodyPart.getFileName() != null) {
                        return true;
                    }
                }
            }
        }
        return false;
    }

    /**
     * Copy of the raw message prepared for one forward target:
     * X-Forwarded-By, X-Original-To and X-Original-Sender are stamped and To is rewritten.
     * Other headers and the body are left as received.
     */
    public static byte[] stampForwardingHeaders(byte[] emlData, String originalRecipient,
                                                String originalSender, String target)
            throws MessagingException {
        MimeMessage message = parse(emlData);
        String originalTo = message.getHeader("To", ", ");
        message.setHeader("X-Forwarded-By", FORWARDED_BY);
        message.setHeader("X-Original-To", originalTo != null ? originalTo : originalRecipient);
        message.setHeader("X-Original-Sender", originalSender == null ? "" : originalSender);
        message.setHeader("To", target);
        return toBytes(message);
    }

    /**
     * Return the mail Session
     */
    public static Session getSession() {
        return SESSION;
    }
}
