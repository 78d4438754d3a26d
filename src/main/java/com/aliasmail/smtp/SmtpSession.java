package com.aliasmail.smtp;

import lombok.Data;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * State of one inbound SMTP connection
 */
@Data
public class SmtpSession {

    private SmtpState state = SmtpState.CONNECTED;
    private String clientHostname;
    private String remoteIp;

    // Mail transaction
    private String mailFrom;
    private List<String> recipients = new ArrayList<>();
    private ByteArrayOutputStream dataBuffer = new ByteArrayOutputStream();
    /** Set once DATA exceeded the size limit; the rest of the message is discarded */
    private boolean oversized;

    // TLS
    private boolean tlsActive = false;

    /**
     * Reset mail transaction (RSET, end of DATA)
     */
    public void resetTransaction() {
        this.mailFrom = null;
        this.recipients = new ArrayList<>();
        this.dataBuffer = new ByteArrayOutputStream();
        this.oversized = false;
        if (state != SmtpState.CONNECTED) {
            state = SmtpState.GREETED;
        }
    }

    /**
     * Reset session state after STARTTLS (RFC 3207: client must EHLO again)
     */
    public void resetAfterTls() {
        this.state = SmtpState.CONNECTED;
        this.clientHostname = null;
        this.tlsActive = true;
        resetTransaction();
    }

    public void addRecipient(String recipient) {
        this.recipients.add(recipient);
    }

    /**
     * Append one DATA line (already dot-unstuffed). Lines are ISO-8859-1 decoded, so bytes round-trip.
     *
     * @return false when the limit is exceeded; the buffer is then dropped
     */
    public boolean appendData(String line, long maxSize) {
        if (oversized) {
            return false;
        }
        byte[] bytes = line.getBytes(StandardCharsets.ISO_8859_1);
        if ((long) dataBuffer.size() + bytes.length + 2 > maxSize) {
            oversized = true;
            dataBuffer = new ByteArrayOutputStream();
            return false;
        }
        dataBuffer.write(bytes, 0, bytes.length);
        dataBuffer.write('\r');
        dataBuffer.write('\n');
        return true;
    }

    /**
     * Raw DATA bytes
     */
    public byte[] getDataBytes() {
        return dataBuffer.toByteArray();
    }
}
