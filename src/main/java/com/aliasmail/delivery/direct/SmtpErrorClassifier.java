package com.aliasmail.delivery.direct;

import com.aliasmail.delivery.PermanentSmtpException;
import com.aliasmail.delivery.SmtpDeliveryException;
import com.aliasmail.delivery.TemporarySmtpException;
import jakarta.mail.MessagingException;
import jakarta.mail.SendFailedException;
import org.eclipse.angus.mail.smtp.SMTPAddressFailedException;
import org.eclipse.angus.mail.smtp.SMTPSendFailedException;
import org.eclipse.angus.mail.smtp.SMTPSenderFailedException;

/**
 * Maps Jakarta Mail failures onto permanent (5xx, refused) and temporary (everything else) errors
 */
public final class SmtpErrorClassifier {

    private SmtpErrorClassifier() {}

    public static SmtpDeliveryException classify(String host, MessagingException e) {
        int code = replyCode(e);
        String message = host + ": " + describe(e);

        if (code >= 500 && code < 600) {
            return new PermanentSmtpException(code, message, e);
        }
        if (code < 0 && isRecipientRefused(e)) {
            return new PermanentSmtpException(code, message, e);
        }
        return new TemporarySmtpException(code, message, e);
    }

    static int replyCode(MessagingException e) {
        Exception current = e;
        while (current != null) {
            if (current instanceof SMTPAddressFailedException afe) {
                return afe.getReturnCode();
            }
            if (current instanceof SMTPSenderFailedException sfe) {
                return sfe.getReturnCode();
            }
            if (current instanceof SMTPSendFailedException sfe) {
                return sfe.getReturnCode();
            }
            current = current instanceof MessagingException me ? me.getNextException() : null;
        }
        return -1;
    }

    private static boolean isRecipientRefused(MessagingException e) {
        return e instanceof SendFailedException sfe
                && sfe.getInvalidAddresses() != null && sfe.getInvalidAddresses().length > 0;
    }

    private static String describe(MessagingException e) {
        Exception next = e.getNextException();
        if (next != null && next.getMessage() != null) {
            return e.getMessage() + " (" + next.getMessage().trim() + ")";
        }
        return String.valueOf(e.getMessage()).trim();
    }
}
