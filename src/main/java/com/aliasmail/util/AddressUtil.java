package com.aliasmail.util;

import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;

import java.util.ArrayList;
import java.util.List;

/**
 * Email address helpers
 */
public final class AddressUtil {

    private AddressUtil() {}

    /**
     * Strip angle brackets (<>) from an email address
     */
    public static String stripAngleBrackets(String email) {
        if (email == null) return null;
        String stripped = email.trim();
        if (stripped.startsWith("<")) stripped = stripped.substring(1);
        if (stripped.endsWith(">")) stripped = stripped.substring(0, stripped.length() - 1);
        return stripped.trim();
    }

    /**
     * Extract domain from an email address (lower-cased)
     */
    public static String extractDomain(String email) {
        if (email == null || !email.contains("@")) return null;
        String domain = email.substring(email.lastIndexOf('@') + 1).trim().toLowerCase();
        return domain.isEmpty() ? null : domain;
    }

    /**
     * Extract local part from an email address
     */
    public static String extractLocalPart(String email) {
        if (email == null || !email.contains("@")) return email;
        return email.substring(0, email.lastIndexOf('@'));
    }

    /**
     * Strict single-address validation
     */
    public static boolean isValid(String email) {
        if (email == null || email.isBlank() || email.indexOf('@') <= 0) {
            return false;
        }
        try {
            new InternetAddress(email, true).validate();
            return true;
        } catch (AddressException e) {
            return false;
        }
    }

    /**
     * Split a comma-separated address list, trimming blanks. Order is preserved.
     */
    public static List<String> splitList(String addresses) {
        List<String> result = new ArrayList<>();
        if (addresses == null) return result;
        for (String part : addresses.split(",")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                result.add(trimmed);
            }
        }
        return result;
    }
}
