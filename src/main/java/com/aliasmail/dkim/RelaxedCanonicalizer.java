package com.aliasmail.dkim;

/**
 * DKIM "relaxed" header and body canonicalization (RFC 6376 section 3.4)
 */
public final class RelaxedCanonicalizer {

    private RelaxedCanonicalizer() {}

    /**
     * Lower-case name, unfolded value with whitespace runs compressed, trimmed, CRLF terminated
     */
    public static String header(String name, String value) {
        return name.trim().toLowerCase() + ":" + unfoldAndCompress(value) + "\r\n";
    }

    /**
     * Compress whitespace runs inside each line, strip trailing whitespace,
     * and drop trailing empty lines. A non-empty body ends with exactly one CRLF.
     */
    public static String body(String body) {
        String[] lines = body.split("\r\n", -1);
        StringBuilder sb = new StringBuilder();
        int pendingEmpty = 0;
        for (int i = 0; i < lines.length; i++) {
            // Last element is the remainder after the final CRLF
            if (i == lines.length - 1 && lines[i].isEmpty()) {
                break;
            }
            String line = compressLine(lines[i]);
            if (line.isEmpty()) {
                pendingEmpty++;
                continue;
            }
            while (pendingEmpty > 0) {
                sb.append("\r\n");
                pendingEmpty--;
            }
            sb.append(line).append("\r\n");
        }
        return sb.toString();
    }

    static String unfoldAndCompress(String s) {
        StringBuilder sb = new StringBuilder();
        boolean prevSpace = false;
        boolean started = false;

        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\r' || c == '\n' || c == ' ' || c == '\t') {
                if (started && !prevSpace) {
                    sb.append(' ');
                    prevSpace = true;
                }
            } else {
                sb.append(c);
                prevSpace = false;
                started = true;
            }
        }

        if (sb.length() > 0 && sb.charAt(sb.length() - 1) == ' ') {
            sb.setLength(sb.length() - 1);
        }
        return sb.toString();
    }

    private static String compressLine(String line) {
        StringBuilder sb = new StringBuilder();
        boolean prevSpace = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == ' ' || c == '\t') {
                if (!prevSpace) {
                    sb.append(' ');
                    prevSpace = true;
                }
            } else {
                sb.append(c);
                prevSpace = false;
            }
        }
        if (sb.length() > 0 && sb.charAt(sb.length() - 1) == ' ') {
            sb.setLength(sb.length() - 1);
        }
        return sb.toString();
    }
}
