package io.github.simbo1905.json.openapi.codegen;

import java.util.logging.Level;
import java.util.logging.Logger;

/// Structured JUL logging: concise `event=NAME key=value` lines.
final class StructuredLog {
    private static final int MAX_VALUE_LENGTH = 200;

    private StructuredLog() {}

    static void fine(Logger log, String event, Object... kv) {
        if (log.isLoggable(Level.FINE)) log.fine(() -> ev(event, kv));
    }

    static void finer(Logger log, String event, Object... kv) {
        if (log.isLoggable(Level.FINER)) log.finer(() -> ev(event, kv));
    }

    static void warning(Logger log, String event, Object... kv) {
        if (log.isLoggable(Level.WARNING)) log.warning(() -> ev(event, kv));
    }

    static String ev(String event, Object... kv) {
        final var sb = new StringBuilder(64);
        sb.append("event=").append(sanitize(event));
        for (int i = 0; i + 1 < kv.length; i += 2) {
            final Object key = kv[i];
            if (key == null) continue;
            final Object val = kv[i + 1];
            final String v = val == null ? "null" : sanitize(val.toString());
            sb.append(' ').append(key).append('=');
            if (needsQuotes(v)) sb.append('"').append(v).append('"'); else sb.append(v);
        }
        return sb.toString();
    }

    private static boolean needsQuotes(String s) {
        if (s.isEmpty()) return true;
        for (int i = 0; i < s.length(); i++) {
            final char c = s.charAt(i);
            if (Character.isWhitespace(c) || c == '"') return true;
        }
        return false;
    }

    private static String sanitize(String s) {
        final String trimmed = s.length() > MAX_VALUE_LENGTH ? s.substring(0, MAX_VALUE_LENGTH) + "..." : s;
        return trimmed.replace('\n', ' ').replace('\r', ' ').replace('\t', ' ');
    }
}
