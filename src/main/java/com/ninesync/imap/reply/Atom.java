package com.ninesync.imap.reply;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * A bare or quoted string token. Literal payloads are carried as quoted
 * atoms whose characters map 1:1 to the received bytes (ISO-8859-1).
 */
public record Atom(String value, boolean quoted) implements ReplyToken {

    public boolean isNil() {
        return !quoted && "NIL".equalsIgnoreCase(value);
    }

    public boolean is(String text) {
        return !quoted && value.equalsIgnoreCase(text);
    }

    public String upper() {
        return value.toUpperCase(Locale.ROOT);
    }

    /** Raw bytes of the value as received from the wire. */
    public byte[] bytes() {
        return value.getBytes(StandardCharsets.ISO_8859_1);
    }

    public long longValue() {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Number expected, found: " + value, e);
        }
    }

    public boolean isNumber() {
        if (quoted || value.isEmpty()) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            if (!Character.isDigit(value.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return quoted ? '"' + value + '"' : value;
    }
}
