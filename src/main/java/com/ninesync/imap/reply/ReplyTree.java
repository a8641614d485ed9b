package com.ninesync.imap.reply;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * One parsed response line: {@code * ...}, {@code + ...} or {@code <tag> <status> ...}.
 */
public record ReplyTree(List<ReplyToken> tokens) implements TokenSequence {

    public ReplyTree {
        tokens = List.copyOf(tokens);
    }

    /** First token: {@code *}, {@code +} or the command tag. */
    public String tag() {
        String tag = text(0);
        return tag != null ? tag : "";
    }

    public boolean isUntagged() {
        return "*".equals(tag());
    }

    public boolean isContinuation() {
        return "+".equals(tag());
    }

    /** OK, NO, BAD, PREAUTH or BYE when the line carries a status, else null. */
    public String status() {
        String word = text(1);
        if (word == null) {
            return null;
        }
        String upper = word.toUpperCase(Locale.ROOT);
        return switch (upper) {
            case "OK", "NO", "BAD", "PREAUTH", "BYE" -> upper;
            default -> null;
        };
    }

    /** Bracketed response code right after the status, if present. */
    public Optional<AttrList> responseCode() {
        return get(2) instanceof AttrList code ? Optional.of(code) : Optional.empty();
    }

    /**
     * For {@code * <n> <KEYWORD> ...} lines the keyword, otherwise the second token,
     * upper-cased.
     */
    public String keyword() {
        Atom second = atom(1);
        if (second == null) {
            return "";
        }
        if (second.isNumber()) {
            String third = text(2);
            return third != null ? third.toUpperCase(Locale.ROOT) : "";
        }
        return second.upper();
    }

    /** Human-readable text after the status and response code. */
    public String statusText() {
        StringBuilder sb = new StringBuilder();
        int start = responseCode().isPresent() ? 3 : 2;
        for (int i = start; i < tokens.size(); i++) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            ReplyToken token = tokens.get(i);
            sb.append(token instanceof Atom atom ? atom.value() : token.toString());
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (ReplyToken token : tokens) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(token);
        }
        return sb.toString();
    }
}
