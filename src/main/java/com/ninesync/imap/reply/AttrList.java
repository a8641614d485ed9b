package com.ninesync.imap.reply;

import java.util.List;

/**
 * Bracketed response code such as {@code [UIDNEXT 42]}, split into atoms.
 */
public record AttrList(List<String> atoms) implements ReplyToken {

    public AttrList {
        atoms = List.copyOf(atoms);
    }

    /** First atom, upper-cased, or empty string. */
    public String code() {
        return atoms.isEmpty() ? "" : atoms.get(0).toUpperCase(java.util.Locale.ROOT);
    }

    public String arg(int index) {
        return index + 1 < atoms.size() ? atoms.get(index + 1) : null;
    }

    @Override
    public String toString() {
        return "[" + String.join(" ", atoms) + "]";
    }
}
