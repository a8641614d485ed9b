package com.ninesync.imap.reply;

import java.util.List;
import java.util.Optional;

/**
 * Positional and key/value access shared by reply lines and nested lists.
 */
public interface TokenSequence {

    List<ReplyToken> tokens();

    default int size() {
        return tokens().size();
    }

    default ReplyToken get(int index) {
        return index < tokens().size() ? tokens().get(index) : null;
    }

    default Atom atom(int index) {
        return get(index) instanceof Atom atom ? atom : null;
    }

    default ListNode list(int index) {
        return get(index) instanceof ListNode list ? list : null;
    }

    /** Text of the atom at the index, or null if there is none. */
    default String text(int index) {
        Atom atom = atom(index);
        return atom != null ? atom.value() : null;
    }

    /**
     * Token following the first bare atom equal to {@code key}
     * (case-insensitive), as in FETCH data item lists.
     */
    default Optional<ReplyToken> valueOf(String key) {
        List<ReplyToken> tokens = tokens();
        for (int i = 0; i + 1 < tokens.size(); i++) {
            if (tokens.get(i) instanceof Atom atom && atom.is(key)) {
                return Optional.of(tokens.get(i + 1));
            }
        }
        return Optional.empty();
    }

    default Optional<Atom> atomValueOf(String key) {
        return valueOf(key).filter(Atom.class::isInstance).map(Atom.class::cast);
    }

    default Optional<ListNode> listValueOf(String key) {
        return valueOf(key).filter(ListNode.class::isInstance).map(ListNode.class::cast);
    }
}
