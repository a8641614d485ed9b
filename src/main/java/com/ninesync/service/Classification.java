package com.ninesync.service;

import java.util.List;

/**
 * Where one message should go: destination mailboxes, the discard marker,
 * or nowhere (the message stays in the inbox).
 */
public record Classification(List<String> destinations, boolean discard) {

    private static final Classification NONE = new Classification(List.of(), false);
    private static final Classification DISCARD = new Classification(List.of(), true);

    public Classification {
        destinations = List.copyOf(destinations);
    }

    public static Classification none() {
        return NONE;
    }

    public static Classification discarded() {
        return DISCARD;
    }

    public static Classification to(String... mailboxes) {
        return new Classification(List.of(mailboxes), false);
    }

    public boolean isNone() {
        return !discard && destinations.isEmpty();
    }
}
