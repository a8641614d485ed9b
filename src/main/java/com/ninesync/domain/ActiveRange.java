package com.ninesync.domain;

/**
 * Stored active range of a mailbox: lowest and highest article UID.
 * {@code low > high} is the empty range; an empty mailbox is anchored at
 * UIDNEXT as {@code (uidNext, uidNext - 1)}.
 */
public record ActiveRange(long low, long high) {

    public static ActiveRange emptyAt(long uidNext) {
        return new ActiveRange(uidNext, uidNext - 1);
    }

    public boolean isEmpty() {
        return low > high;
    }

    public ActiveRange withHigh(long newHigh) {
        return new ActiveRange(low, newHigh);
    }
}
