package com.ninesync.domain;

import java.util.Map;

/**
 * Outcome of one splitting pass over an inbox.
 *
 * @param candidates new articles that were classified
 * @param copied     per destination, the UIDs whose COPY succeeded
 * @param failed     per destination, the UIDs whose COPY was refused; they stay in the inbox
 * @param deleted    UIDs removed from the inbox after delivery
 * @param discarded  UIDs removed without delivery
 * @param kept       UIDs no rule matched
 * @param expunge    outcome of the delivered-articles deletion, or of the discard deletion
 *                   when nothing was delivered
 */
public record SplitResult(String inbox,
                          UidRange candidates,
                          Map<String, UidRange> copied,
                          Map<String, UidRange> failed,
                          UidRange deleted,
                          UidRange discarded,
                          UidRange kept,
                          ExpungeOutcome expunge) {

    public SplitResult {
        copied = Map.copyOf(copied);
        failed = Map.copyOf(failed);
    }

    public static SplitResult nothingNew(String inbox) {
        return new SplitResult(inbox, UidRange.empty(), Map.of(), Map.of(),
                UidRange.empty(), UidRange.empty(), UidRange.empty(), ExpungeOutcome.NOTHING_TO_DELETE);
    }

    public boolean isPartialFailure() {
        return !failed.isEmpty();
    }
}
