package com.ninesync.service;

import com.ninesync.domain.ActiveRange;
import com.ninesync.domain.MailboxInfo;
import com.ninesync.domain.MailboxState;
import com.ninesync.domain.Mark;
import com.ninesync.domain.UidRange;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Turns a fresh flag listing into updated active, read and mark ranges.
 *
 * <p>Only the fetched window {@code [startArticle, high]} is authoritative.
 * When the window does not start at UID 1, everything known about UIDs below
 * it is carried over from the previously stored info. All combination is done
 * with canonical range set operations, so applying the same listing twice
 * yields the same result.</p>
 *
 * <p>A mark whose flag the mailbox cannot store (PERMANENTFLAGS lacks both the
 * flag and {@code \*}) is left exactly as stored. A storable mark that no
 * fetched article carries has its window cleared.</p>
 */
@Slf4j
@Component
public class FlagReconciler {

    /**
     * @param previous stored info for the mailbox, or null when there is none
     */
    public MailboxInfo reconcile(String server, MailboxState state, MailboxInfo previous) {
        long start = Math.max(1, state.getStartArticle());
        long high = state.high();
        boolean partial = start > 1;

        ActiveRange active = activeRange(state, previous, partial, high);

        UidRange unread = state.getExisting()
                .subtract(fresh(state, Mark.READ))
                .subtract(fresh(state, Mark.TICK));
        UidRange read = unread.complement(start, high);
        if (partial && previous != null) {
            read = previous.getRead().intersect(1, start - 1).union(read);
        }

        Map<Mark, UidRange> marks = new EnumMap<>(Mark.class);
        for (Mark mark : Mark.values()) {
            if (mark == Mark.READ) {
                continue;
            }
            UidRange stored = previous != null ? previous.mark(mark) : UidRange.empty();
            UidRange range;
            if (!storable(state, mark)) {
                range = stored;
            } else if (partial) {
                range = stored.subtract(UidRange.interval(start, high)).union(fresh(state, mark));
            } else {
                range = fresh(state, mark);
            }
            if (!range.isEmpty()) {
                marks.put(mark, range);
            }
        }

        log.debug("Reconciled {}/{} window {}:{} active={} read={} marks={}",
                server, state.getName(), start, high, active, read, marks.keySet());

        return MailboxInfo.builder()
                .server(server)
                .mailbox(state.getName())
                .uidValidity(state.getUidValidity())
                .active(active)
                .read(read)
                .marks(marks)
                .highestModSeq(state.getHighestModSeq())
                .build();
    }

    private static ActiveRange activeRange(MailboxState state, MailboxInfo previous, boolean partial, long high) {
        ActiveRange stored = previous != null ? previous.getActive() : null;
        if (partial && stored != null) {
            return stored.withHigh(Math.max(stored.high(), high));
        }
        if (state.getExisting().isEmpty()) {
            return ActiveRange.emptyAt(state.getUidNext() != null ? state.getUidNext() : 1);
        }
        return new ActiveRange(state.low(), high);
    }

    /** UIDs carrying the mark's flag, falling back to its alternate spelling. */
    static UidRange fresh(MailboxState state, Mark mark) {
        UidRange uids = state.uidsWithFlag(mark.flag());
        if (uids == null && mark.alternateFlag() != null) {
            uids = state.uidsWithFlag(mark.alternateFlag());
        }
        return uids != null ? uids : UidRange.empty();
    }

    private static boolean storable(MailboxState state, Mark mark) {
        return state.canStore(mark.flag())
                || (mark.alternateFlag() != null && state.canStore(mark.alternateFlag()));
    }
}
