package com.ninesync.service;

import com.ninesync.domain.ActiveRange;
import com.ninesync.domain.MailboxInfo;
import com.ninesync.domain.MailboxState;
import com.ninesync.domain.Mark;
import com.ninesync.domain.UidRange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * FlagReconciler unit tests
 */
class FlagReconcilerTest {

    private FlagReconciler reconciler;

    @BeforeEach
    void setUp() {
        reconciler = new FlagReconciler();
    }

    private static MailboxState state(String existing, long uidNext, long start) {
        MailboxState state = new MailboxState("INBOX");
        state.setExisting(UidRange.parse(existing));
        state.setUidNext(uidNext);
        state.setUidValidity(1);
        state.setStartArticle(start);
        return state;
    }

    @Test
    @DisplayName("Complete sync: read is everything not unread and not ticked")
    void testCompleteSync() {
        MailboxState state = state("1:10", 11, 1);
        state.addFlag("\\Seen", UidRange.parse("1:4,7"));
        state.addFlag("\\Flagged", UidRange.parse("9"));
        state.addFlag("\\Answered", UidRange.parse("2"));

        MailboxInfo info = reconciler.reconcile("srv", state, null);

        assertThat(info.getActive()).isEqualTo(new ActiveRange(1, 10));
        // unread = 5,6,8,10
        assertThat(info.getRead().toString()).isEqualTo("1:4,7,9");
        assertThat(info.mark(Mark.TICK).toString()).isEqualTo("9");
        assertThat(info.mark(Mark.REPLY).toString()).isEqualTo("2");
        assertThat(info.getMarks()).doesNotContainKey(Mark.EXPIRE);
    }

    @Test
    @DisplayName("UIDs missing from the mailbox count as read within the window")
    void testGapsAreRead() {
        MailboxState state = state("2,5", 8, 1);

        MailboxInfo info = reconciler.reconcile("srv", state, null);

        assertThat(info.getActive()).isEqualTo(new ActiveRange(2, 7));
        assertThat(info.getRead().toString()).isEqualTo("1,3:4,6:7");
    }

    @Test
    @DisplayName("Empty mailbox gets an empty active range anchored at UIDNEXT")
    void testEmptyMailbox() {
        MailboxInfo info = reconciler.reconcile("srv", state("", 42, 1), null);

        assertThat(info.getActive()).isEqualTo(ActiveRange.emptyAt(42));
        assertThat(info.getActive().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Alternate flag spelling is recognised")
    void testAlternateFlag() {
        MailboxState state = state("1:3", 4, 1);
        state.addFlag("$Forwarded", UidRange.parse("3"));
        state.addFlag("Seen", UidRange.parse("1"));

        MailboxInfo info = reconciler.reconcile("srv", state, null);

        assertThat(info.mark(Mark.FORWARD).toString()).isEqualTo("3");
        assertThat(info.getRead().toString()).isEqualTo("1");
    }

    @Test
    @DisplayName("Partial sync keeps read state below the window and reflects the window")
    void testPartialSyncPreservation() {
        MailboxInfo stored = MailboxInfo.builder()
                .server("srv").mailbox("INBOX").uidValidity(1)
                .active(new ActiveRange(1, 100))
                .read(UidRange.parse("1:50,60:100"))
                .build();
        MailboxState state = state("80:120", 121, 80);
        state.addFlag("\\Seen", UidRange.parse("80:89,110:120"));

        MailboxInfo info = reconciler.reconcile("srv", state, stored);

        assertThat(info.getRead().intersect(1, 79)).isEqualTo(UidRange.parse("1:50,60:79"));
        assertThat(info.getRead().intersect(80, 120)).isEqualTo(UidRange.parse("80:89,110:120"));
        assertThat(info.getActive()).isEqualTo(new ActiveRange(1, 120));
    }

    @Test
    @DisplayName("Applying the same listing twice yields identical state")
    void testIdempotence() {
        MailboxInfo stored = MailboxInfo.builder()
                .server("srv").mailbox("INBOX").uidValidity(1)
                .active(new ActiveRange(1, 30))
                .read(UidRange.parse("1:30"))
                .marks(new EnumMap<>(Map.of(Mark.TICK, UidRange.parse("3,25"))))
                .build();
        MailboxState state = state("20:40", 41, 20);
        state.addFlag("\\Seen", UidRange.parse("20:35"));
        state.addFlag("\\Flagged", UidRange.parse("22"));

        MailboxInfo once = reconciler.reconcile("srv", state, stored);
        MailboxInfo twice = reconciler.reconcile("srv", state, once);

        assertThat(twice).isEqualTo(once);
        assertThat(once.mark(Mark.TICK).toString()).isEqualTo("3,22");
    }

    @Test
    @DisplayName("Storable mark with no fresh UIDs clears the window and keeps older entries")
    void testEmptyFreshSetClearsWindow() {
        MailboxInfo stored = MailboxInfo.builder()
                .server("srv").mailbox("INBOX").uidValidity(1)
                .active(new ActiveRange(1, 50))
                .marks(new EnumMap<>(Map.of(Mark.REPLY, UidRange.parse("5,45"))))
                .build();
        MailboxState state = state("40:60", 61, 40);
        state.setPermanentFlags(Set.of("\\Seen", "\\Answered", "\\Flagged"));

        MailboxInfo info = reconciler.reconcile("srv", state, stored);

        assertThat(info.mark(Mark.REPLY).toString()).isEqualTo("5");
    }

    @Test
    @DisplayName("Mark whose flag the mailbox cannot store is left untouched")
    void testAbsentMarkUntouched() {
        MailboxInfo stored = MailboxInfo.builder()
                .server("srv").mailbox("INBOX").uidValidity(1)
                .active(new ActiveRange(1, 50))
                .marks(new EnumMap<>(Map.of(Mark.EXPIRE, UidRange.parse("5,45"))))
                .build();
        MailboxState state = state("40:60", 61, 40);
        state.setPermanentFlags(Set.of("\\Seen", "\\Answered", "\\Flagged"));

        MailboxInfo info = reconciler.reconcile("srv", state, stored);

        assertThat(info.mark(Mark.EXPIRE).toString()).isEqualTo("5,45");
    }

    @Test
    @DisplayName("Complete sync replaces stale marks entirely")
    void testCompleteSyncReplacesMarks() {
        MailboxInfo stored = MailboxInfo.builder()
                .server("srv").mailbox("INBOX").uidValidity(1)
                .active(new ActiveRange(1, 10))
                .marks(new EnumMap<>(Map.of(Mark.TICK, UidRange.parse("1:3"))))
                .build();
        MailboxState state = state("1:10", 11, 1);
        state.addFlag("\\Flagged", UidRange.parse("7"));

        MailboxInfo info = reconciler.reconcile("srv", state, stored);

        assertThat(info.mark(Mark.TICK).toString()).isEqualTo("7");
    }
}
