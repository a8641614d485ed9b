package com.ninesync.service;

import com.ninesync.domain.MailboxState;
import com.ninesync.domain.UidRange;
import com.ninesync.imap.CommandResult;
import com.ninesync.imap.reply.Atom;
import com.ninesync.imap.reply.ListNode;
import com.ninesync.imap.reply.ReplyToken;
import com.ninesync.imap.reply.ReplyTree;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Folds the untagged FETCH lines of a {@code (UID FLAGS)} listing into a
 * {@link MailboxState}.
 */
final class FlagListing {

    private FlagListing() {}

    /**
     * Replace the state's existing-UID set and flag map with the listing.
     * UIDs below {@code minUid} are ignored; servers answer {@code n:*} with
     * the last message even when its UID is below n.
     */
    static void apply(MailboxState state, CommandResult listing, long minUid) {
        List<Long> existing = new ArrayList<>();
        Map<String, List<Long>> flags = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        Map<String, String> spelling = new LinkedHashMap<>();

        for (ReplyTree reply : listing.untagged("FETCH")) {
            ListNode items = reply.list(3);
            if (items == null) {
                continue;
            }
            Optional<Atom> uidAtom = items.atomValueOf("UID");
            if (uidAtom.isEmpty() || !uidAtom.get().isNumber()) {
                continue;
            }
            long uid = uidAtom.get().longValue();
            if (uid < minUid) {
                continue;
            }
            existing.add(uid);
            Optional<ListNode> flagList = items.listValueOf("FLAGS");
            if (flagList.isEmpty()) {
                continue;
            }
            for (ReplyToken token : flagList.get().tokens()) {
                if (token instanceof Atom flag) {
                    flags.computeIfAbsent(flag.value(), k -> new ArrayList<>()).add(uid);
                    spelling.putIfAbsent(flag.value().toLowerCase(Locale.ROOT), flag.value());
                }
            }
        }

        Map<String, UidRange> ranges = new LinkedHashMap<>();
        for (String flag : spelling.values()) {
            ranges.put(flag, UidRange.of(flags.get(flag)));
        }
        UidRange existingRange = UidRange.of(existing);
        state.setExisting(existingRange);
        state.setFlags(ranges);
        if (state.getUidNext() != null && !existingRange.isEmpty() && existingRange.max() >= state.getUidNext()) {
            // A message arrived between SELECT and FETCH
            state.setUidNext(existingRange.max() + 1);
        }
    }
}
