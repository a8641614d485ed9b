package com.ninesync.service;

import com.ninesync.config.ClientProperties;
import com.ninesync.domain.ExpungeOutcome;
import com.ninesync.domain.MailboxState;
import com.ninesync.domain.SplitResult;
import com.ninesync.domain.UidRange;
import com.ninesync.exception.ImapProtocolException;
import com.ninesync.imap.CommandDispatcher;
import com.ninesync.imap.CommandResult;
import com.ninesync.imap.ImapSession;
import com.ninesync.imap.MailboxNames;
import com.ninesync.imap.reply.Atom;
import com.ninesync.imap.reply.ListNode;
import com.ninesync.imap.reply.ReplyTree;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Moves new inbox articles into the mailboxes the classifier names.
 *
 * <p>COPY commands are pipelined, one per destination, and each completion is
 * checked against its own tag. An article is deleted from the inbox only when
 * every copy it took part in succeeded; the rest are left for the next pass.
 * A destination that cannot be created counts as a failed copy. Articles
 * classified as discard are deleted without copying.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MailSplitService {

    private final ClientProperties properties;
    private final CommandDispatcher dispatcher;
    private final MailboxService mailboxService;
    private final MessageDeletionService deletionService;
    private final MailClassifier classifier;

    public SplitResult split(ImapSession session) {
        String inbox = properties.server(session.getServerName())
                .map(ClientProperties.Server::getInbox)
                .orElse(MailboxNames.INBOX);

        MailboxState state = mailboxService.select(session, inbox, false);
        FlagListing.apply(state, dispatcher.runChecked(session, "UID FETCH 1:* (UID FLAGS)"), 1);

        UidRange candidates = newArticles(state);
        if (candidates.isEmpty()) {
            log.debug("No new articles in {} on {}", inbox, session.getServerName());
            return SplitResult.nothingNew(inbox);
        }

        Map<String, List<Long>> destinations = new LinkedHashMap<>();
        List<Long> discard = new ArrayList<>();
        List<Long> kept = new ArrayList<>();
        CommandResult articles = dispatcher.runChecked(session,
                "UID FETCH %s (UID BODY.PEEK[HEADER] BODY.PEEK[1])", candidates);
        for (ReplyTree reply : articles.untagged("FETCH")) {
            ListNode items = reply.list(3);
            Optional<Atom> uidAtom = items != null ? items.atomValueOf("UID") : Optional.empty();
            if (uidAtom.isEmpty() || !uidAtom.get().isNumber()) {
                continue;
            }
            long uid = uidAtom.get().longValue();
            Classification classification = classifier.classify(rawArticle(items));
            if (classification.discard()) {
                discard.add(uid);
            } else if (classification.isNone()) {
                kept.add(uid);
            } else {
                for (String destination : classification.destinations()) {
                    destinations.computeIfAbsent(destination, k -> new ArrayList<>()).add(uid);
                }
            }
        }

        Set<String> unavailable = new HashSet<>();
        for (String destination : mailboxService.missing(session, destinations.keySet())) {
            try {
                mailboxService.create(session, destination);
            } catch (ImapProtocolException e) {
                log.warn("Cannot create {} on {}, its articles stay in {}: {}",
                        destination, session.getServerName(), inbox, e.getMessage());
                unavailable.add(destination);
            }
        }

        Map<String, UidRange> ranges = new LinkedHashMap<>();
        Map<String, String> tags = new LinkedHashMap<>();
        Map<String, UidRange> copied = new LinkedHashMap<>();
        Map<String, UidRange> failed = new LinkedHashMap<>();
        for (Map.Entry<String, List<Long>> entry : destinations.entrySet()) {
            UidRange range = UidRange.of(entry.getValue());
            ranges.put(entry.getKey(), range);
            if (unavailable.contains(entry.getKey())) {
                failed.put(entry.getKey(), range);
                continue;
            }
            tags.put(entry.getKey(), dispatcher.send(session, "UID COPY %s %s",
                    range, CommandDispatcher.mailbox(entry.getKey())));
        }

        for (Map.Entry<String, String> entry : tags.entrySet()) {
            String destination = entry.getKey();
            CommandResult result = dispatcher.collect(session, entry.getValue());
            if (result.ok()) {
                copied.put(destination, ranges.get(destination));
            } else {
                log.warn("COPY of {} to {} failed on {}: {} {}", ranges.get(destination), destination,
                        session.getServerName(), result.status(), result.statusText());
                failed.put(destination, ranges.get(destination));
            }
        }

        UidRange delivered = union(copied).subtract(union(failed));
        ExpungeOutcome outcome = deletionService.delete(session, delivered);
        UidRange discarded = UidRange.of(discard);
        ExpungeOutcome discardOutcome = deletionService.delete(session, discarded);
        if (outcome == ExpungeOutcome.NOTHING_TO_DELETE) {
            outcome = discardOutcome;
        }

        SplitResult result = new SplitResult(inbox, candidates, copied, failed,
                delivered, discarded, UidRange.of(kept), outcome);
        log.info("Split {} on {}: {} delivered, {} discarded, {} kept, {} destination(s) failed",
                inbox, session.getServerName(), delivered.size(), discarded.size(), kept.size(), failed.size());
        return result;
    }

    /** Listed articles carrying neither \Seen nor \Deleted. */
    static UidRange newArticles(MailboxState state) {
        UidRange candidates = state.getExisting();
        UidRange deleted = state.uidsWithFlag(MessageDeletionService.DELETED);
        UidRange seen = state.uidsWithFlag("\\Seen");
        if (deleted != null) {
            candidates = candidates.subtract(deleted);
        }
        if (seen != null) {
            candidates = candidates.subtract(seen);
        }
        return candidates;
    }

    private static byte[] rawArticle(ListNode items) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        items.atomValueOf("BODY[HEADER]").filter(a -> !a.isNil()).ifPresent(header -> out.writeBytes(header.bytes()));
        items.atomValueOf("BODY[1]").filter(a -> !a.isNil()).ifPresent(body -> out.writeBytes(body.bytes()));
        return out.toByteArray();
    }

    private static UidRange union(Map<String, UidRange> ranges) {
        UidRange all = UidRange.empty();
        for (UidRange range : ranges.values()) {
            all = all.union(range);
        }
        return all;
    }
}
