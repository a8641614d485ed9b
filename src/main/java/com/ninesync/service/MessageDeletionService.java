package com.ninesync.service;

import com.ninesync.config.ClientProperties;
import com.ninesync.domain.ExpungeOutcome;
import com.ninesync.domain.MailboxState;
import com.ninesync.domain.UidRange;
import com.ninesync.imap.CommandDispatcher;
import com.ninesync.imap.ImapSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Deletes articles from the selected mailbox.
 *
 * <p>The target UIDs are flagged {@code \Deleted} silently. With UIDPLUS only
 * those UIDs are expunged. Without it a full EXPUNGE is issued only when the
 * server entry allows it, because that also removes articles other clients
 * flagged. Otherwise the articles stay flagged and
 * {@link ExpungeOutcome#NOT_EXPUNGED} is returned.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MessageDeletionService {

    static final String DELETED = "\\Deleted";

    private final ClientProperties properties;
    private final CommandDispatcher dispatcher;

    public ExpungeOutcome delete(ImapSession session, UidRange uids) {
        if (uids.isEmpty()) {
            return ExpungeOutcome.NOTHING_TO_DELETE;
        }
        String mailbox = session.getSelectedMailbox();
        if (mailbox == null) {
            throw new IllegalStateException("No mailbox selected on " + session.getServerName());
        }
        MailboxState state = session.mailbox(mailbox);

        dispatcher.runChecked(session, "UID STORE %s +FLAGS.SILENT (\\Deleted)", uids);
        if (state != null && !state.getExisting().intersect(uids).isEmpty()) {
            state.addFlag(DELETED, state.getExisting().intersect(uids));
        }

        if (session.hasCapability("UIDPLUS")) {
            dispatcher.runChecked(session, "UID EXPUNGE %s", uids);
            if (state != null) {
                state.remove(uids);
            }
            log.info("Expunged {} from {} on {}", uids, mailbox, session.getServerName());
            return ExpungeOutcome.EXPUNGED;
        }

        if (allowUnscopedExpunge(session)) {
            dispatcher.runChecked(session, "EXPUNGE");
            if (state != null) {
                UidRange deleted = state.uidsWithFlag(DELETED);
                state.remove(deleted != null ? deleted.union(uids) : uids);
            }
            log.info("Expunged all deleted articles of {} on {}", mailbox, session.getServerName());
            return ExpungeOutcome.EXPUNGED_ALL;
        }

        log.warn("{} on {} marked deleted but not expunged: no UIDPLUS and unscoped expunge is disabled",
                uids, session.getServerName());
        return ExpungeOutcome.NOT_EXPUNGED;
    }

    private boolean allowUnscopedExpunge(ImapSession session) {
        return properties.server(session.getServerName())
                .map(ClientProperties.Server::isAllowUnscopedExpunge)
                .orElse(false);
    }
}
