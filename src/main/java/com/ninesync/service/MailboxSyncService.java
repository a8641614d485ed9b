package com.ninesync.service;

import com.ninesync.config.ClientProperties;
import com.ninesync.domain.ActiveRange;
import com.ninesync.domain.MailboxInfo;
import com.ninesync.domain.MailboxState;
import com.ninesync.imap.CommandDispatcher;
import com.ninesync.imap.CommandResult;
import com.ninesync.imap.ImapSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Brings the stored metadata of one mailbox up to date with the server.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MailboxSyncService {

    private final ClientProperties properties;
    private final CommandDispatcher dispatcher;
    private final MailboxService mailboxService;
    private final FlagReconciler reconciler;
    private final MailboxInfoStore store;

    public MailboxInfo sync(ImapSession session, String mailbox) {
        String server = session.getServerName();
        MailboxInfo stored = store.load(server, mailbox).orElse(null);
        MailboxState state = mailboxService.select(session, mailbox, true);

        if (stored != null && stored.getUidValidity() != 0 && stored.getUidValidity() != state.getUidValidity()) {
            log.warn("UIDVALIDITY of {}/{} changed from {} to {}, discarding stored marks",
                    server, mailbox, stored.getUidValidity(), state.getUidValidity());
            stored = null;
        }

        long start = startArticle(stored, overlap(server));
        state.setStartArticle(start);
        CommandResult listing = dispatcher.runChecked(session, "UID FETCH %d:* (UID FLAGS)", start);
        FlagListing.apply(state, listing, start);

        MailboxInfo info = reconciler.reconcile(server, state, stored);
        store.save(info);
        log.info("Synced {}/{} from UID {}: {} articles listed, active {}",
                server, mailbox, start, state.getExisting().size(), info.getActive());
        return info;
    }

    /**
     * 1 for a complete pass; otherwise re-list only the newest
     * {@code overlap} UIDs of the stored active range and everything above.
     */
    static long startArticle(MailboxInfo stored, int overlap) {
        if (stored == null || overlap <= 0) {
            return 1;
        }
        ActiveRange active = stored.getActive();
        if (active == null) {
            return 1;
        }
        return Math.max(1, active.high() - overlap + 1);
    }

    private int overlap(String server) {
        return properties.server(server).map(ClientProperties.Server::getResyncOverlap).orElse(0);
    }
}
