package com.ninesync.service;

import com.ninesync.domain.MailboxState;
import com.ninesync.exception.ImapProtocolException;
import com.ninesync.imap.CommandDispatcher;
import com.ninesync.imap.CommandResult;
import com.ninesync.imap.ImapSession;
import com.ninesync.imap.MailboxNames;
import com.ninesync.imap.reply.AttrList;
import com.ninesync.imap.reply.ListNode;
import com.ninesync.imap.reply.ReplyTree;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Mailbox level commands: SELECT/EXAMINE, LIST and CREATE.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MailboxService {

    private final CommandDispatcher dispatcher;

    /**
     * Select (or examine, when {@code readOnly}) a mailbox and record it as the
     * session's single selected mailbox.
     *
     * @return fresh state carrying EXISTS, FLAGS, PERMANENTFLAGS, UIDNEXT,
     *         UIDVALIDITY and HIGHESTMODSEQ as reported
     */
    public MailboxState select(ImapSession session, String mailbox, boolean readOnly) {
        CommandResult result;
        try {
            result = dispatcher.runChecked(session, "%s %s",
                    readOnly ? "EXAMINE" : "SELECT", CommandDispatcher.mailbox(mailbox));
        } catch (ImapProtocolException e) {
            // A failed SELECT leaves no mailbox selected
            session.selected(null);
            throw e;
        }

        MailboxState state = new MailboxState(mailbox);
        for (ReplyTree reply : result.untagged()) {
            String keyword = reply.keyword();
            if ("EXISTS".equals(keyword)) {
                state.setExists((int) reply.atom(1).longValue());
            } else if ("FLAGS".equals(keyword)) {
                ListNode flags = reply.list(2);
                if (flags != null) {
                    state.setAvailableFlags(atoms(flags));
                }
            }
        }
        result.responseCode("PERMANENTFLAGS")
                .ifPresent(code -> state.setPermanentFlags(new LinkedHashSet<>(code.atoms().subList(1, code.atoms().size()))));
        numericCode(result, "UIDNEXT").ifPresent(state::setUidNext);
        numericCode(result, "UIDVALIDITY").ifPresent(state::setUidValidity);
        numericCode(result, "HIGHESTMODSEQ").ifPresent(state::setHighestModSeq);

        session.mailbox(state);
        session.selected(mailbox);
        log.info("Selected {} on {} ({} messages, UIDNEXT {}, UIDVALIDITY {})",
                mailbox, session.getServerName(), state.getExists(), state.getUidNext(), state.getUidValidity());
        return state;
    }

    /** All mailbox names on the server, decoded. */
    public List<String> list(ImapSession session) {
        CommandResult result = dispatcher.runChecked(session, "LIST \"\" \"*\"");
        List<String> names = new ArrayList<>();
        for (ReplyTree reply : result.untagged("LIST")) {
            String wireName = reply.text(reply.size() - 1);
            if (wireName != null) {
                names.add(MailboxNames.decode(wireName));
            }
        }
        return names;
    }

    /**
     * Create a mailbox. A refusal is accepted when the mailbox turns out to
     * exist already.
     */
    public void create(ImapSession session, String mailbox) {
        CommandResult result = dispatcher.runCommand(session, "CREATE %s", CommandDispatcher.mailbox(mailbox));
        if (result.ok()) {
            log.info("Created mailbox {} on {}", mailbox, session.getServerName());
            return;
        }
        if (list(session).contains(mailbox)) {
            log.debug("Mailbox {} already exists on {}", mailbox, session.getServerName());
            return;
        }
        throw new ImapProtocolException(session.getServerName(), "CREATE", result.status(), result.statusText());
    }

    /**
     * Names in {@code names} the server does not list, INBOX excepted.
     */
    public List<String> missing(ImapSession session, Collection<String> names) {
        Set<String> existing = new HashSet<>(list(session));
        List<String> missing = new ArrayList<>();
        for (String name : names) {
            if (!existing.contains(name) && !MailboxNames.INBOX.equalsIgnoreCase(name)) {
                missing.add(name);
            }
        }
        return missing;
    }

    private static Set<String> atoms(ListNode list) {
        Set<String> values = new LinkedHashSet<>();
        for (int i = 0; i < list.size(); i++) {
            String text = list.text(i);
            if (text != null) {
                values.add(text);
            }
        }
        return values;
    }

    private static Optional<Long> numericCode(CommandResult result, String code) {
        Optional<AttrList> attr = result.responseCode(code);
        if (attr.isEmpty() || attr.get().arg(0) == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(attr.get().arg(0)));
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-numeric {} value: {}", code, attr.get().arg(0));
            return Optional.empty();
        }
    }
}
