package com.ninesync.imap;

import com.ninesync.imap.reply.AttrList;
import com.ninesync.imap.reply.ReplyTree;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of one command: its untagged data and the tagged completion.
 *
 * @param malformed the reply could not be parsed; {@code untagged} is empty
 */
public record CommandResult(String tag,
                            String status,
                            String statusText,
                            List<ReplyTree> untagged,
                            boolean malformed) {

    public CommandResult {
        untagged = List.copyOf(untagged);
    }

    public boolean ok() {
        return "OK".equals(status) && !malformed;
    }

    /** Untagged lines whose keyword (after any message number) matches. */
    public List<ReplyTree> untagged(String keyword) {
        List<ReplyTree> matches = new ArrayList<>();
        for (ReplyTree reply : untagged) {
            if (reply.keyword().equalsIgnoreCase(keyword)) {
                matches.add(reply);
            }
        }
        return matches;
    }

    /** First bracketed response code with the given name on an untagged status line. */
    public Optional<AttrList> responseCode(String code) {
        for (ReplyTree reply : untagged) {
            Optional<AttrList> attr = reply.responseCode();
            if (attr.isPresent() && attr.get().code().equalsIgnoreCase(code)) {
                return attr;
            }
        }
        return Optional.empty();
    }
}
