package com.ninesync.imap;

import java.time.Instant;

/**
 * A command written to the stream whose tagged completion has not been seen yet.
 *
 * @param kind     lower-case verb, e.g. "select" or "fetch"
 * @param detached reply is discarded on arrival instead of being awaited
 */
public record PendingCommand(String tag, String command, String kind, boolean detached, Instant sentAt) {
}
