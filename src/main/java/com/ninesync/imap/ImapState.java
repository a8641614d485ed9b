package com.ninesync.imap;

/**
 * Client side of the IMAP session state machine
 */
public enum ImapState {
    /** TCP connected, greeting not yet read */
    CONNECTING,
    /** Greeting read - before authentication */
    NOT_AUTHENTICATED,
    /** Authenticated - before mailbox selection */
    AUTHENTICATED,
    /** A mailbox is selected - message operations allowed */
    SELECTED,
    /** Stream closed */
    LOGOUT
}
