package com.ninesync.domain;

/**
 * What happened to articles after they were marked deleted.
 */
public enum ExpungeOutcome {
    /** Exactly the target UIDs were expunged (UID EXPUNGE). */
    EXPUNGED,
    /** A full EXPUNGE ran; every deleted article in the mailbox is gone. */
    EXPUNGED_ALL,
    /** Marked \Deleted only; neither scoped nor unscoped expunge was possible. */
    NOT_EXPUNGED,
    /** Empty target, no command sent. */
    NOTHING_TO_DELETE
}
