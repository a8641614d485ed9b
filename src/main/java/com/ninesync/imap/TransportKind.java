package com.ninesync.imap;

/**
 * How the byte stream to the server is secured.
 */
public enum TransportKind {
    /** Cleartext; may be upgraded opportunistically when the server offers STARTTLS */
    PLAIN,
    /** TLS from the first byte (port 993) */
    TLS,
    /** Cleartext connect followed by a mandatory STARTTLS upgrade */
    STARTTLS
}
