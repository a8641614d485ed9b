package com.ninesync.exception;

import lombok.Getter;

/**
 * Base of all failures reported by the IMAP client.
 */
@Getter
public class ImapClientException extends RuntimeException {

    private final String server;

    public ImapClientException(String server, String message) {
        super(message);
        this.server = server;
    }

    public ImapClientException(String server, String message, Throwable cause) {
        super(message, cause);
        this.server = server;
    }
}
