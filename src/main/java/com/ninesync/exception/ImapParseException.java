package com.ninesync.exception;

/**
 * Reply structure could not be parsed; the data is unusable but the session is not.
 * Raised by the parser, which does not know the server.
 */
public class ImapParseException extends ImapClientException {

    public ImapParseException(String message) {
        super(null, message);
    }

    public ImapParseException(String message, Throwable cause) {
        super(null, message, cause);
    }
}
