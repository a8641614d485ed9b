package com.ninesync.exception;

/**
 * Login rejected or no credentials available.
 */
public class ImapAuthenticationException extends ImapClientException {

    public ImapAuthenticationException(String server, String message) {
        super(server, message);
    }
}
