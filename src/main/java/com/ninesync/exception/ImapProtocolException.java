package com.ninesync.exception;

import lombok.Getter;

/**
 * A command completed with NO or BAD. The session stays open.
 */
@Getter
public class ImapProtocolException extends ImapClientException {

    private final String status;
    private final String statusText;

    public ImapProtocolException(String server, String command, String status, String statusText) {
        super(server, command + " failed on " + server + ": " + status + " " + statusText);
        this.status = status;
        this.statusText = statusText;
    }
}
