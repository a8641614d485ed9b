package com.ninesync.exception;

import com.ninesync.imap.TransportKind;
import lombok.Getter;

/**
 * Connect, handshake or stream failure. Fatal to the operation; no retry is attempted.
 */
@Getter
public class ImapTransportException extends ImapClientException {

    private final TransportKind transport;

    public ImapTransportException(String server, TransportKind transport, String message) {
        super(server, server + " (" + transport + "): " + message);
        this.transport = transport;
    }

    public ImapTransportException(String server, TransportKind transport, String message, Throwable cause) {
        super(server, server + " (" + transport + "): " + message, cause);
        this.transport = transport;
    }
}
