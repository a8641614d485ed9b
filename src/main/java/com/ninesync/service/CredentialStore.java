package com.ninesync.service;

import java.util.List;
import java.util.Optional;

/**
 * Source of login credentials.
 */
public interface CredentialStore {

    /**
     * @param host  host name or address as configured
     * @param ports port numbers or service names ("imap", "imaps") to try
     */
    Optional<Credentials> lookup(String host, List<String> ports);

    /** Drop cached credentials after the server rejected them. */
    void forget(String host, int port);
}
