package com.ninesync.service;

/**
 * Login name and secret for one server.
 */
public record Credentials(String user, String secret) {

    @Override
    public String toString() {
        return "Credentials[user=" + user + ", secret=****]";
    }
}
