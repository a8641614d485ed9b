package com.ninesync.service;

import com.ninesync.domain.MailboxInfo;

import java.util.List;
import java.util.Optional;

/**
 * Persisted per-mailbox metadata: active range, read range and mark ranges.
 */
public interface MailboxInfoStore {

    Optional<MailboxInfo> load(String server, String mailbox);

    List<MailboxInfo> loadAll(String server);

    void save(MailboxInfo info);

    void delete(String server, String mailbox);
}
