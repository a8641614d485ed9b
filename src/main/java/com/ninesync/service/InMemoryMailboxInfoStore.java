package com.ninesync.service;

import com.ninesync.domain.MailboxInfo;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-persistent store, for running without a database.
 */
public class InMemoryMailboxInfoStore implements MailboxInfoStore {

    private final Map<String, MailboxInfo> infos = new ConcurrentHashMap<>();

    @Override
    public Optional<MailboxInfo> load(String server, String mailbox) {
        return Optional.ofNullable(infos.get(key(server, mailbox))).map(InMemoryMailboxInfoStore::copy);
    }

    @Override
    public List<MailboxInfo> loadAll(String server) {
        List<MailboxInfo> result = new ArrayList<>();
        for (MailboxInfo info : infos.values()) {
            if (info.getServer().equals(server)) {
                result.add(copy(info));
            }
        }
        return result;
    }

    @Override
    public void save(MailboxInfo info) {
        infos.put(key(info.getServer(), info.getMailbox()), copy(info));
    }

    @Override
    public void delete(String server, String mailbox) {
        infos.remove(key(server, mailbox));
    }

    private static MailboxInfo copy(MailboxInfo info) {
        return info.toBuilder().marks(new EnumMap<>(info.getMarks())).build();
    }

    private static String key(String server, String mailbox) {
        return server + "\u0000" + mailbox;
    }
}
