package com.ninesync.domain;

import lombok.Data;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Server-side view of one mailbox as observed during the current sync pass.
 */
@Data
public class MailboxState {

    private final String name;

    /** UIDs seen in the flag listing. */
    private UidRange existing = UidRange.empty();

    /** Flag token to the UIDs carrying it, keyed as the server spelled the flag. */
    private Map<String, UidRange> flags = new LinkedHashMap<>();

    private Long uidNext;
    private long uidValidity;
    private long highestModSeq;
    private int exists;

    /** Null until the server reports PERMANENTFLAGS. */
    private Set<String> permanentFlags;

    private Set<String> availableFlags = new LinkedHashSet<>();

    /** Lowest UID included in this pass; 1 for a complete sync. */
    private long startArticle = 1;

    /**
     * UIDs carrying the given flag, matched case-insensitively, or null when
     * no listed article carried it.
     */
    public UidRange uidsWithFlag(String flag) {
        if (flag == null) {
            return null;
        }
        for (Map.Entry<String, UidRange> entry : flags.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(flag)) {
                return entry.getValue();
            }
        }
        return null;
    }

    public void addFlag(String flag, long uid) {
        addFlag(flag, UidRange.of(uid));
    }

    public void addFlag(String flag, UidRange uids) {
        for (Map.Entry<String, UidRange> entry : flags.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(flag)) {
                entry.setValue(entry.getValue().union(uids));
                return;
            }
        }
        flags.put(flag, uids);
    }

    /** Forget the given UIDs entirely, as after an expunge. */
    public void remove(UidRange uids) {
        existing = existing.subtract(uids);
        flags.replaceAll((flag, range) -> range.subtract(uids));
        flags.values().removeIf(UidRange::isEmpty);
    }

    public long high() {
        if (uidNext != null) {
            return uidNext - 1;
        }
        return existing.isEmpty() ? 0 : existing.max();
    }

    public long low() {
        if (existing.isEmpty()) {
            return uidNext != null ? uidNext : 1;
        }
        return existing.min();
    }

    /**
     * Whether the server can keep the flag on messages of this mailbox.
     * Unknown PERMANENTFLAGS counts as storable.
     */
    public boolean canStore(String flag) {
        if (permanentFlags == null) {
            return true;
        }
        for (String permanent : permanentFlags) {
            if ("\\*".equals(permanent) || permanent.equalsIgnoreCase(flag)) {
                return true;
            }
        }
        return false;
    }
}
