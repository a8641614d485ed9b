package com.ninesync.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Local article marks and the IMAP flag each one is stored as.
 * System flags also answer to their keyword form without the backslash,
 * which some servers echo back for client-set flags.
 */
public enum Mark {

    READ("read", "\\Seen", "Seen"),
    TICK("tick", "\\Flagged", "Flagged"),
    REPLY("reply", "\\Answered", "Answered"),
    EXPIRE("expire", "gnus-expire", null),
    DORMANT("dormant", "gnus-dormant", null),
    SCORE("score", "gnus-score", null),
    SAVE("save", "gnus-save", null),
    DOWNLOAD("download", "gnus-download", null),
    FORWARD("forward", "gnus-forward", "$Forwarded");

    private final String label;
    private final String flag;
    private final String alternateFlag;

    Mark(String label, String flag, String alternateFlag) {
        this.label = label;
        this.flag = flag;
        this.alternateFlag = alternateFlag;
    }

    public String label() {
        return label;
    }

    /** Canonical protocol flag token. */
    public String flag() {
        return flag;
    }

    /** Alternate encoding of the flag, or null. */
    public String alternateFlag() {
        return alternateFlag;
    }

    public static Optional<Mark> forFlag(String flag) {
        if (flag == null) {
            return Optional.empty();
        }
        for (Mark mark : values()) {
            if (mark.flag.equalsIgnoreCase(flag)
                    || (mark.alternateFlag != null && mark.alternateFlag.equalsIgnoreCase(flag))) {
                return Optional.of(mark);
            }
        }
        return Optional.empty();
    }

    public static Optional<Mark> forLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String lower = label.toLowerCase(Locale.ROOT);
        for (Mark mark : values()) {
            if (mark.label.equals(lower)) {
                return Optional.of(mark);
            }
        }
        return Optional.empty();
    }
}
