package com.ninesync.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumMap;
import java.util.Map;

/**
 * Locally persisted metadata for one mailbox, as consumed by the reading
 * application: active range, read range and per-mark ranges.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MailboxInfo {

    private String server;
    private String mailbox;
    private long uidValidity;
    private ActiveRange active;

    @Builder.Default
    private UidRange read = UidRange.empty();

    /** Every mark except {@link Mark#READ}; absent key means no articles carry it. */
    @Builder.Default
    private Map<Mark, UidRange> marks = new EnumMap<>(Mark.class);

    private long highestModSeq;

    public UidRange mark(Mark mark) {
        if (mark == Mark.READ) {
            return read;
        }
        UidRange range = marks.get(mark);
        return range != null ? range : UidRange.empty();
    }
}
