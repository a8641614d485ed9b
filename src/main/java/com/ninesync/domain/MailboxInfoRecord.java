package com.ninesync.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * mailbox_info table row. Ranges are stored in their text form ({@code 1:5,7});
 * marks as {@code label=range} pairs separated by {@code ;}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MailboxInfoRecord {
    private String server;
    private String mailbox;
    private long uidValidity;
    private long activeLow;
    private long activeHigh;
    private String readRange;
    private String marks;
    private long highestModSeq;
    private LocalDateTime updatedAt;
}
