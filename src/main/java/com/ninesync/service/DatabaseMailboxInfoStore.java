package com.ninesync.service;

import com.ninesync.domain.ActiveRange;
import com.ninesync.domain.MailboxInfo;
import com.ninesync.domain.MailboxInfoRecord;
import com.ninesync.domain.Mark;
import com.ninesync.domain.UidRange;
import com.ninesync.mapper.MailboxInfoMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * MyBatis-backed mailbox metadata store (SQLite).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DatabaseMailboxInfoStore implements MailboxInfoStore {

    private final MailboxInfoMapper mapper;

    @Override
    public Optional<MailboxInfo> load(String server, String mailbox) {
        return Optional.ofNullable(mapper.findByServerAndMailbox(server, mailbox)).map(this::toInfo);
    }

    @Override
    public List<MailboxInfo> loadAll(String server) {
        List<MailboxInfo> result = new ArrayList<>();
        for (MailboxInfoRecord record : mapper.findByServer(server)) {
            result.add(toInfo(record));
        }
        return result;
    }

    @Override
    @Transactional
    public void save(MailboxInfo info) {
        ActiveRange active = info.getActive() != null ? info.getActive() : new ActiveRange(1, 0);
        mapper.upsert(MailboxInfoRecord.builder()
                .server(info.getServer())
                .mailbox(info.getMailbox())
                .uidValidity(info.getUidValidity())
                .activeLow(active.low())
                .activeHigh(active.high())
                .readRange(info.getRead().toString())
                .marks(formatMarks(info.getMarks()))
                .highestModSeq(info.getHighestModSeq())
                .updatedAt(LocalDateTime.now())
                .build());
        log.debug("Saved mailbox info {}/{}: active={}, read={}",
                info.getServer(), info.getMailbox(), active, info.getRead());
    }

    @Override
    @Transactional
    public void delete(String server, String mailbox) {
        mapper.deleteByServerAndMailbox(server, mailbox);
    }

    private MailboxInfo toInfo(MailboxInfoRecord record) {
        return MailboxInfo.builder()
                .server(record.getServer())
                .mailbox(record.getMailbox())
                .uidValidity(record.getUidValidity())
                .active(new ActiveRange(record.getActiveLow(), record.getActiveHigh()))
                .read(UidRange.parse(record.getReadRange()))
                .marks(parseMarks(record.getMarks()))
                .highestModSeq(record.getHighestModSeq())
                .build();
    }

    static String formatMarks(Map<Mark, UidRange> marks) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<Mark, UidRange> entry : marks.entrySet()) {
            if (entry.getValue().isEmpty()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(';');
            }
            sb.append(entry.getKey().label()).append('=').append(entry.getValue());
        }
        return sb.toString();
    }

    static Map<Mark, UidRange> parseMarks(String text) {
        Map<Mark, UidRange> marks = new EnumMap<>(Mark.class);
        if (text == null || text.isBlank()) {
            return marks;
        }
        for (String pair : text.split(";")) {
            int eq = pair.indexOf('=');
            if (eq <= 0) {
                log.warn("Ignoring malformed stored mark entry: {}", pair);
                continue;
            }
            Optional<Mark> mark = Mark.forLabel(pair.substring(0, eq).trim());
            if (mark.isEmpty()) {
                log.warn("Ignoring unknown stored mark: {}", pair.substring(0, eq));
                continue;
            }
            marks.put(mark.get(), UidRange.parse(pair.substring(eq + 1).trim()));
        }
        return marks;
    }
}
