package com.ninesync.service;

import com.ninesync.domain.ActiveRange;
import com.ninesync.domain.MailboxInfo;
import com.ninesync.domain.MailboxInfoRecord;
import com.ninesync.domain.Mark;
import com.ninesync.domain.UidRange;
import com.ninesync.mapper.MailboxInfoMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

/**
 * DatabaseMailboxInfoStore unit tests
 */
@ExtendWith(MockitoExtension.class)
class DatabaseMailboxInfoStoreTest {

    @Mock
    private MailboxInfoMapper mapper;

    @InjectMocks
    private DatabaseMailboxInfoStore store;

    @Test
    @DisplayName("Save writes ranges in their text form")
    void testSave() {
        Map<Mark, UidRange> marks = new EnumMap<>(Mark.class);
        marks.put(Mark.TICK, UidRange.parse("5,9:10"));
        marks.put(Mark.EXPIRE, UidRange.empty());
        MailboxInfo info = MailboxInfo.builder()
                .server("srv").mailbox("INBOX").uidValidity(42)
                .active(new ActiveRange(1, 10))
                .read(UidRange.parse("1:4,6"))
                .marks(marks)
                .highestModSeq(77)
                .build();

        store.save(info);

        ArgumentCaptor<MailboxInfoRecord> captor = ArgumentCaptor.forClass(MailboxInfoRecord.class);
        verify(mapper).upsert(captor.capture());
        MailboxInfoRecord record = captor.getValue();
        assertThat(record.getActiveLow()).isEqualTo(1);
        assertThat(record.getActiveHigh()).isEqualTo(10);
        assertThat(record.getReadRange()).isEqualTo("1:4,6");
        assertThat(record.getMarks()).isEqualTo("tick=5,9:10");
        assertThat(record.getHighestModSeq()).isEqualTo(77);
        assertThat(record.getUpdatedAt()).isNotNull();
    }

    @Test
    @DisplayName("Load restores ranges and skips unknown marks")
    void testLoad() {
        MailboxInfoRecord record = MailboxInfoRecord.builder()
                .server("srv").mailbox("INBOX").uidValidity(42)
                .activeLow(3).activeHigh(20)
                .readRange("3:8")
                .marks("tick=4;bogus=1:2;reply=7:9")
                .build();
        when(mapper.findByServerAndMailbox("srv", "INBOX")).thenReturn(record);

        MailboxInfo info = store.load("srv", "INBOX").orElseThrow();

        assertThat(info.getActive()).isEqualTo(new ActiveRange(3, 20));
        assertThat(info.getRead()).isEqualTo(UidRange.interval(3, 8));
        assertThat(info.getMarks()).containsOnlyKeys(Mark.TICK, Mark.REPLY);
        assertThat(info.mark(Mark.REPLY)).isEqualTo(UidRange.interval(7, 9));
        assertThat(info.mark(Mark.DORMANT).isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Unknown mailbox loads as empty")
    void testLoadMissing() {
        when(mapper.findByServerAndMailbox(anyString(), anyString())).thenReturn(null);

        assertThat(store.load("srv", "Nope")).isEmpty();
    }

    @Test
    @DisplayName("Load all and delete delegate to the mapper")
    void testLoadAllAndDelete() {
        when(mapper.findByServer("srv")).thenReturn(List.of(
                MailboxInfoRecord.builder().server("srv").mailbox("A").activeLow(1).activeHigh(0).build(),
                MailboxInfoRecord.builder().server("srv").mailbox("B").activeLow(1).activeHigh(3).build()));

        assertThat(store.loadAll("srv")).extracting(MailboxInfo::getMailbox).containsExactly("A", "B");

        store.delete("srv", "A");
        verify(mapper).deleteByServerAndMailbox("srv", "A");
    }
}
