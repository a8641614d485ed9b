package com.ninesync.mapper;

import com.ninesync.domain.MailboxInfoRecord;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface MailboxInfoMapper {

    void upsert(MailboxInfoRecord record);

    MailboxInfoRecord findByServerAndMailbox(@Param("server") String server, @Param("mailbox") String mailbox);

    List<MailboxInfoRecord> findByServer(@Param("server") String server);

    void deleteByServerAndMailbox(@Param("server") String server, @Param("mailbox") String mailbox);
}
