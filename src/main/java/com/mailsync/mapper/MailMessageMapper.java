package com.mailsync.mapper;

import com.mailsync.domain.MailMessage;
import com.mailsync.domain.MessageStats;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface MailMessageMapper {

    /**
     * Insert unless a row with the same id exists. Returns the number of rows written.
     */
    int insertIfAbsent(MailMessage message);

    MailMessage findById(@Param("id") String id);

    List<MailMessage> findByThreadId(@Param("threadId") String threadId);

    /**
     * Newest first; a null mailboxId spans every mailbox.
     */
    List<MailMessage> findRecent(@Param("mailboxId") String mailboxId, @Param("limit") int limit);

    MessageStats selectStats(@Param("mailboxId") String mailboxId);

    int countById(@Param("id") String id);
}
