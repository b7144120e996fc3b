package com.mailsync.mapper;

import com.mailsync.domain.AttachmentRef;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface AttachmentRefMapper {

    int insertIfAbsent(AttachmentRef attachment);

    List<AttachmentRef> findByMessageId(@Param("messageId") String messageId);
}
