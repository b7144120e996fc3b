package com.mailsync.mapper;

import com.mailsync.domain.SyncState;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface SyncStateMapper {

    SyncState findById(@Param("mailboxId") String mailboxId);

    List<SyncState> findAll();

    /**
     * Insert the row, or replace every column except a cursor that is already higher.
     */
    void upsert(SyncState state);

    /**
     * Raise the cursor. Returns 0 when the stored cursor is already at or above it.
     */
    int advanceCursor(@Param("mailboxId") String mailboxId,
                      @Param("cursor") long cursor,
                      @Param("lastUpdated") String lastUpdated);

    int updateStatus(@Param("mailboxId") String mailboxId,
                     @Param("status") String status,
                     @Param("lastUpdated") String lastUpdated);
}
