package com.maildesk.mapper;

import com.maildesk.domain.TicketIdentity;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface TicketIdentityMapper {

    /**
     * INSERT OR IGNORE on the conversation key; returns 0 when another writer got there first
     */
    int insertIfAbsent(TicketIdentity identity);

    TicketIdentity findByKey(@Param("conversationKey") String conversationKey);

    List<TicketIdentity> findAll();

    void deleteAll();
}
