package com.maildesk.mapper;

import com.maildesk.domain.TicketEvent;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface TicketEventMapper {

    void insert(TicketEvent event);

    int countByMessageUid(@Param("messageUid") String messageUid);

    List<TicketEvent> findByTicketId(@Param("ticketId") String ticketId);
}
