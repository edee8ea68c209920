package com.maildesk.mapper;

import com.maildesk.domain.Ticket;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

@Mapper
public interface TicketMapper {

    void insert(Ticket ticket);

    Ticket findById(@Param("ticketId") String ticketId);

    int countById(@Param("ticketId") String ticketId);

    void touchFollowUp(@Param("ticketId") String ticketId,
                       @Param("updatedAt") String updatedAt,
                       @Param("deliveryStatus") String deliveryStatus);

    int countAll();
}
