package com.maildesk.mapper;

import com.maildesk.domain.TicketAttachment;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface TicketAttachmentMapper {

    void insert(TicketAttachment attachment);

    TicketAttachment findById(@Param("id") long id);

    List<TicketAttachment> findByTicketId(@Param("ticketId") String ticketId);
}
