package com.maildesk.mapper;

import com.maildesk.domain.UndeliveredEmail;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface UndeliveredEmailMapper {

    void insert(UndeliveredEmail undelivered);
}
