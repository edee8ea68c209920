package com.maildesk.mapper;

import com.maildesk.domain.Member;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

@Mapper
public interface MemberMapper {

    Member findByFfnum(@Param("ffnum") String ffnum);

    Member findByEmail(@Param("email") String email);
}
