package com.maildesk.mapper;

import com.maildesk.domain.SeenMessage;
import org.apache.ibatis.annotations.Mapper;

import java.util.List;

@Mapper
public interface SeenMessageMapper {

    /**
     * INSERT OR IGNORE; returns 0 when the uid was already present
     */
    int insertIfAbsent(SeenMessage seen);

    List<String> findAllUids();

    void deleteAll();
}
