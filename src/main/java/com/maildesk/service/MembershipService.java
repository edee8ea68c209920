package com.maildesk.service;

import com.maildesk.domain.Member;
import com.maildesk.exception.StorageException;
import com.maildesk.mapper.MemberMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Requester lookup in the member table
 * - By membership reference (FFNUM) when the message quotes one
 * - Otherwise by sender address
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MembershipService {

    private final MemberMapper memberMapper;

    public Optional<Member> resolve(String membershipRef, String senderEmail) {
        try {
            if (membershipRef != null && !membershipRef.isBlank()) {
                Member member = memberMapper.findByFfnum(membershipRef);
                if (member != null) {
                    return Optional.of(member);
                }
                log.debug("Membership reference {} not found, trying sender address", membershipRef);
            }
            if (senderEmail != null && !senderEmail.isBlank()) {
                return Optional.ofNullable(memberMapper.findByEmail(senderEmail));
            }
            return Optional.empty();
        } catch (RuntimeException e) {
            throw new StorageException("Member lookup failed for " + senderEmail, e);
        }
    }
}
