package com.maildesk.service;

import com.maildesk.domain.Member;
import com.maildesk.exception.StorageException;
import com.maildesk.mapper.MemberMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * MembershipService unit tests
 */
@ExtendWith(MockitoExtension.class)
class MembershipServiceTest {

    @Mock
    private MemberMapper memberMapper;

    @InjectMocks
    private MembershipService membershipService;

    @Test
    @DisplayName("Membership reference wins over the sender address")
    void testResolveByRef() {
        Member member = Member.builder().ffnum("AB12345").build();
        when(memberMapper.findByFfnum("AB12345")).thenReturn(member);

        assertThat(membershipService.resolve("AB12345", "alice@example.com")).contains(member);
        verify(memberMapper, never()).findByEmail(anyString());
    }

    @Test
    @DisplayName("Unknown reference falls back to the sender address")
    void testFallbackToEmail() {
        Member member = Member.builder().ffnum("ZZ99999").email("alice@example.com").build();
        when(memberMapper.findByFfnum("AB12345")).thenReturn(null);
        when(memberMapper.findByEmail("alice@example.com")).thenReturn(member);

        assertThat(membershipService.resolve("AB12345", "alice@example.com")).contains(member);
    }

    @Test
    @DisplayName("No reference and no sender resolves to nothing")
    void testNothingToResolve() {
        assertThat(membershipService.resolve(null, "")).isEmpty();
        verifyNoInteractions(memberMapper);
    }

    @Test
    @DisplayName("Lookup failures surface as storage errors")
    void testLookupFailure() {
        when(memberMapper.findByEmail("alice@example.com")).thenThrow(new RuntimeException("no such table: member"));

        assertThatThrownBy(() -> membershipService.resolve(null, "alice@example.com"))
                .isInstanceOf(StorageException.class);
    }
}
