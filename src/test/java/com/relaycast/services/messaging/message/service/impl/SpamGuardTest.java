package com.relaycast.services.messaging.message.service.impl;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;

import com.relaycast.services.messaging.channel.model.Channel;
import com.relaycast.services.messaging.config.MessageProperties;
import com.relaycast.services.messaging.contact.dto.Urn;
import com.relaycast.services.messaging.contact.model.ContactUrn;

@ExtendWith(MockitoExtension.class)
@DisplayName("SpamGuard unit tests")
class SpamGuardTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 5, 1, 12, 0);
    private static final Timestamp TEN_MINUTES_AGO = Timestamp.valueOf(NOW.minusMinutes(10));
    private static final Timestamp A_DAY_AGO = Timestamp.valueOf(NOW.minusHours(24));

    @Mock
    private JdbcTemplate jdbcTemplate;

    private SpamGuard spamGuard;

    private Channel channel;

    @BeforeEach
    void setUp() {
        spamGuard = new SpamGuard(jdbcTemplate, new MessageProperties());
        channel = Channel.builder().id(8L).channelType("T").schemes(List.of(Urn.TEL)).build();
    }

    private static ContactUrn tel(Long id, String path) {
        return ContactUrn.builder().id(id).orgId(1L).contactId(1L).scheme(Urn.TEL).path(path)
                .identity("tel:" + path).build();
    }

    private static String sameMessageSql() {
        return argThat(sql -> sql != null && sql.contains("m.attachments"));
    }

    private static String sameTextSql() {
        return argThat(sql -> sql != null && !sql.contains("m.attachments"));
    }

    private void givenRecentSameMessages(Long urnId, int count) {
        when(jdbcTemplate.queryForObject(sameMessageSql(), eq(Integer.class),
                eq(urnId), eq(8L), eq("Thanks!"), isNull(), eq(TEN_MINUTES_AGO)))
                .thenReturn(count);
    }

    @Test
    @DisplayName("Nine identical messages in the window are not a loop")
    void isLoop_belowThreshold_passes() {
        givenRecentSameMessages(10L, 9);

        assertFalse(spamGuard.isLoop(tel(10L, "+250788000001"), channel, "Thanks!", null, NOW));

        // a full number never runs the short code check
        verifyNoMoreInteractions(jdbcTemplate);
    }

    @Test
    @DisplayName("The tenth identical message in the window is a loop")
    void isLoop_atThreshold_dropped() {
        givenRecentSameMessages(10L, 10);

        assertTrue(spamGuard.isLoop(tel(10L, "+250788000001"), channel, "Thanks!", null, NOW));

        verifyNoMoreInteractions(jdbcTemplate);
    }

    @Test
    @DisplayName("Attachments are part of what makes two messages the same")
    void isLoop_attachmentsCompared() {
        when(jdbcTemplate.queryForObject(sameMessageSql(), eq(Integer.class),
                eq(10L), eq(8L), eq("Thanks!"), eq("[\"image/jpeg:https://x/a.jpg\"]"), eq(TEN_MINUTES_AGO)))
                .thenReturn(10);

        assertTrue(spamGuard.isLoop(tel(10L, "+250788000001"), channel, "Thanks!",
                List.of("image/jpeg:https://x/a.jpg"), NOW));
    }

    @Test
    @DisplayName("A short code is checked for the same text over the last day")
    void isLoop_shortCode_dailyWindow() {
        // Given: quiet for the last ten minutes, ten of the same text today
        givenRecentSameMessages(20L, 0);
        when(jdbcTemplate.queryForObject(sameTextSql(), eq(Integer.class),
                eq(20L), eq(8L), eq("Thanks!"), eq(A_DAY_AGO)))
                .thenReturn(10);

        // When / Then
        assertTrue(spamGuard.isLoop(tel(20L, "3456"), channel, "Thanks!", null, NOW));
    }

    @Test
    @DisplayName("A short code under the daily threshold passes")
    void isLoop_shortCode_belowDailyThreshold_passes() {
        givenRecentSameMessages(20L, 3);
        when(jdbcTemplate.queryForObject(sameTextSql(), eq(Integer.class),
                eq(20L), eq(8L), eq("Thanks!"), eq(A_DAY_AGO)))
                .thenReturn(9);

        assertFalse(spamGuard.isLoop(tel(20L, "3456"), channel, "Thanks!", null, NOW));
    }
}
