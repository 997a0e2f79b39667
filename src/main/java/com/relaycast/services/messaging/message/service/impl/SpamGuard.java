package com.relaycast.services.messaging.message.service.impl;

import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.List;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import com.relaycast.services.messaging.channel.model.Channel;
import com.relaycast.services.messaging.common.converter.StringListConverter;
import com.relaycast.services.messaging.config.MessageProperties;
import com.relaycast.services.messaging.contact.dto.Urn;
import com.relaycast.services.messaging.contact.model.ContactUrn;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Detects automated reply loops: the same outgoing message sent to the same URN over and over.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SpamGuard {

    private static final String SAME_MSG_SQL = """
            SELECT COUNT(*) FROM msgs m
            JOIN contacts c ON c.id = m.contact_id
            WHERE m.contact_urn_id = ?
              AND m.channel_id <=> ?
              AND m.text = ?
              AND m.attachments <=> ?
              AND m.direction = 'OUTGOING'
              AND m.msg_type <> 'IVR'
              AND c.is_test = FALSE
              AND m.created_on >= ?
            """;

    private static final String SAME_TEXT_SQL = """
            SELECT COUNT(*) FROM msgs m
            JOIN contacts c ON c.id = m.contact_id
            WHERE m.contact_urn_id = ?
              AND m.channel_id <=> ?
              AND m.text = ?
              AND m.direction = 'OUTGOING'
              AND c.is_test = FALSE
              AND m.created_on >= ?
            """;

    private final JdbcTemplate jdbcTemplate;
    private final MessageProperties messageProperties;
    private final StringListConverter attachmentsConverter = new StringListConverter();

    /**
     * Whether sending this message now would continue a loop. Short codes get a longer window.
     */
    public boolean isLoop(ContactUrn urn, Channel channel, String text, List<String> attachments,
            LocalDateTime now) {
        MessageProperties.SpamGuard guard = messageProperties.getSpamGuard();
        Long channelId = channel == null ? null : channel.getId();

        Integer recent = jdbcTemplate.queryForObject(SAME_MSG_SQL, Integer.class,
                urn.getId(), channelId, text, attachmentsConverter.convertToDatabaseColumn(attachments),
                Timestamp.valueOf(now.minus(guard.getWindow())));

        if (recent != null && recent >= guard.getThreshold()) {
            log.warn("Message loop caught. urnId={} channelId={} recentCount={}", urn.getId(), channelId, recent);
            return true;
        }

        if (Urn.TEL.equals(urn.getScheme()) && urn.getPath().length() < guard.getShortCodeMaxLength()) {
            Integer daily = jdbcTemplate.queryForObject(SAME_TEXT_SQL, Integer.class,
                    urn.getId(), channelId, text, Timestamp.valueOf(now.minus(guard.getShortCodeWindow())));

            if (daily != null && daily >= guard.getThreshold()) {
                log.warn("Short code loop caught. urnId={} path={} dailyCount={}", urn.getId(), urn.getPath(), daily);
                return true;
            }
        }
        return false;
    }
}
