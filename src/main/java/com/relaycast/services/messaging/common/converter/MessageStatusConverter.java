package com.relaycast.services.messaging.common.converter;

import com.relaycast.services.messaging.message.enums.MessageStatus;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Persists {@link MessageStatus} as its single character code.
 */
@Converter
public class MessageStatusConverter implements AttributeConverter<MessageStatus, String> {

    @Override
    public String convertToDatabaseColumn(MessageStatus status) {
        return status == null ? null : String.valueOf(status.getCode());
    }

    @Override
    public MessageStatus convertToEntityAttribute(String code) {
        return code == null || code.isEmpty() ? null : MessageStatus.fromCode(code.charAt(0));
    }
}
