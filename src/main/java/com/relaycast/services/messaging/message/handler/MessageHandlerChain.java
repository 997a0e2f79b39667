package com.relaycast.services.messaging.message.handler;

import java.time.LocalDateTime;
import java.util.List;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import com.relaycast.services.messaging.contact.model.Contact;
import com.relaycast.services.messaging.counts.service.impl.SystemLabelCounter;
import com.relaycast.services.messaging.message.enums.MessageStatus;
import com.relaycast.services.messaging.message.enums.MsgType;
import com.relaycast.services.messaging.message.enums.Visibility;
import com.relaycast.services.messaging.message.model.Msg;
import com.relaycast.services.messaging.message.repository.MsgRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs an incoming message through the handlers, then marks it handled.
 * Messages from blocked contacts are archived without being handled by anyone.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MessageHandlerChain {

    private final List<MessageHandler> handlers; // in @Order
    private final MsgRepository msgRepository;
    private final SystemLabelCounter systemLabelCounter;

    @Transactional
    public void process(Msg msg, Contact contact) {
        Msg before = msg.toBuilder().build();

        if (contact.isBlocked()) {
            msg.setVisibility(Visibility.ARCHIVED);
            log.info("Archived msgId={} from blocked contactId={}", msg.getId(), contact.getId());
        } else {
            for (MessageHandler handler : handlers) {
                try {
                    if (handler.handle(msg, contact)) {
                        log.debug("msgId={} handled by {}", msg.getId(), handler.getClass().getSimpleName());
                        break;
                    }
                } catch (Exception e) {
                    log.error("Handler {} failed on msgId={}", handler.getClass().getSimpleName(), msg.getId(), e);
                }
            }
        }

        markHandled(msg);
        systemLabelCounter.recordChange(before, msg);
        msgRepository.save(msg);
    }

    private void markHandled(Msg msg) {
        msg.setStatus(MessageStatus.HANDLED);
        if (msg.getMsgType() == null) {
            msg.setMsgType(MsgType.INBOX);
        }
        msg.setModifiedOn(LocalDateTime.now());
    }
}
