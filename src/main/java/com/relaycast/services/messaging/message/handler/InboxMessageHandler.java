package com.relaycast.services.messaging.message.handler;

import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import com.relaycast.services.messaging.contact.model.Contact;
import com.relaycast.services.messaging.message.enums.MsgType;
import com.relaycast.services.messaging.message.model.Msg;

import lombok.extern.slf4j.Slf4j;

/**
 * Files anything no other handler wanted into the inbox. Always last.
 */
@Slf4j
@Component
@Order(Ordered.LOWEST_PRECEDENCE)
public class InboxMessageHandler implements MessageHandler {

    @Override
    public boolean handle(Msg msg, Contact contact) {
        msg.setMsgType(MsgType.INBOX);
        log.debug("Filed msgId={} into inbox of orgId={}", msg.getId(), msg.getOrgId());
        return true;
    }
}
