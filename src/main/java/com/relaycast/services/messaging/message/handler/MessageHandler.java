package com.relaycast.services.messaging.message.handler;

import com.relaycast.services.messaging.contact.model.Contact;
import com.relaycast.services.messaging.message.model.Msg;

/**
 * Processes an incoming message. Handlers are tried in {@link org.springframework.core.annotation.Order}
 * until one of them claims the message.
 */
public interface MessageHandler {

    /**
     * @return true if the message was handled and no further handler should see it
     */
    boolean handle(Msg msg, Contact contact);
}
