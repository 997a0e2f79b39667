package com.relaycast.services.messaging.contact.dto;

import com.relaycast.services.messaging.contact.model.Contact;
import com.relaycast.services.messaging.contact.model.ContactUrn;

/**
 * Something a message can be addressed to: a contact, one of its URNs, or a raw URN string.
 */
public interface Recipient {

    enum Kind {
        CONTACT, URN, RAW_URN
    }

    Kind kind();

    static Recipient of(Contact contact) {
        return new ContactRecipient(contact);
    }

    static Recipient of(ContactUrn urn) {
        return new UrnRecipient(urn);
    }

    static Recipient of(String urn) {
        return new RawUrnRecipient(urn);
    }

    record ContactRecipient(Contact contact) implements Recipient {
        @Override
        public Kind kind() {
            return Kind.CONTACT;
        }
    }

    record UrnRecipient(ContactUrn urn) implements Recipient {
        @Override
        public Kind kind() {
            return Kind.URN;
        }
    }

    record RawUrnRecipient(String urn) implements Recipient {
        @Override
        public Kind kind() {
            return Kind.RAW_URN;
        }
    }
}
