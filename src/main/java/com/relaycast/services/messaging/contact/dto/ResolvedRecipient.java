package com.relaycast.services.messaging.contact.dto;

import com.relaycast.services.messaging.contact.model.Contact;
import com.relaycast.services.messaging.contact.model.ContactUrn;

public record ResolvedRecipient(Contact contact, ContactUrn urn) {
}
