package com.relaycast.services.messaging.broadcast.service.impl;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.relaycast.services.messaging.config.MessageProperties;
import com.relaycast.services.messaging.contact.model.Contact;
import com.relaycast.services.messaging.org.model.Org;

import lombok.RequiredArgsConstructor;

/**
 * Picks the translation of a broadcast's text, media and quick replies for a contact.
 */
@Component
@RequiredArgsConstructor
public class TranslationResolver {

    private final MessageProperties messageProperties;

    /**
     * Contact language if the org uses it, then the org's primary language, then the base language
     */
    public List<String> preferredLanguages(Contact contact, Org org, String baseLanguage) {
        List<String> languages = new ArrayList<>(3);
        if (contact != null && contact.getLanguage() != null && org.supportsLanguage(contact.getLanguage())) {
            languages.add(contact.getLanguage());
        }
        if (org.getPrimaryLanguage() != null) {
            languages.add(org.getPrimaryLanguage());
        }
        languages.add(baseLanguage);
        return languages;
    }

    /**
     * First non-empty translation in preference order, or null
     */
    public String localize(Map<String, String> translations, List<String> preferredLanguages) {
        if (translations == null || translations.isEmpty()) {
            return null;
        }
        for (String language : preferredLanguages) {
            String localized = translations.get(language);
            if (localized != null && !localized.isEmpty()) {
                return localized;
            }
        }
        return null;
    }

    public List<String> localizeQuickReplies(List<Map<String, String>> quickReplies, List<String> preferredLanguages) {
        List<String> localized = new ArrayList<>();
        if (quickReplies == null) {
            return localized;
        }
        for (Map<String, String> reply : quickReplies) {
            String text = localize(reply, preferredLanguages);
            if (text != null) {
                localized.add(text);
            }
        }
        return localized;
    }

    /**
     * Turns an uploaded media reference like {@code image/jpeg:attachments/1/a.jpg} into an absolute URL.
     * References whose type has no subtype (e.g. {@code geo:1.2,3.4}) are returned unchanged.
     */
    public String qualifyMedia(String media) {
        if (media == null) {
            return null;
        }
        int colon = media.indexOf(':');
        if (colon < 0) {
            return media;
        }
        String contentType = media.substring(0, colon);
        String url = media.substring(colon + 1);
        if (url.isEmpty() || contentType.indexOf('/') < 0 || url.startsWith("http://") || url.startsWith("https://")) {
            return media;
        }
        return contentType + ":https://" + messageProperties.getMediaBaseUrl() + "/" + url;
    }
}
