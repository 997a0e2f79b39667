package com.relaycast.services.messaging.contact.dto;

import java.util.Locale;

import com.relaycast.services.messaging.exception.InvalidRequestException;

/**
 * A parsed URN string of the form scheme:path, with an optional #display suffix.
 */
public record Urn(String scheme, String path, String display) {

    public static final String TEL = "tel";
    public static final String EMAIL = "mailto";
    public static final String TWITTER = "twitter";

    public static Urn parse(String urn) {
        if (urn == null) {
            throw new InvalidRequestException("URN must not be null");
        }
        int colon = urn.indexOf(':');
        if (colon <= 0 || colon == urn.length() - 1) {
            throw new InvalidRequestException("URN must contain scheme and path components: " + urn);
        }

        String scheme = urn.substring(0, colon).trim().toLowerCase(Locale.ROOT);
        String path = urn.substring(colon + 1);
        String display = null;

        int hash = path.indexOf('#');
        if (hash >= 0) {
            display = path.substring(hash + 1);
            path = path.substring(0, hash);
        }
        if (path.isBlank()) {
            throw new InvalidRequestException("URN contains an invalid path component: " + urn);
        }
        return new Urn(scheme, path, display).normalize();
    }

    /**
     * Normalized copy: trimmed, phone numbers stripped of punctuation, handles and emails lower-cased
     */
    public Urn normalize() {
        String norm = path.trim();
        switch (scheme) {
            case TEL:
                norm = norm.toLowerCase(Locale.ROOT).replaceAll("[^0-9a-z+]", "");
                if (norm.length() >= 11 && norm.charAt(0) != '+' && norm.charAt(0) != '0') {
                    norm = "+" + norm;
                }
                break;
            case TWITTER:
                norm = norm.toLowerCase(Locale.ROOT);
                if (norm.startsWith("@")) {
                    norm = norm.substring(1);
                }
                break;
            case EMAIL:
                norm = norm.toLowerCase(Locale.ROOT);
                break;
            default:
                break;
        }
        return new Urn(scheme, norm, display);
    }

    public String identity() {
        return scheme + ":" + path;
    }

    @Override
    public String toString() {
        return display == null ? identity() : identity() + "#" + display;
    }
}
