package com.relaycast.services.messaging.channel.enums;

/**
 * Roles a channel can play. Channels store the roles they support as a string of codes, e.g. "SR".
 */
public enum ChannelRole {
    SEND('S'),
    RECEIVE('R'),
    CALL('C'),
    ANSWER('A'),
    USSD('U');

    private final char code;

    ChannelRole(char code) {
        this.code = code;
    }

    public char getCode() {
        return code;
    }
}
