package com.relaycast.services.messaging.message.enums;

import com.relaycast.services.messaging.channel.enums.ChannelRole;

public enum MsgType {
    INBOX,
    FLOW,
    IVR,
    USSD;

    /**
     * The channel role needed to send a message of this type.
     */
    public ChannelRole requiredRole() {
        switch (this) {
            case IVR:
                return ChannelRole.CALL;
            case USSD:
                return ChannelRole.USSD;
            default:
                return ChannelRole.SEND;
        }
    }
}
