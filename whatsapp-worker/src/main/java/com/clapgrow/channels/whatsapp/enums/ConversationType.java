package com.clapgrow.channels.whatsapp.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ConversationType {
    USER("user"),
    GROUP("group");

    private final String value;

    ConversationType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static ConversationType fromJid(String jid) {
        return jid != null && jid.endsWith("@g.us") ? GROUP : USER;
    }
}
