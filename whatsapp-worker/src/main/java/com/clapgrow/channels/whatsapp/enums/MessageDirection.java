package com.clapgrow.channels.whatsapp.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MessageDirection {
    IN("in"),
    OUT("out");

    private final String value;

    MessageDirection(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
