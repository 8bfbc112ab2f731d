package com.clapgrow.channels.whatsapp.publisher;

/**
 * Structured last error of a channel.
 */
public record ChannelError(String code, String message) {

    public static ChannelError of(String code, String message) {
        return new ChannelError(code, message);
    }
}
