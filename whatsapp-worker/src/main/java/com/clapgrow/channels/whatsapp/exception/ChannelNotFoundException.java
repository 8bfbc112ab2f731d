package com.clapgrow.channels.whatsapp.exception;

public class ChannelNotFoundException extends RuntimeException {

    public ChannelNotFoundException(String channelId) {
        super("Channel not found: " + channelId);
    }
}
