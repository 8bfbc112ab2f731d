package com.clapgrow.channels.whatsapp.session;

import com.clapgrow.channels.whatsapp.transport.SessionCredentials;

import java.util.List;
import java.util.Optional;

/**
 * Durable per-channel credential material. Only the channel's supervisor reads or writes its entry.
 */
public interface SessionStore {

    Optional<SessionCredentials> load(String channelId);

    void save(SessionCredentials credentials);

    /** Idempotent. */
    void delete(String channelId);

    /** Channels that currently have stored credentials. */
    List<String> channelIds();
}
