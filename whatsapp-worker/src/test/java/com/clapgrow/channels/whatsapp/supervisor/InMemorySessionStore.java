package com.clapgrow.channels.whatsapp.supervisor;

import com.clapgrow.channels.whatsapp.session.SessionStore;
import com.clapgrow.channels.whatsapp.transport.SessionCredentials;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

class InMemorySessionStore implements SessionStore {

    final Map<String, SessionCredentials> entries = new LinkedHashMap<>();

    @Override
    public Optional<SessionCredentials> load(String channelId) {
        return Optional.ofNullable(entries.get(channelId));
    }

    @Override
    public void save(SessionCredentials credentials) {
        entries.put(credentials.channelId(), credentials);
    }

    @Override
    public void delete(String channelId) {
        entries.remove(channelId);
    }

    @Override
    public List<String> channelIds() {
        return new ArrayList<>(entries.keySet());
    }
}
