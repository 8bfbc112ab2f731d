package com.clapgrow.channels.whatsapp.transport;

import com.clapgrow.channels.whatsapp.enums.MessageStatus;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Events raised by one transport session. Callbacks may arrive on any thread.
 */
public interface TransportListener {

    /** A (new) pairing payload is available and must be scanned from the phone. */
    void onQr(String qr);

    /** The session is authenticated; {@code selfJid} is the linked account's own JID. */
    void onOpen(String selfJid);

    void onClose(CloseReason reason, String detail);

    /** Credential material changed and must be persisted before it is needed again. */
    void onCredentialsUpdated(SessionCredentials credentials);

    /** Raw message events as delivered by the gateway. */
    void onMessages(List<JsonNode> messages);

    void onMessageStatus(String jid, String messageId, MessageStatus status);
}
