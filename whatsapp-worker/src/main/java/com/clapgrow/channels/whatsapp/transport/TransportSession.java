package com.clapgrow.channels.whatsapp.transport;

/**
 * A live or pairing session returned by {@link WhatsAppTransport#open}.
 */
public interface TransportSession {

    /**
     * Sends a text message and returns the message id assigned by WhatsApp.
     *
     * @throws com.clapgrow.channels.whatsapp.exception.TransportException when the gateway rejects the send
     */
    String sendText(String to, String text);

    /**
     * Stops this session locally and disconnects it at the gateway. Credentials stay valid.
     * Must not block on network calls.
     */
    void close();

    /**
     * Unlinks the device and deletes the session at the gateway. Must not block on network calls.
     */
    void logout();
}
