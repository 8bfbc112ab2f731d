package com.clapgrow.channels.whatsapp.transport.wasender;

/**
 * Outcome of {@code POST /whatsapp-sessions/{id}/connect}: a status and, for NEED_SCAN, the pairing payload.
 */
public record ConnectResult(String status, String qrCode) {
}
