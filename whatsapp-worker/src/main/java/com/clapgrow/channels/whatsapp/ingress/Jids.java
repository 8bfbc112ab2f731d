package com.clapgrow.channels.whatsapp.ingress;

/**
 * Helpers for WhatsApp JIDs such as {@code 5511999999999@s.whatsapp.net} or {@code 1203630@g.us}.
 */
public final class Jids {

    public static final String USER_SERVER = "s.whatsapp.net";
    public static final String GROUP_SERVER = "g.us";

    private Jids() {
    }

    /**
     * Drops the device part: {@code 123:4@s.whatsapp.net} becomes {@code 123@s.whatsapp.net}.
     * Blank input gives {@code null}.
     */
    public static String normalize(String jid) {
        if (jid == null || jid.isBlank()) {
            return null;
        }
        String trimmed = jid.trim();
        int at = trimmed.indexOf('@');
        String user = at >= 0 ? trimmed.substring(0, at) : trimmed;
        String server = at >= 0 ? trimmed.substring(at + 1) : USER_SERVER;
        int colon = user.indexOf(':');
        if (colon >= 0) {
            user = user.substring(0, colon);
        }
        if (user.isEmpty()) {
            return null;
        }
        return user + "@" + server;
    }

    /**
     * Accepts a JID or a plain phone number ({@code +55 11 99999-9999}) and returns a JID.
     */
    public static String fromRecipient(String recipient) {
        if (recipient == null || recipient.isBlank()) {
            return null;
        }
        if (recipient.contains("@")) {
            return normalize(recipient);
        }
        String digits = recipient.replaceAll("\\D", "");
        return digits.isEmpty() ? null : digits + "@" + USER_SERVER;
    }

    public static String userPart(String jid) {
        if (jid == null) {
            return null;
        }
        int at = jid.indexOf('@');
        String user = at >= 0 ? jid.substring(0, at) : jid;
        int colon = user.indexOf(':');
        return colon >= 0 ? user.substring(0, colon) : user;
    }

    public static boolean isGroup(String jid) {
        return jid != null && jid.endsWith("@" + GROUP_SERVER);
    }

    /**
     * E.164 form of the account behind a user JID, or {@code null} when it has no digits.
     */
    public static String toE164(String jid) {
        String user = userPart(jid);
        if (user == null) {
            return null;
        }
        String digits = user.replaceAll("\\D", "");
        return digits.isEmpty() ? null : "+" + digits;
    }
}
