package com.clapgrow.channels.whatsapp.ingress;

import com.clapgrow.channels.whatsapp.ingress.extract.ExtractorChain;
import com.clapgrow.channels.whatsapp.ingress.extract.JsonFields;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Turns raw message events into {@link NormalizedMessage}s whatever payload shape the gateway used.
 *
 * <p>Every extractor tolerates missing or malformed fields: text falls back to "", fromMe to
 * false and the remote party to the caller's default.
 */
@Component
public class MessageNormalizer {

    /**
     * Text-bearing fields inside a message content object, in lookup order.
     */
    private static final List<String[]> CONTENT_TEXT_PATHS = List.of(
        new String[]{"conversation"},
        new String[]{"extendedTextMessage", "text"},
        new String[]{"imageMessage", "caption"},
        new String[]{"videoMessage", "caption"},
        new String[]{"documentMessage", "caption"},
        new String[]{"buttonsResponseMessage", "selectedDisplayText"},
        new String[]{"listResponseMessage", "title"}
    );

    /**
     * Wrappers whose {@code message} field holds another content object.
     */
    private static final List<String> ENVELOPES = List.of(
        "ephemeralMessage", "viewOnceMessage", "viewOnceMessageV2", "documentWithCaptionMessage");

    private static final int MAX_ENVELOPE_DEPTH = 3;

    private final ExtractorChain<String> textChain = ExtractorChain.<String>named("text")
        .then("message.content", node -> contentText(JsonFields.at(node, "message"), 0))
        .then("text", node -> JsonFields.text(node, "text").or(() -> JsonFields.text(node, "text", "body")))
        .then("body", node -> JsonFields.text(node, "body"))
        .build();

    private final ExtractorChain<Boolean> fromMeChain = ExtractorChain.<Boolean>named("fromMe")
        .then("fromMe", node -> JsonFields.bool(node, "fromMe"))
        .then("isBot", node -> JsonFields.bool(node, "isBot"))
        .then("key.fromMe", node -> JsonFields.bool(node, "key", "fromMe"))
        .build();

    private final ExtractorChain<String> jidChain = ExtractorChain.<String>named("jid")
        .then("key.remoteJid", node -> JsonFields.text(node, "key", "remoteJid"))
        .then("remoteJid", node -> JsonFields.text(node, "remoteJid"))
        .then("jid", node -> JsonFields.text(node, "jid"))
        .then("from", node -> JsonFields.text(node, "from"))
        .build();

    private final ExtractorChain<String> idChain = ExtractorChain.<String>named("id")
        .then("key.id", node -> JsonFields.text(node, "key", "id"))
        .then("id", node -> JsonFields.text(node, "id"))
        .then("messageId", node -> JsonFields.text(node, "messageId"))
        .build();

    private final ExtractorChain<Long> timestampChain = ExtractorChain.<Long>named("timestamp")
        .then("messageTimestamp", node -> JsonFields.number(node, "messageTimestamp").map(MessageNormalizer::toMillis))
        .then("timestamp", node -> JsonFields.number(node, "timestamp").map(MessageNormalizer::toMillis))
        .build();

    private final ExtractorChain<String> pushNameChain = ExtractorChain.<String>named("pushName")
        .then("pushName", node -> JsonFields.text(node, "pushName"))
        .then("notifyName", node -> JsonFields.text(node, "notifyName"))
        .build();

    public String extractText(JsonNode raw) {
        return textChain.extract(raw, "");
    }

    public boolean extractFromMe(JsonNode raw) {
        return fromMeChain.extract(raw, false);
    }

    /**
     * Remote party of the event with the device suffix removed, or {@code fallbackJid}.
     */
    public String extractJid(JsonNode raw, String fallbackJid) {
        String jid = Jids.normalize(jidChain.extract(raw, null));
        return jid != null ? jid : fallbackJid;
    }

    public String extractMessageId(JsonNode raw) {
        return idChain.extract(raw, null);
    }

    public long extractTimestamp(JsonNode raw, long nowMillis) {
        return timestampChain.extract(raw, nowMillis);
    }

    public String extractPushName(JsonNode raw) {
        return pushNameChain.extract(raw, null);
    }

    /**
     * Empty when the event has no message id or no remote party.
     */
    public Optional<NormalizedMessage> normalize(JsonNode raw, String fallbackJid, long nowMillis) {
        String messageId = extractMessageId(raw);
        String jid = extractJid(raw, fallbackJid);
        if (messageId == null || jid == null) {
            return Optional.empty();
        }
        String text = extractText(raw);
        return Optional.of(new NormalizedMessage(
            messageId,
            jid,
            extractFromMe(raw),
            text.isEmpty() ? null : text,
            extractTimestamp(raw, nowMillis),
            extractPushName(raw)));
    }

    private static Optional<String> contentText(JsonNode content, int depth) {
        if (content == null) {
            return Optional.empty();
        }
        if (content.isTextual()) {
            return content.asText().isBlank() ? Optional.empty() : Optional.of(content.asText());
        }
        for (String[] path : CONTENT_TEXT_PATHS) {
            Optional<String> text = JsonFields.text(content, path);
            if (text.isPresent()) {
                return text;
            }
        }
        if (depth >= MAX_ENVELOPE_DEPTH) {
            return Optional.empty();
        }
        for (String envelope : ENVELOPES) {
            Optional<String> text = contentText(JsonFields.at(content, envelope, "message"), depth + 1);
            if (text.isPresent()) {
                return text;
            }
        }
        return Optional.empty();
    }

    /**
     * WhatsApp timestamps are in seconds; anything that already looks like millis is kept.
     */
    static long toMillis(long value) {
        return value < 100_000_000_000L ? value * 1000L : value;
    }
}
