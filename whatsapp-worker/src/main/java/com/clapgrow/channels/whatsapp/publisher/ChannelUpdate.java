package com.clapgrow.channels.whatsapp.publisher;

import com.clapgrow.channels.whatsapp.entity.ChannelEntity;
import com.clapgrow.channels.whatsapp.enums.ChannelStatus;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Partial update of a channel record. Only fields that were explicitly set are written;
 * setting a field to {@code null} clears it, leaving it out keeps the stored value.
 */
public final class ChannelUpdate {

    public enum Field {
        DISPLAY_NAME,
        STATUS,
        QR,
        QR_DATA_URL,
        PHONE_E164,
        LINKED,
        LAST_SEEN_AT,
        LAST_QR_AT,
        CONNECTED_AT,
        LAST_ERROR
    }

    private final Map<Field, Object> values;

    private ChannelUpdate(Map<Field, Object> values) {
        this.values = Collections.unmodifiableMap(new EnumMap<>(values));
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean has(Field field) {
        return values.containsKey(field);
    }

    public Object get(Field field) {
        return values.get(field);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * Applies the set fields to {@code channel}. {@code now} stamps the error time.
     */
    public void applyTo(ChannelEntity channel, LocalDateTime now) {
        values.forEach((field, value) -> {
            switch (field) {
                case DISPLAY_NAME -> channel.setDisplayName((String) value);
                case STATUS -> channel.setStatus((ChannelStatus) value);
                case QR -> channel.setQr((String) value);
                case QR_DATA_URL -> channel.setQrDataUrl((String) value);
                case PHONE_E164 -> channel.setPhoneE164((String) value);
                case LINKED -> channel.setLinked(Boolean.TRUE.equals(value));
                case LAST_SEEN_AT -> channel.setLastSeenAt((LocalDateTime) value);
                case LAST_QR_AT -> channel.setLastQrAt((LocalDateTime) value);
                case CONNECTED_AT -> channel.setConnectedAt((LocalDateTime) value);
                case LAST_ERROR -> {
                    ChannelError error = (ChannelError) value;
                    channel.setLastErrorCode(error == null ? null : error.code());
                    channel.setLastErrorMessage(error == null ? null : error.message());
                    channel.setLastErrorAt(error == null ? null : now);
                }
            }
        });
    }

    @Override
    public String toString() {
        // qr payloads are pairing secrets
        StringBuilder sb = new StringBuilder("ChannelUpdate{");
        values.forEach((field, value) -> {
            boolean secret = field == Field.QR || field == Field.QR_DATA_URL;
            sb.append(field).append('=').append(secret && value != null ? "<redacted>" : value).append(", ");
        });
        if (!values.isEmpty()) {
            sb.setLength(sb.length() - 2);
        }
        return sb.append('}').toString();
    }

    public static final class Builder {
        private final Map<Field, Object> values = new EnumMap<>(Field.class);

        public Builder displayName(String displayName) {
            values.put(Field.DISPLAY_NAME, displayName);
            return this;
        }

        public Builder status(ChannelStatus status) {
            values.put(Field.STATUS, status);
            return this;
        }

        public Builder qr(String qr, String qrDataUrl) {
            values.put(Field.QR, qr);
            values.put(Field.QR_DATA_URL, qrDataUrl);
            return this;
        }

        public Builder clearQr() {
            return qr(null, null);
        }

        public Builder phoneE164(String phoneE164) {
            values.put(Field.PHONE_E164, phoneE164);
            return this;
        }

        public Builder linked(boolean linked) {
            values.put(Field.LINKED, linked);
            return this;
        }

        public Builder lastSeenAt(LocalDateTime at) {
            values.put(Field.LAST_SEEN_AT, at);
            return this;
        }

        public Builder lastQrAt(LocalDateTime at) {
            values.put(Field.LAST_QR_AT, at);
            return this;
        }

        public Builder connectedAt(LocalDateTime at) {
            values.put(Field.CONNECTED_AT, at);
            return this;
        }

        public Builder lastError(ChannelError error) {
            values.put(Field.LAST_ERROR, error);
            return this;
        }

        public Builder clearLastError() {
            return lastError(null);
        }

        public ChannelUpdate build() {
            return new ChannelUpdate(values);
        }
    }
}
