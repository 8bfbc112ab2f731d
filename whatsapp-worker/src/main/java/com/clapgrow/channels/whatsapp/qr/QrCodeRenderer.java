package com.clapgrow.channels.whatsapp.qr;

import com.google.zxing.BarcodeFormat;
import com.google.zxing.EncodeHintType;
import com.google.zxing.WriterException;
import com.google.zxing.client.j2se.MatrixToImageWriter;
import com.google.zxing.common.BitMatrix;
import com.google.zxing.qrcode.QRCodeWriter;
import com.google.zxing.qrcode.decoder.ErrorCorrectionLevel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Base64;
import java.util.Map;

/**
 * Renders a raw pairing payload into a PNG {@code data:} URL the dashboard can show directly.
 */
@Component
public class QrCodeRenderer {

    static final String DATA_URL_PREFIX = "data:image/png;base64,";

    private final int size;

    public QrCodeRenderer(@Value("${worker.qr.size:320}") int size) {
        this.size = size;
    }

    public String toDataUrl(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new IllegalArgumentException("QR payload is empty");
        }
        // Gateways sometimes hand out an already rendered image
        if (payload.startsWith("data:image/")) {
            return payload;
        }
        try {
            BitMatrix matrix = new QRCodeWriter().encode(payload, BarcodeFormat.QR_CODE, size, size,
                Map.of(EncodeHintType.ERROR_CORRECTION, ErrorCorrectionLevel.M,
                       EncodeHintType.MARGIN, 2));
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            MatrixToImageWriter.writeToStream(matrix, "PNG", out);
            return DATA_URL_PREFIX + Base64.getEncoder().encodeToString(out.toByteArray());
        } catch (WriterException | IOException e) {
            throw new IllegalStateException("Failed to render QR code: " + e.getMessage(), e);
        }
    }
}
