package com.clapgrow.channels.whatsapp.controller;

import com.clapgrow.channels.whatsapp.transport.wasender.WasenderWebhookHandler;
import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Receives session and message events from the WASender gateway.
 */
@RestController
@RequestMapping(value = "/v1/webhooks", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
@Tag(name = "Webhooks", description = "Gateway event delivery")
public class WasenderWebhookController {

    static final String SIGNATURE_HEADER = "X-Webhook-Signature";

    private final WasenderWebhookHandler webhookHandler;

    @PostMapping("/wasender")
    @Operation(summary = "WASender webhook", description = "Authenticated by the shared webhook secret.")
    public ResponseEntity<Map<String, Object>> receive(
            @RequestHeader(name = SIGNATURE_HEADER, required = false) String signature,
            @RequestBody JsonNode payload) {
        boolean routed = webhookHandler.handle(signature, payload);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ok", true);
        body.put("routed", routed);
        return ResponseEntity.ok(body);
    }
}
