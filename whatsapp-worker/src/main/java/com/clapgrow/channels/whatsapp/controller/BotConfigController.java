package com.clapgrow.channels.whatsapp.controller;

import com.clapgrow.channels.whatsapp.dto.BotConfigResponse;
import com.clapgrow.channels.whatsapp.dto.BotConfigUpdateRequest;
import com.clapgrow.channels.whatsapp.entity.BotConfigEntity;
import com.clapgrow.channels.whatsapp.service.BotConfigService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping(value = "/v1/channels/{channelId}/bot/config", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
@Tag(name = "Bot config", description = "Auto-reply configuration per channel")
public class BotConfigController {

    private final BotConfigService botConfigService;

    @GetMapping
    @Operation(summary = "Get bot config", description = "Created with auto-reply disabled when absent.")
    public ResponseEntity<Map<String, Object>> get(@PathVariable String channelId) {
        return ResponseEntity.ok(response(botConfigService.get(channelId)));
    }

    @PutMapping
    @Operation(summary = "Update bot config", description = "Merges the provided fields.")
    public ResponseEntity<Map<String, Object>> update(@PathVariable String channelId,
                                                      @Valid @RequestBody BotConfigUpdateRequest request) {
        return ResponseEntity.ok(response(botConfigService.update(channelId, request)));
    }

    private static Map<String, Object> response(BotConfigEntity config) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ok", true);
        body.put("config", BotConfigResponse.from(config));
        return body;
    }
}
