package com.clapgrow.channels.whatsapp.controller;

import com.clapgrow.channels.whatsapp.dto.ChannelResponse;
import com.clapgrow.channels.whatsapp.dto.ConversationResponse;
import com.clapgrow.channels.whatsapp.dto.CreateChannelRequest;
import com.clapgrow.channels.whatsapp.dto.RenameChannelRequest;
import com.clapgrow.channels.whatsapp.dto.SendMessageRequest;
import com.clapgrow.channels.whatsapp.entity.ChannelEntity;
import com.clapgrow.channels.whatsapp.entity.ConversationEntity;
import com.clapgrow.channels.whatsapp.service.ChannelService;
import com.clapgrow.channels.whatsapp.supervisor.ChannelSnapshot;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lifecycle commands for channels, as called by the dashboard.
 */
@RestController
@RequestMapping(value = "/v1/channels", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Channels", description = "Channel lifecycle: pairing, connection, messaging")
public class ChannelController {

    private final ChannelService channelService;

    @PostMapping
    @Operation(summary = "Create channel", description = "Registers a new, disconnected channel.")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "201", description = "Channel created"),
        @ApiResponse(responseCode = "400", description = "Invalid request or id already taken")
    })
    public ResponseEntity<Map<String, Object>> create(@Valid @RequestBody CreateChannelRequest request) {
        ChannelEntity channel = channelService.create(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ok("channel", ChannelResponse.from(channel)));
    }

    @GetMapping
    @Operation(summary = "List channels")
    public ResponseEntity<Map<String, Object>> list() {
        List<ChannelResponse> channels = channelService.list().stream().map(ChannelResponse::from).toList();
        return ResponseEntity.ok(ok("channels", channels));
    }

    @GetMapping("/{channelId}")
    @Operation(summary = "Get channel", description = "Returns the stored channel record.")
    public ResponseEntity<Map<String, Object>> get(@PathVariable String channelId) {
        return ResponseEntity.ok(ok("channel", ChannelResponse.from(channelService.get(channelId))));
    }

    @PatchMapping("/{channelId}")
    @Operation(summary = "Rename channel", description = "Updates the display name only.")
    public ResponseEntity<Map<String, Object>> rename(@PathVariable String channelId,
                                                      @Valid @RequestBody RenameChannelRequest request) {
        ChannelEntity channel = channelService.rename(channelId, request.getDisplayName());
        return ResponseEntity.ok(ok("channel", ChannelResponse.from(channel)));
    }

    @PostMapping("/{channelId}/qr")
    @Operation(summary = "Request QR",
        description = "Starts pairing or resumes the stored session. Idempotent while an attempt is pending.")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Attempt started or already pending"),
        @ApiResponse(responseCode = "409", description = "Channel already connected")
    })
    public ResponseEntity<Map<String, Object>> requestQr(@PathVariable String channelId) {
        return ResponseEntity.ok(snapshot(channelService.requestQr(channelId)));
    }

    @PostMapping("/{channelId}/disconnect")
    @Operation(summary = "Disconnect", description = "Closes the session and keeps the stored credentials.")
    public ResponseEntity<Map<String, Object>> disconnect(@PathVariable String channelId) {
        return ResponseEntity.ok(snapshot(channelService.disconnect(channelId)));
    }

    @PostMapping("/{channelId}/resetSession")
    @Operation(summary = "Reset session", description = "Logs out and deletes the stored credentials.")
    public ResponseEntity<Map<String, Object>> resetSession(@PathVariable String channelId) {
        return ResponseEntity.ok(snapshot(channelService.resetSession(channelId)));
    }

    @PostMapping("/{channelId}/repair")
    @Operation(summary = "Repair", description = "Reconnects a channel in ERROR.")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Reconnect started"),
        @ApiResponse(responseCode = "409", description = "Channel is not in ERROR")
    })
    public ResponseEntity<Map<String, Object>> repair(@PathVariable String channelId) {
        return ResponseEntity.ok(snapshot(channelService.repair(channelId)));
    }

    @PostMapping("/{channelId}/messages/send")
    @Operation(summary = "Send text message")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Message accepted by WhatsApp"),
        @ApiResponse(responseCode = "409", description = "Channel not connected"),
        @ApiResponse(responseCode = "502", description = "Gateway failure")
    })
    public ResponseEntity<Map<String, Object>> send(@PathVariable String channelId,
                                                    @Valid @RequestBody SendMessageRequest request) {
        String messageId = channelService.send(channelId, request.getTo(), request.getText());
        return ResponseEntity.ok(ok("messageId", messageId));
    }

    @PostMapping("/{channelId}/conversations/{jid}/markRead")
    @Operation(summary = "Mark conversation read", description = "Resets the unread counter. Idempotent.")
    public ResponseEntity<Map<String, Object>> markRead(@PathVariable String channelId, @PathVariable String jid) {
        ConversationEntity conversation = channelService.markRead(channelId, jid);
        return ResponseEntity.ok(ok("conversation", ConversationResponse.from(conversation)));
    }

    private static Map<String, Object> ok(String key, Object value) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ok", true);
        body.put(key, value);
        return body;
    }

    private static Map<String, Object> snapshot(ChannelSnapshot snapshot) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ok", true);
        body.put("channelId", snapshot.channelId());
        body.put("state", snapshot.state());
        body.put("status", snapshot.status());
        body.put("qr", snapshot.qr());
        body.put("qrDataUrl", snapshot.qrDataUrl());
        body.put("phoneE164", snapshot.phoneE164());
        body.put("lastError", snapshot.lastError());
        return body;
    }
}
