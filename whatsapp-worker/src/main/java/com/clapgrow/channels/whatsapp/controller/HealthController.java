package com.clapgrow.channels.whatsapp.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Health", description = "Health check endpoints")
public class HealthController {

    @GetMapping(value = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Health check", description = "Returns \"ok\" while the worker is up.")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Worker is up")
    })
    public ResponseEntity<String> health() {
        return ResponseEntity.ok().contentType(MediaType.APPLICATION_JSON).body("\"ok\"");
    }
}
