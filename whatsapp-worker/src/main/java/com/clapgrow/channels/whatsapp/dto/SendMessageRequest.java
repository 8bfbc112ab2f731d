package com.clapgrow.channels.whatsapp.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class SendMessageRequest {

    /**
     * Recipient JID, or a phone number in international format.
     */
    @NotBlank(message = "to is required")
    private String to;

    @NotBlank(message = "text is required")
    @Size(max = 4096, message = "text must be at most 4096 characters")
    private String text;
}
