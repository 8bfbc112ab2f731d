package com.clapgrow.channels.whatsapp.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class CreateChannelRequest {

    /**
     * Optional caller-chosen id; a random one is generated when absent.
     */
    @Pattern(regexp = "^[A-Za-z0-9_-]{1,64}$", message = "id may only contain letters, digits, '_' and '-' (max 64)")
    private String id;

    @NotBlank(message = "displayName is required")
    @Size(max = 255, message = "displayName must be at most 255 characters")
    private String displayName;
}
