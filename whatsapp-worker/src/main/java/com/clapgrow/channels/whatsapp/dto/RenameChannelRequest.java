package com.clapgrow.channels.whatsapp.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class RenameChannelRequest {

    @NotBlank(message = "displayName is required")
    @Size(max = 255, message = "displayName must be at most 255 characters")
    private String displayName;
}
