package com.clapgrow.channels.whatsapp.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * Partial bot configuration. Fields left null keep their stored value.
 */
@Data
public class BotConfigUpdateRequest {

    private Boolean enabled;

    @Size(max = 20000, message = "productDetails must be at most 20000 characters")
    private String productDetails;

    @Size(max = 20000, message = "salesStrategy must be at most 20000 characters")
    private String salesStrategy;

    @Size(max = 128)
    private String updatedByUid;

    @Email(message = "updatedByEmail must be a valid email address")
    private String updatedByEmail;
}
