package com.cyberx.vpnpool.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class NamingPatternRequest {
    @NotBlank(message = "Pattern is required")
    @Size(max = 255, message = "Pattern must not exceed 255 characters")
    private String pattern;
}
