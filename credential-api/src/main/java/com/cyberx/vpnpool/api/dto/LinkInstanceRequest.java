package com.cyberx.vpnpool.api.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class LinkInstanceRequest {
    @NotNull(message = "Instance ID is required")
    private Long instanceId;
}
