package com.cyberx.vpnpool.api.dto;

import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.List;

@Data
public class BulkDeleteRequest {
    @NotEmpty(message = "At least one credential ID is required")
    private List<Long> credentialIds;
}
