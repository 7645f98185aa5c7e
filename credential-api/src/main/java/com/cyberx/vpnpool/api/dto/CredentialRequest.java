package com.cyberx.vpnpool.api.dto;

import lombok.Data;

/**
 * Self-service request. Counts above the per-request cap are truncated.
 */
@Data
public class CredentialRequest {
    private int count = 1;
}
