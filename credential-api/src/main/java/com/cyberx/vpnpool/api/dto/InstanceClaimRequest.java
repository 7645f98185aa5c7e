package com.cyberx.vpnpool.api.dto;

import lombok.Data;

/**
 * Leave {@code instanceId} empty to reserve a credential for an instance that is
 * created afterwards, then link it.
 */
@Data
public class InstanceClaimRequest {
    private Long instanceId;
}
