package com.cyberx.vpnpool.api.dto;

import com.cyberx.vpnpool.api.entity.VpnCredential;
import com.cyberx.vpnpool.common.pool.AssignmentType;

import java.time.LocalDateTime;

/**
 * Credential metadata. Key material is only ever returned inside a downloaded config.
 */
public record VpnCredentialResponse(
    Long id,
    String interfaceIp,
    String ipv4Address,
    String ipv6Local,
    String ipv6Global,
    String endpoint,
    AssignmentType assignmentType,
    boolean isAvailable,
    boolean isActive,
    Long assignedToUserId,
    String assignedToUsername,
    LocalDateTime assignedAt,
    Long assignedToInstanceId,
    LocalDateTime assignedInstanceAt,
    String requestBatchId,
    LocalDateTime createdAt
) {

    public static VpnCredentialResponse from(VpnCredential credential) {
        return new VpnCredentialResponse(
            credential.getId(),
            credential.getInterfaceIp(),
            credential.getIpv4Address(),
            credential.getIpv6Local(),
            credential.getIpv6Global(),
            credential.getEndpoint(),
            credential.getAssignmentType(),
            Boolean.TRUE.equals(credential.getIsAvailable()),
            Boolean.TRUE.equals(credential.getIsActive()),
            credential.getAssignedToUserId(),
            credential.getAssignedToUsername(),
            credential.getAssignedAt(),
            credential.getAssignedToInstanceId(),
            credential.getAssignedInstanceAt(),
            credential.getRequestBatchId(),
            credential.getCreatedAt()
        );
    }
}
