package com.cyberx.vpnpool.api.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * Admin assignment of one or more credentials to a single user. Counts above the
 * per-request cap are truncated like a self-service request.
 */
@Data
public class AssignRequest {

    @NotNull(message = "User ID is required")
    private Long userId;

    private String username;

    @Min(value = 1, message = "Count must be at least 1")
    private int count = 1;

    // Defaults to USER_REQUESTABLE
    private String assignmentType;
}
