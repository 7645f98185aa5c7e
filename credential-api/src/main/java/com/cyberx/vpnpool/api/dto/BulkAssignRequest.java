package com.cyberx.vpnpool.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.List;

@Data
public class BulkAssignRequest {

    @NotEmpty(message = "At least one user is required")
    private List<@Valid UserRef> users;

    // Defaults to USER_REQUESTABLE
    private String assignmentType;

    @Data
    public static class UserRef {
        @NotNull(message = "User ID is required")
        private Long userId;

        private String username;
    }
}
