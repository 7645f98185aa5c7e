package com.cyberx.vpnpool.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.List;

@Data
public class BulkAssignmentTypeRequest {
    @NotEmpty(message = "At least one credential ID is required")
    private List<Long> credentialIds;

    @NotBlank(message = "Assignment type is required")
    private String assignmentType;
}
