package com.cyberx.vpnpool.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class AssignmentTypeRequest {
    @NotBlank(message = "Assignment type is required")
    private String assignmentType;
}
