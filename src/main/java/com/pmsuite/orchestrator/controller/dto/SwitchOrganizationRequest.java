package com.pmsuite.orchestrator.controller.dto;

import jakarta.validation.constraints.NotBlank;

public record SwitchOrganizationRequest(@NotBlank String organizationId) {
}
