package com.pmsuite.orchestrator.controller.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

/**
 * @param organizationId organization to activate; the first membership when absent
 */
public record LoginRequest(
        @NotBlank @Email String email,
        @NotBlank String password,
        String organizationId) {
}
