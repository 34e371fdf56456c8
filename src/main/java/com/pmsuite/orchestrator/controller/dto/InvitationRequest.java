package com.pmsuite.orchestrator.controller.dto;

import com.pmsuite.orchestrator.security.Role;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

/**
 * @param role role granted on acceptance; member when absent
 */
public record InvitationRequest(@NotBlank @Email String email, Role role) {
}
