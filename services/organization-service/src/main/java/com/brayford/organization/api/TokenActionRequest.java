package com.brayford.organization.api;

import jakarta.validation.constraints.NotBlank;

/**
 * Body of the confirm and undo calls, carrying the values from the emailed link.
 */
public record TokenActionRequest(@NotBlank String requestId, @NotBlank String token) {
}
