package com.brayford.organization.api;

import jakarta.validation.constraints.NotBlank;

/**
 * Body of a deletion request: the organization name, typed by the user to show intent.
 */
public record InitiateDeletionRequest(@NotBlank String organizationName) {
}
