package com.openforge.storeagent.action.dto;

import jakarta.validation.constraints.NotBlank;

/** Body of a direct approve/reject call from the admin UI. */
public record DecisionRequest(@NotBlank String actor) {}
