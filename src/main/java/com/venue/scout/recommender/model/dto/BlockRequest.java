package com.venue.scout.recommender.model.dto;

import jakarta.validation.constraints.NotBlank;

public record BlockRequest(@NotBlank(message = "candidateId is required") String candidateId,
                           String candidateName,
                           String reason) {
}
