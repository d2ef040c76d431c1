package com.contosouniversity.backend.modules.instructor.presentation.dto;

import java.util.List;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record UpdateCourseAssignmentsRequest(
        @NotNull
        List<@NotNull @Positive Long> courseIds
) {
}
