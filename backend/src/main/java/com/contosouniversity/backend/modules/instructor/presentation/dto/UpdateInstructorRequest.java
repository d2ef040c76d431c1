package com.contosouniversity.backend.modules.instructor.presentation.dto;

import java.time.LocalDate;
import java.util.List;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

/**
 * Partial update. A {@code null} field is left unchanged.
 * A blank {@code officeLocation} removes the office; an empty {@code courseIds} unlinks every course.
 */
public record UpdateInstructorRequest(
        @Size(min = 1, max = 50)
        @Pattern(regexp = InstructorRequestPatterns.PERSON_NAME, message = "contains invalid characters")
        String lastName,
        @Size(min = 1, max = 50)
        @Pattern(regexp = InstructorRequestPatterns.PERSON_NAME, message = "contains invalid characters")
        String firstMidName,
        LocalDate hireDate,
        @Size(max = 50)
        String officeLocation,
        List<@NotNull @Positive Long> courseIds
) {
}
