package com.contosouniversity.backend.modules.instructor.presentation.dto;

import java.time.LocalDate;
import java.util.List;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

public record CreateInstructorRequest(
        @NotBlank
        @Size(max = 50)
        @Pattern(regexp = InstructorRequestPatterns.PERSON_NAME, message = "contains invalid characters")
        String lastName,
        @NotBlank
        @Size(max = 50)
        @Pattern(regexp = InstructorRequestPatterns.PERSON_NAME, message = "contains invalid characters")
        String firstMidName,
        @NotNull
        LocalDate hireDate,
        @Size(max = 50)
        String officeLocation,
        List<@NotNull @Positive Long> courseIds
) {
}
