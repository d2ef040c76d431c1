package com.contosouniversity.backend.modules.instructor.presentation.dto;

import java.time.LocalDate;
import java.util.List;

public record InstructorResponse(
        Long id,
        String lastName,
        String firstMidName,
        String fullName,
        LocalDate hireDate,
        String officeLocation,
        List<AssignedCourse> courses
) {

    public record AssignedCourse(
            Long courseId,
            String title
    ) {
    }
}
