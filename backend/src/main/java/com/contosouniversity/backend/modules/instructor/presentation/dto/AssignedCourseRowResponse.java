package com.contosouniversity.backend.modules.instructor.presentation.dto;

public record AssignedCourseRowResponse(
        Long courseId,
        String title,
        boolean assigned
) {
}
