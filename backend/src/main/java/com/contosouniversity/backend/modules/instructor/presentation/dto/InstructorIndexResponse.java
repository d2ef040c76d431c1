package com.contosouniversity.backend.modules.instructor.presentation.dto;

import java.util.List;

import com.contosouniversity.backend.modules.course.presentation.dto.CourseResponse;
import com.contosouniversity.backend.modules.instructor.application.ViewDiagnostic;

/**
 * Three-panel instructor index.
 * {@code courses} is {@code null} unless an instructor was selected and {@code enrollments} is {@code null}
 * unless a course was selected as well. The selected ids are echoed only when they were honoured.
 */
public record InstructorIndexResponse(
        Long selectedInstructorId,
        Long selectedCourseId,
        List<InstructorResponse> instructors,
        List<CourseResponse> courses,
        List<EnrollmentItem> enrollments,
        List<ViewDiagnostic> diagnostics
) {

    public record EnrollmentItem(
            Long enrollmentId,
            Long courseId,
            Long studentId,
            String studentFullName,
            String grade
    ) {
    }
}
