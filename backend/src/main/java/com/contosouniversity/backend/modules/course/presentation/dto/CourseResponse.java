package com.contosouniversity.backend.modules.course.presentation.dto;

import com.contosouniversity.backend.modules.course.domain.Course;
import com.contosouniversity.backend.modules.course.domain.Department;

/**
 * Course with its department; the caller must have fetched the department.
 */
public record CourseResponse(
        Long courseId,
        String title,
        int credits,
        Long departmentId,
        String departmentName
) {

    public static CourseResponse from(Course course) {
        Department department = course.getDepartment();
        return new CourseResponse(
                course.getId(),
                course.getTitle(),
                course.getCredits(),
                department != null ? department.getId() : null,
                department != null ? department.getName() : null
        );
    }
}
