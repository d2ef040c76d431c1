package com.contosouniversity.backend.modules.instructor.presentation.dto;

import java.util.Comparator;
import java.util.List;

import com.contosouniversity.backend.modules.course.domain.Course;
import com.contosouniversity.backend.modules.course.domain.Enrollment;
import com.contosouniversity.backend.modules.instructor.domain.Instructor;
import com.contosouniversity.backend.modules.instructor.domain.OfficeAssignment;

public final class InstructorDtoMapper {

    private InstructorDtoMapper() {
    }

    public static InstructorResponse toResponse(Instructor instructor) {
        OfficeAssignment office = instructor.getOfficeAssignment();
        List<InstructorResponse.AssignedCourse> courses = instructor.getCourseAssignments().stream()
                .map(assignment -> toAssignedCourse(assignment.getCourse()))
                .sorted(Comparator.comparing(InstructorResponse.AssignedCourse::courseId))
                .toList();
        return new InstructorResponse(
                instructor.getId(),
                instructor.getLastName(),
                instructor.getFirstMidName(),
                instructor.getFullName(),
                instructor.getHireDate(),
                office != null ? office.getLocation() : null,
                courses
        );
    }

    public static InstructorIndexResponse.EnrollmentItem toEnrollmentItem(Enrollment enrollment, Long courseId) {
        return new InstructorIndexResponse.EnrollmentItem(
                enrollment.getId(),
                courseId,
                enrollment.getStudent().getId(),
                enrollment.getStudent().getFullName(),
                enrollment.getGrade() != null ? enrollment.getGrade().name() : null
        );
    }

    public static AssignedCourseRowResponse toAssignedCourseRow(Course course, Instructor instructor) {
        return new AssignedCourseRowResponse(course.getId(), course.getTitle(), instructor.teaches(course.getId()));
    }

    private static InstructorResponse.AssignedCourse toAssignedCourse(Course course) {
        return new InstructorResponse.AssignedCourse(course.getId(), course.getTitle());
    }
}
