package com.contosouniversity.backend.modules.instructor.domain;

import java.io.Serializable;
import java.util.Objects;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

@Embeddable
public class CourseAssignmentId implements Serializable {

    @Column(name = "course_id", nullable = false)
    private Long courseId;

    @Column(name = "instructor_id", nullable = false)
    private Long instructorId;

    protected CourseAssignmentId() {
    }

    public CourseAssignmentId(Long courseId, Long instructorId) {
        this.courseId = courseId;
        this.instructorId = instructorId;
    }

    public Long getCourseId() {
        return courseId;
    }

    public Long getInstructorId() {
        return instructorId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CourseAssignmentId that)) return false;
        return Objects.equals(courseId, that.courseId) && Objects.equals(instructorId, that.instructorId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(courseId, instructorId);
    }
}
