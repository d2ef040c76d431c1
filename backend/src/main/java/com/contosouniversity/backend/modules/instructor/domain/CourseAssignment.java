package com.contosouniversity.backend.modules.instructor.domain;

import com.contosouniversity.backend.modules.course.domain.Course;

import jakarta.persistence.EmbeddedId;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.MapsId;
import jakarta.persistence.Table;

/**
 * Link row between an instructor and one of the courses on their teaching list. Carries no payload beyond the two keys.
 */
@Entity
@Table(name = "course_instructor")
public class CourseAssignment {

    @EmbeddedId
    private CourseAssignmentId id;

    @MapsId("instructorId")
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "instructor_id", nullable = false)
    private Instructor instructor;

    @MapsId("courseId")
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "course_id", nullable = false)
    private Course course;

    protected CourseAssignment() {
    }

    CourseAssignment(Instructor instructor, Course course) {
        this.id = new CourseAssignmentId(course.getId(), instructor.getId());
        this.instructor = instructor;
        this.course = course;
    }

    public CourseAssignmentId getId() {
        return id;
    }

    public Instructor getInstructor() {
        return instructor;
    }

    public Course getCourse() {
        return course;
    }
}
