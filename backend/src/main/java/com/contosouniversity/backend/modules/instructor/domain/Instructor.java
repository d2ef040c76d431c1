package com.contosouniversity.backend.modules.instructor.domain;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import com.contosouniversity.backend.global.jpa.AbstractTimestampedEntity;
import com.contosouniversity.backend.modules.course.domain.Course;

import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OneToOne;
import jakarta.persistence.Table;

/**
 * An instructor, the owner of both the office assignment and the course links.
 * The two relations are independent: clearing the office never touches course links and vice versa.
 */
@Entity
@Table(name = "instructor")
public class Instructor extends AbstractTimestampedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "last_name", nullable = false, length = 50)
    private String lastName;

    @Column(name = "first_mid_name", nullable = false, length = 50)
    private String firstMidName;

    @Column(name = "hire_date", nullable = false)
    private LocalDate hireDate;

    @OneToOne(mappedBy = "instructor", cascade = CascadeType.ALL, fetch = FetchType.LAZY, orphanRemoval = true)
    private OfficeAssignment officeAssignment;

    @OneToMany(mappedBy = "instructor", cascade = CascadeType.ALL, fetch = FetchType.LAZY, orphanRemoval = true)
    private List<CourseAssignment> courseAssignments = new ArrayList<>();

    protected Instructor() {
    }

    public Instructor(String lastName, String firstMidName, LocalDate hireDate) {
        this.lastName = lastName;
        this.firstMidName = firstMidName;
        this.hireDate = hireDate;
    }

    public Long getId() {
        return id;
    }

    public String getLastName() {
        return lastName;
    }

    public void setLastName(String lastName) {
        this.lastName = lastName;
    }

    public String getFirstMidName() {
        return firstMidName;
    }

    public void setFirstMidName(String firstMidName) {
        this.firstMidName = firstMidName;
    }

    public LocalDate getHireDate() {
        return hireDate;
    }

    public void setHireDate(LocalDate hireDate) {
        this.hireDate = hireDate;
    }

    public String getFullName() {
        return lastName + ", " + firstMidName;
    }

    public OfficeAssignment getOfficeAssignment() {
        return officeAssignment;
    }

    /**
     * Creates the office assignment or moves the existing one to {@code location}.
     */
    public void assignOffice(String location) {
        if (officeAssignment == null) {
            officeAssignment = new OfficeAssignment(this, location);
        } else {
            officeAssignment.setLocation(location);
        }
    }

    public void clearOffice() {
        officeAssignment = null;
    }

    public List<CourseAssignment> getCourseAssignments() {
        return Collections.unmodifiableList(courseAssignments);
    }

    public Set<Long> getAssignedCourseIds() {
        Set<Long> ids = new LinkedHashSet<>();
        for (CourseAssignment assignment : courseAssignments) {
            ids.add(assignment.getCourse().getId());
        }
        return ids;
    }

    public boolean teaches(Long courseId) {
        return courseAssignments.stream()
                .anyMatch(assignment -> Objects.equals(assignment.getCourse().getId(), courseId));
    }

    /**
     * Links the course unless it is already linked.
     *
     * @return {@code true} if a new link was created
     */
    public boolean assignCourse(Course course) {
        Objects.requireNonNull(course, "course");
        if (teaches(course.getId())) {
            return false;
        }
        courseAssignments.add(new CourseAssignment(this, course));
        return true;
    }

    /**
     * @return {@code true} if a link existed and was removed
     */
    public boolean unassignCourse(Long courseId) {
        return courseAssignments.removeIf(assignment -> Objects.equals(assignment.getCourse().getId(), courseId));
    }
}
