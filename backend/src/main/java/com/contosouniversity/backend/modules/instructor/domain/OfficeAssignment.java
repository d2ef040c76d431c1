package com.contosouniversity.backend.modules.instructor.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.MapsId;
import jakarta.persistence.OneToOne;
import jakarta.persistence.Table;

/**
 * Owned one-to-one office of an instructor. Shares the instructor's primary key and has no identity of its own.
 */
@Entity
@Table(name = "office_assignment")
public class OfficeAssignment {

    @Id
    @Column(name = "instructor_id", nullable = false, updatable = false)
    private Long instructorId;

    @MapsId
    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "instructor_id")
    private Instructor instructor;

    @Column(name = "location", length = 50)
    private String location;

    protected OfficeAssignment() {
    }

    OfficeAssignment(Instructor instructor, String location) {
        this.instructor = instructor;
        this.location = location;
    }

    public Long getInstructorId() {
        return instructorId;
    }

    public Instructor getInstructor() {
        return instructor;
    }

    public String getLocation() {
        return location;
    }

    void setLocation(String location) {
        this.location = location;
    }
}
