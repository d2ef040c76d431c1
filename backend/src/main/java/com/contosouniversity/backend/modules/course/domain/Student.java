package com.contosouniversity.backend.modules.course.domain;

import java.time.LocalDate;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

@Entity
@Table(name = "student")
public class Student {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "last_name", nullable = false, length = 50)
    private String lastName;

    @Column(name = "first_mid_name", nullable = false, length = 50)
    private String firstMidName;

    @Column(name = "enrollment_date", nullable = false)
    private LocalDate enrollmentDate;

    protected Student() {
    }

    public Student(String lastName, String firstMidName, LocalDate enrollmentDate) {
        this.lastName = lastName;
        this.firstMidName = firstMidName;
        this.enrollmentDate = enrollmentDate;
    }

    public Long getId() {
        return id;
    }

    public String getLastName() {
        return lastName;
    }

    public String getFirstMidName() {
        return firstMidName;
    }

    public LocalDate getEnrollmentDate() {
        return enrollmentDate;
    }

    public String getFullName() {
        return lastName + ", " + firstMidName;
    }
}
