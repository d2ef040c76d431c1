package com.contosouniversity.backend.modules.course.domain;

import java.util.Objects;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

/**
 * A course offering. Ids are assigned by the registrar (1..99999), never generated.
 */
@Entity
@Table(name = "course")
public class Course {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "title", length = 100)
    private String title;

    @Column(name = "credits", nullable = false)
    private int credits;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "department_id", nullable = false)
    private Department department;

    protected Course() {
    }

    public Course(Long id, String title, int credits, Department department) {
        this.id = Objects.requireNonNull(id, "id");
        this.title = title;
        this.credits = credits;
        this.department = department;
    }

    public Long getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public int getCredits() {
        return credits;
    }

    public Department getDepartment() {
        return department;
    }
}
