package com.contosouniversity.backend.modules.course.domain;

import java.math.BigDecimal;
import java.time.LocalDate;

import com.contosouniversity.backend.modules.instructor.domain.Instructor;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.Version;

@Entity
@Table(name = "department")
public class Department {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "name", length = 50)
    private String name;

    @Column(name = "budget", nullable = false, precision = 12, scale = 2)
    private BigDecimal budget;

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "administrator_id")
    private Instructor administrator;

    @Version
    @Column(name = "version", nullable = false)
    private int version;

    protected Department() {
    }

    public Department(String name, BigDecimal budget, LocalDate startDate) {
        this.name = name;
        this.budget = budget;
        this.startDate = startDate;
    }

    public Long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public BigDecimal getBudget() {
        return budget;
    }

    public LocalDate getStartDate() {
        return startDate;
    }

    public Instructor getAdministrator() {
        return administrator;
    }

    public void setAdministrator(Instructor administrator) {
        this.administrator = administrator;
    }

    public int getVersion() {
        return version;
    }
}
