package com.contosouniversity.backend.modules.course.infrastructure.persistence;

import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;

import com.contosouniversity.backend.modules.course.domain.Department;

public interface DepartmentRepository extends JpaRepository<Department, Long> {

    Optional<Department> findFirstByAdministratorId(Long instructorId);
}
