package com.contosouniversity.backend.modules.course.infrastructure.persistence;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.contosouniversity.backend.modules.course.domain.Course;

public interface CourseRepository extends JpaRepository<Course, Long> {

    @Query("""
            select c
              from Course c
              join fetch c.department
             order by c.id
            """)
    List<Course> findAllWithDepartment();

    @Query("""
            select c
              from CourseAssignment ca
              join ca.course c
              join fetch c.department
             where ca.instructor.id = :instructorId
             order by c.id
            """)
    List<Course> findAssignedToInstructor(@Param("instructorId") Long instructorId);
}
