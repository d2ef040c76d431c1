package com.contosouniversity.backend.modules.course.infrastructure.persistence;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.contosouniversity.backend.modules.course.domain.Enrollment;

public interface EnrollmentRepository extends JpaRepository<Enrollment, Long> {

    @Query("""
            select e
              from Enrollment e
              join fetch e.student s
             where e.course.id = :courseId
             order by s.lastName, s.firstMidName, e.id
            """)
    List<Enrollment> findByCourseIdWithStudent(@Param("courseId") Long courseId);
}
