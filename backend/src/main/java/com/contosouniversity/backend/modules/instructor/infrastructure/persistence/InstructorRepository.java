package com.contosouniversity.backend.modules.instructor.infrastructure.persistence;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.contosouniversity.backend.modules.instructor.domain.Instructor;

public interface InstructorRepository extends JpaRepository<Instructor, Long> {

    /**
     * Roots of the drill-down view: office plus the shallow (id, title) of each linked course.
     * Course departments and enrollments are deliberately not joined.
     */
    @Query("""
            select distinct i
              from Instructor i
              left join fetch i.officeAssignment
              left join fetch i.courseAssignments ca
              left join fetch ca.course
             order by i.lastName, i.firstMidName, i.id
            """)
    List<Instructor> findAllWithOfficeAndAssignments();

    @Query("""
            select i
              from Instructor i
              left join fetch i.officeAssignment
              left join fetch i.courseAssignments ca
              left join fetch ca.course
             where i.id = :id
            """)
    Optional<Instructor> findDetailById(@Param("id") Long id);
}
