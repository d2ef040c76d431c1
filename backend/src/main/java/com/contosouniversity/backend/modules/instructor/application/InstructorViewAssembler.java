package com.contosouniversity.backend.modules.instructor.application;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.contosouniversity.backend.modules.course.infrastructure.persistence.CourseRepository;
import com.contosouniversity.backend.modules.course.infrastructure.persistence.EnrollmentRepository;
import com.contosouniversity.backend.modules.course.presentation.dto.CourseResponse;
import com.contosouniversity.backend.modules.instructor.domain.Instructor;
import com.contosouniversity.backend.modules.instructor.infrastructure.persistence.InstructorRepository;
import com.contosouniversity.backend.modules.instructor.presentation.dto.InstructorDtoMapper;
import com.contosouniversity.backend.modules.instructor.presentation.dto.InstructorIndexResponse;
import com.contosouniversity.backend.modules.instructor.presentation.dto.InstructorIndexResponse.EnrollmentItem;
import com.contosouniversity.backend.modules.instructor.presentation.dto.InstructorResponse;

/**
 * Builds the instructor index drill-down: instructors, then the selected instructor's courses,
 * then the selected course's enrollments.
 * <p>
 * Each level is queried only when its selector is present. A stale or inconsistent selector never raises;
 * the view falls back to the deepest valid level and reports a {@link ViewDiagnostic}.
 */
@Service
@Transactional(readOnly = true)
public class InstructorViewAssembler {

    private static final Logger log = LoggerFactory.getLogger(InstructorViewAssembler.class);

    private final InstructorRepository instructorRepository;
    private final CourseRepository courseRepository;
    private final EnrollmentRepository enrollmentRepository;

    public InstructorViewAssembler(
            InstructorRepository instructorRepository,
            CourseRepository courseRepository,
            EnrollmentRepository enrollmentRepository
    ) {
        this.instructorRepository = instructorRepository;
        this.courseRepository = courseRepository;
        this.enrollmentRepository = enrollmentRepository;
    }

    public InstructorIndexResponse assemble(@NonNull ViewSelectors selectors) {
        Objects.requireNonNull(selectors, "selectors");
        Long instructorId = selectors.instructorId();
        Long courseId = selectors.courseId();

        List<Instructor> roots = instructorRepository.findAllWithOfficeAndAssignments();
        List<InstructorResponse> instructors = roots.stream()
                .map(InstructorDtoMapper::toResponse)
                .toList();

        if (instructorId == null) {
            if (courseId != null) {
                log.debug("Ignoring course selector {} without an instructor selector", courseId);
                return new InstructorIndexResponse(null, null, instructors, null, null,
                        List.of(ViewDiagnostic.COURSE_WITHOUT_INSTRUCTOR));
            }
            return new InstructorIndexResponse(null, null, instructors, null, null, List.of());
        }

        Optional<Instructor> selected = roots.stream()
                .filter(instructor -> instructorId.equals(instructor.getId()))
                .findFirst();
        if (selected.isEmpty()) {
            log.debug("Instructor selector {} does not resolve", instructorId);
            return new InstructorIndexResponse(null, null, instructors, List.of(),
                    courseId != null ? List.of() : null,
                    List.of(ViewDiagnostic.UNKNOWN_INSTRUCTOR));
        }

        List<CourseResponse> courses = courseRepository.findAssignedToInstructor(instructorId).stream()
                .map(CourseResponse::from)
                .toList();
        if (courseId == null) {
            return new InstructorIndexResponse(instructorId, null, instructors, courses, null, List.of());
        }

        boolean taught = courses.stream().anyMatch(course -> courseId.equals(course.courseId()));
        if (!taught) {
            log.debug("Course selector {} is not taught by instructor {}", courseId, instructorId);
            return new InstructorIndexResponse(instructorId, null, instructors, courses, List.of(),
                    List.of(ViewDiagnostic.COURSE_NOT_ASSIGNED));
        }

        List<EnrollmentItem> enrollments = enrollmentRepository.findByCourseIdWithStudent(courseId).stream()
                .map(enrollment -> InstructorDtoMapper.toEnrollmentItem(enrollment, courseId))
                .toList();
        return new InstructorIndexResponse(instructorId, courseId, instructors, courses, enrollments, List.of());
    }
}
