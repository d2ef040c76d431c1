package com.contosouniversity.backend.modules.instructor.application;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.contosouniversity.backend.global.error.ProblemException;
import com.contosouniversity.backend.modules.course.infrastructure.persistence.CourseRepository;
import com.contosouniversity.backend.modules.course.infrastructure.persistence.DepartmentRepository;
import com.contosouniversity.backend.modules.instructor.domain.Instructor;
import com.contosouniversity.backend.modules.instructor.infrastructure.persistence.InstructorRepository;
import com.contosouniversity.backend.modules.instructor.presentation.dto.AssignedCourseRowResponse;
import com.contosouniversity.backend.modules.instructor.presentation.dto.CourseAssignmentChangesResponse;
import com.contosouniversity.backend.modules.instructor.presentation.dto.InstructorDtoMapper;
import com.contosouniversity.backend.modules.instructor.presentation.dto.InstructorMutationResponse;
import com.contosouniversity.backend.modules.instructor.presentation.dto.InstructorResponse;

@Service
@Transactional
public class InstructorService {

    private static final Logger log = LoggerFactory.getLogger(InstructorService.class);
    private static final LocalDate EARLIEST_HIRE_DATE = LocalDate.of(1900, 1, 1);

    private final InstructorRepository instructorRepository;
    private final CourseRepository courseRepository;
    private final DepartmentRepository departmentRepository;
    private final CourseAssignmentReconciler courseAssignmentReconciler;
    private final Clock clock;

    public InstructorService(
            InstructorRepository instructorRepository,
            CourseRepository courseRepository,
            DepartmentRepository departmentRepository,
            CourseAssignmentReconciler courseAssignmentReconciler,
            Clock clock
    ) {
        this.instructorRepository = instructorRepository;
        this.courseRepository = courseRepository;
        this.departmentRepository = departmentRepository;
        this.courseAssignmentReconciler = courseAssignmentReconciler;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<InstructorResponse> findAll() {
        return instructorRepository.findAllWithOfficeAndAssignments().stream()
                .map(InstructorDtoMapper::toResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public InstructorResponse findById(@NonNull Long instructorId) {
        return InstructorDtoMapper.toResponse(findInstructor(instructorId));
    }

    /**
     * One row per course in the catalogue, flagged when the instructor currently teaches it.
     */
    @Transactional(readOnly = true)
    public List<AssignedCourseRowResponse> getAssignedCourseRows(@NonNull Long instructorId) {
        Instructor instructor = findInstructor(instructorId);
        return courseRepository.findAll(Sort.by("id")).stream()
                .map(course -> InstructorDtoMapper.toAssignedCourseRow(course, instructor))
                .toList();
    }

    public InstructorMutationResponse create(@NonNull CreateInstructorCommand command) {
        String lastName = requireName(command.lastName(), "lastName");
        String firstMidName = requireName(command.firstMidName(), "firstMidName");
        validateHireDate(command.hireDate());

        Instructor instructor = new Instructor(lastName, firstMidName, command.hireDate());
        String location = normalizeLocation(command.officeLocation());
        if (location != null) {
            instructor.assignOffice(location);
        }
        Instructor saved = instructorRepository.save(instructor);

        ReconcileResult changes = null;
        if (command.courseIds() != null && !command.courseIds().isEmpty()) {
            changes = courseAssignmentReconciler.reconcile(saved, command.courseIds());
        }
        log.info("Created instructor {}", saved.getId());
        return toMutationResponse(saved, changes);
    }

    public InstructorMutationResponse update(@NonNull Long instructorId, @NonNull UpdateInstructorCommand command) {
        Instructor instructor = findInstructor(instructorId);

        if (command.lastName() != null) {
            instructor.setLastName(requireName(command.lastName(), "lastName"));
        }
        if (command.firstMidName() != null) {
            instructor.setFirstMidName(requireName(command.firstMidName(), "firstMidName"));
        }
        if (command.hireDate() != null) {
            validateHireDate(command.hireDate());
            instructor.setHireDate(command.hireDate());
        }
        if (command.officeLocation() != null) {
            String location = normalizeLocation(command.officeLocation());
            if (location == null) {
                instructor.clearOffice();
            } else {
                instructor.assignOffice(location);
            }
        }

        ReconcileResult changes = null;
        if (command.courseIds() != null) {
            changes = courseAssignmentReconciler.reconcile(instructor, command.courseIds());
        }
        return toMutationResponse(instructor, changes);
    }

    public CourseAssignmentChangesResponse reassignCourses(@NonNull Long instructorId, @NonNull Set<Long> courseIds) {
        Instructor instructor = findInstructor(instructorId);
        return CourseAssignmentChangesResponse.from(courseAssignmentReconciler.reconcile(instructor, courseIds));
    }

    public void delete(@NonNull Long instructorId) {
        Instructor instructor = findInstructor(instructorId);
        departmentRepository.findFirstByAdministratorId(instructorId).ifPresent(department -> {
            throw new ProblemException(HttpStatus.CONFLICT, "instructor.department_administrator",
                    "Instructor administers the %s department and cannot be deleted".formatted(department.getName()));
        });
        instructorRepository.delete(instructor);
        log.info("Deleted instructor {}", instructorId);
    }

    private Instructor findInstructor(Long instructorId) {
        return instructorRepository.findDetailById(instructorId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "instructor.not_found",
                        "Instructor %d not found".formatted(instructorId)));
    }

    private String requireName(String value, String field) {
        String trimmed = value == null ? "" : value.trim();
        if (trimmed.isEmpty()) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "instructor.invalid_name",
                    "%s must not be blank".formatted(field));
        }
        return trimmed;
    }

    private void validateHireDate(LocalDate hireDate) {
        if (hireDate == null) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "instructor.invalid_hire_date",
                    "hireDate is required");
        }
        LocalDate today = LocalDate.now(clock);
        if (hireDate.isBefore(EARLIEST_HIRE_DATE) || hireDate.isAfter(today)) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "instructor.invalid_hire_date",
                    "hireDate must be between %s and %s".formatted(EARLIEST_HIRE_DATE, today));
        }
    }

    private String normalizeLocation(String location) {
        if (location == null) {
            return null;
        }
        String trimmed = location.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private InstructorMutationResponse toMutationResponse(Instructor instructor, ReconcileResult changes) {
        return new InstructorMutationResponse(
                InstructorDtoMapper.toResponse(instructor),
                changes != null ? CourseAssignmentChangesResponse.from(changes) : null
        );
    }

    public record CreateInstructorCommand(
            String lastName,
            String firstMidName,
            LocalDate hireDate,
            String officeLocation,
            Set<Long> courseIds
    ) {
    }

    /**
     * {@code null} fields are left untouched; see {@link CourseAssignmentReconciler} for the meaning of an empty
     * {@code courseIds}.
     */
    public record UpdateInstructorCommand(
            String lastName,
            String firstMidName,
            LocalDate hireDate,
            String officeLocation,
            Set<Long> courseIds
    ) {
    }
}
