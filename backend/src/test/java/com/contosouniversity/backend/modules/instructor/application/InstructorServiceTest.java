package com.contosouniversity.backend.modules.instructor.application;

import static com.contosouniversity.backend.support.TestEntities.course;
import static com.contosouniversity.backend.support.TestEntities.department;
import static com.contosouniversity.backend.support.TestEntities.instructor;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.contosouniversity.backend.global.error.ProblemException;
import com.contosouniversity.backend.modules.course.domain.Course;
import com.contosouniversity.backend.modules.course.domain.Department;
import com.contosouniversity.backend.modules.course.infrastructure.persistence.CourseRepository;
import com.contosouniversity.backend.modules.course.infrastructure.persistence.DepartmentRepository;
import com.contosouniversity.backend.modules.instructor.application.InstructorService.CreateInstructorCommand;
import com.contosouniversity.backend.modules.instructor.application.InstructorService.UpdateInstructorCommand;
import com.contosouniversity.backend.modules.instructor.domain.Instructor;
import com.contosouniversity.backend.modules.instructor.infrastructure.persistence.InstructorRepository;
import com.contosouniversity.backend.modules.instructor.presentation.dto.AssignedCourseRowResponse;
import com.contosouniversity.backend.modules.instructor.presentation.dto.InstructorMutationResponse;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class InstructorServiceTest {

    @Mock
    private InstructorRepository instructorRepository;

    @Mock
    private CourseRepository courseRepository;

    @Mock
    private DepartmentRepository departmentRepository;

    @Mock
    private CourseAssignmentReconciler courseAssignmentReconciler;

    private InstructorService instructorService;

    private Course chemistry;
    private Course calculus;
    private Instructor harui;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-10-01T00:00:00Z"), ZoneOffset.UTC);
        instructorService = new InstructorService(
                instructorRepository,
                courseRepository,
                departmentRepository,
                courseAssignmentReconciler,
                clock
        );

        chemistry = course(1050L, "Chemistry");
        calculus = course(1045L, "Calculus");
        harui = instructor(3L, "Harui", "Roger");
        harui.assignOffice("Gowan 27");
        harui.assignCourse(chemistry);
    }

    @Test
    @DisplayName("update without courseIds leaves the course links alone")
    void update_withoutCourseIds_skipsReconciler() {
        when(instructorRepository.findDetailById(3L)).thenReturn(Optional.of(harui));

        InstructorMutationResponse response = instructorService.update(3L,
                new UpdateInstructorCommand(" Harui-Smith ", null, null, null, null));

        assertThat(response.instructor().lastName()).isEqualTo("Harui-Smith");
        assertThat(response.courseAssignmentChanges()).isNull();
        assertThat(harui.getAssignedCourseIds()).containsExactly(1050L);
        verify(courseAssignmentReconciler, never()).reconcile(any(), any());
    }

    @Test
    @DisplayName("update with an empty courseIds set asks the reconciler to clear every link")
    void update_withEmptyCourseIds_reconciles() {
        when(instructorRepository.findDetailById(3L)).thenReturn(Optional.of(harui));
        when(courseAssignmentReconciler.reconcile(harui, Set.of()))
                .thenReturn(new ReconcileResult(List.of(), List.of(1050L), List.of()));

        InstructorMutationResponse response = instructorService.update(3L,
                new UpdateInstructorCommand(null, null, null, null, Set.of()));

        assertThat(response.courseAssignmentChanges()).isNotNull();
        assertThat(response.courseAssignmentChanges().removed()).containsExactly(1050L);
        verify(courseAssignmentReconciler).reconcile(harui, Set.of());
    }

    @Test
    @DisplayName("blank office location clears the office and keeps the course links")
    void update_blankOffice_clearsOfficeOnly() {
        when(instructorRepository.findDetailById(3L)).thenReturn(Optional.of(harui));

        InstructorMutationResponse response = instructorService.update(3L,
                new UpdateInstructorCommand(null, null, null, "  ", null));

        assertThat(harui.getOfficeAssignment()).isNull();
        assertThat(response.instructor().officeLocation()).isNull();
        assertThat(harui.getAssignedCourseIds()).containsExactly(1050L);
    }

    @Test
    @DisplayName("hire dates in the future are rejected")
    void update_futureHireDate_isRejected() {
        when(instructorRepository.findDetailById(3L)).thenReturn(Optional.of(harui));

        assertThatThrownBy(() -> instructorService.update(3L,
                new UpdateInstructorCommand(null, null, LocalDate.of(2024, 10, 2), null, null)))
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> {
                    ProblemException problem = (ProblemException) ex;
                    assertThat(problem.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
                    assertThat(problem.getCode()).isEqualTo("instructor.invalid_hire_date");
                });
    }

    @Test
    @DisplayName("create saves the instructor with an office and reconciles requested courses")
    void create_withOfficeAndCourses() {
        when(instructorRepository.save(any(Instructor.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(courseAssignmentReconciler.reconcile(any(Instructor.class), any()))
                .thenReturn(new ReconcileResult(List.of(1045L), List.of(), List.of()));

        InstructorMutationResponse response = instructorService.create(new CreateInstructorCommand(
                "Kapoor", "Candace", LocalDate.of(2001, 1, 15), "Thompson 304", Set.of(1045L)));

        assertThat(response.instructor().fullName()).isEqualTo("Kapoor, Candace");
        assertThat(response.instructor().officeLocation()).isEqualTo("Thompson 304");
        assertThat(response.courseAssignmentChanges().added()).containsExactly(1045L);
    }

    @Test
    @DisplayName("create without courses never calls the reconciler")
    void create_withoutCourses() {
        when(instructorRepository.save(any(Instructor.class))).thenAnswer(invocation -> invocation.getArgument(0));

        InstructorMutationResponse response = instructorService.create(new CreateInstructorCommand(
                "Zheng", "Roger", LocalDate.of(2004, 2, 12), null, null));

        assertThat(response.instructor().officeLocation()).isNull();
        assertThat(response.courseAssignmentChanges()).isNull();
        verify(courseAssignmentReconciler, never()).reconcile(any(), any());
    }

    @Test
    @DisplayName("create rejects blank names")
    void create_blankName_isRejected() {
        assertThatThrownBy(() -> instructorService.create(new CreateInstructorCommand(
                "  ", "Roger", LocalDate.of(2004, 2, 12), null, null)))
                .isInstanceOf(ProblemException.class)
                .hasFieldOrPropertyWithValue("code", "instructor.invalid_name");
        verify(instructorRepository, never()).save(any());
    }

    @Test
    @DisplayName("assigned course rows flag exactly the linked courses")
    void getAssignedCourseRows_flagsLinkedCourses() {
        when(instructorRepository.findDetailById(3L)).thenReturn(Optional.of(harui));
        when(courseRepository.findAll(Sort.by("id"))).thenReturn(List.of(calculus, chemistry));

        List<AssignedCourseRowResponse> rows = instructorService.getAssignedCourseRows(3L);

        assertThat(rows).extracting(AssignedCourseRowResponse::courseId).containsExactly(1045L, 1050L);
        assertThat(rows).extracting(AssignedCourseRowResponse::assigned).containsExactly(false, true);
    }

    @Test
    @DisplayName("missing instructor is reported as not found")
    void findById_missing() {
        when(instructorRepository.findDetailById(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> instructorService.findById(99L))
                .isInstanceOf(ProblemException.class)
                .hasFieldOrPropertyWithValue("code", "instructor.not_found");
    }

    @Test
    @DisplayName("department administrators cannot be deleted")
    void delete_departmentAdministrator_conflicts() {
        Department engineering = department(3L, "Engineering");
        engineering.setAdministrator(harui);
        when(instructorRepository.findDetailById(3L)).thenReturn(Optional.of(harui));
        when(departmentRepository.findFirstByAdministratorId(3L)).thenReturn(Optional.of(engineering));

        assertThatThrownBy(() -> instructorService.delete(3L))
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> assertThat(((ProblemException) ex).getStatusCode()).isEqualTo(HttpStatus.CONFLICT));
        verify(instructorRepository, never()).delete(any());
    }

    @Test
    @DisplayName("deleting an instructor removes the aggregate")
    void delete_removesInstructor() {
        when(instructorRepository.findDetailById(3L)).thenReturn(Optional.of(harui));
        when(departmentRepository.findFirstByAdministratorId(3L)).thenReturn(Optional.empty());

        instructorService.delete(3L);

        verify(instructorRepository).delete(harui);
    }
}
