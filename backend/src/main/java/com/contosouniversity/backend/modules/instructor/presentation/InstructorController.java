package com.contosouniversity.backend.modules.instructor.presentation;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.contosouniversity.backend.modules.instructor.application.InstructorService;
import com.contosouniversity.backend.modules.instructor.application.InstructorService.CreateInstructorCommand;
import com.contosouniversity.backend.modules.instructor.application.InstructorService.UpdateInstructorCommand;
import com.contosouniversity.backend.modules.instructor.application.InstructorViewAssembler;
import com.contosouniversity.backend.modules.instructor.application.ViewSelectors;
import com.contosouniversity.backend.modules.instructor.presentation.dto.AssignedCourseRowResponse;
import com.contosouniversity.backend.modules.instructor.presentation.dto.CourseAssignmentChangesResponse;
import com.contosouniversity.backend.modules.instructor.presentation.dto.CreateInstructorRequest;
import com.contosouniversity.backend.modules.instructor.presentation.dto.InstructorIndexResponse;
import com.contosouniversity.backend.modules.instructor.presentation.dto.InstructorMutationResponse;
import com.contosouniversity.backend.modules.instructor.presentation.dto.InstructorResponse;
import com.contosouniversity.backend.modules.instructor.presentation.dto.UpdateCourseAssignmentsRequest;
import com.contosouniversity.backend.modules.instructor.presentation.dto.UpdateInstructorRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/instructors")
public class InstructorController {

    private final InstructorService instructorService;
    private final InstructorViewAssembler instructorViewAssembler;

    public InstructorController(
            InstructorService instructorService,
            InstructorViewAssembler instructorViewAssembler
    ) {
        this.instructorService = instructorService;
        this.instructorViewAssembler = instructorViewAssembler;
    }

    @Operation(summary = "Instructor index view",
            description = "Instructors, plus the selected instructor's courses, plus the selected course's enrollments.")
    @GetMapping("/view")
    public ResponseEntity<InstructorIndexResponse> getIndexView(
            @RequestParam(name = "id", required = false) Long instructorId,
            @RequestParam(name = "courseID", required = false) Long courseId
    ) {
        requirePositive(instructorId, "id");
        requirePositive(courseId, "courseID");
        return ResponseEntity.ok(instructorViewAssembler.assemble(new ViewSelectors(instructorId, courseId)));
    }

    @GetMapping
    public ResponseEntity<List<InstructorResponse>> listInstructors() {
        return ResponseEntity.ok(instructorService.findAll());
    }

    @GetMapping("/{instructorId}")
    public ResponseEntity<InstructorResponse> getInstructor(@PathVariable("instructorId") Long instructorId) {
        requirePositive(instructorId, "id");
        return ResponseEntity.ok(instructorService.findById(instructorId));
    }

    @Operation(summary = "Course selection rows", description = "Every course with a flag telling whether the instructor teaches it.")
    @GetMapping("/{instructorId}/assigned-courses")
    public ResponseEntity<List<AssignedCourseRowResponse>> getAssignedCourses(@PathVariable("instructorId") Long instructorId) {
        requirePositive(instructorId, "id");
        return ResponseEntity.ok(instructorService.getAssignedCourseRows(instructorId));
    }

    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Created"),
            @ApiResponse(responseCode = "422", description = "Invalid instructor fields")
    })
    @PostMapping
    public ResponseEntity<InstructorMutationResponse> createInstructor(@Valid @RequestBody CreateInstructorRequest request) {
        InstructorMutationResponse response = instructorService.create(new CreateInstructorCommand(
                request.lastName(),
                request.firstMidName(),
                request.hireDate(),
                request.officeLocation(),
                toIdSet(request.courseIds())
        ));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Operation(summary = "Update instructor",
            description = "Omitted fields stay unchanged. An omitted courseIds keeps the course links, an empty list removes them all.")
    @PutMapping("/{instructorId}")
    public ResponseEntity<InstructorMutationResponse> updateInstructor(
            @PathVariable("instructorId") Long instructorId,
            @Valid @RequestBody UpdateInstructorRequest request
    ) {
        requirePositive(instructorId, "id");
        InstructorMutationResponse response = instructorService.update(instructorId, new UpdateInstructorCommand(
                request.lastName(),
                request.firstMidName(),
                request.hireDate(),
                request.officeLocation(),
                toIdSet(request.courseIds())
        ));
        return ResponseEntity.ok(response);
    }

    @Operation(summary = "Replace course links", description = "Links and unlinks courses so the instructor teaches exactly the given set.")
    @PutMapping("/{instructorId}/courses")
    public ResponseEntity<CourseAssignmentChangesResponse> replaceCourses(
            @PathVariable("instructorId") Long instructorId,
            @Valid @RequestBody UpdateCourseAssignmentsRequest request
    ) {
        requirePositive(instructorId, "id");
        return ResponseEntity.ok(instructorService.reassignCourses(instructorId, toIdSet(request.courseIds())));
    }

    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Deleted"),
            @ApiResponse(responseCode = "404", description = "Unknown instructor"),
            @ApiResponse(responseCode = "409", description = "Instructor administers a department")
    })
    @DeleteMapping("/{instructorId}")
    public ResponseEntity<Void> deleteInstructor(@PathVariable("instructorId") Long instructorId) {
        requirePositive(instructorId, "id");
        instructorService.delete(instructorId);
        return ResponseEntity.noContent().build();
    }

    private static Set<Long> toIdSet(List<Long> ids) {
        return ids == null ? null : new LinkedHashSet<>(ids);
    }

    private static void requirePositive(Long value, String name) {
        if (value != null && value <= 0) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "%s must be a positive integer".formatted(name));
        }
    }
}
