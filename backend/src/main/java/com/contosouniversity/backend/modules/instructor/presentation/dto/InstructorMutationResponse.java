package com.contosouniversity.backend.modules.instructor.presentation.dto;

/**
 * Result of a create or update. {@code courseAssignmentChanges} is {@code null} when course links were not part of the request.
 */
public record InstructorMutationResponse(
        InstructorResponse instructor,
        CourseAssignmentChangesResponse courseAssignmentChanges
) {
}
