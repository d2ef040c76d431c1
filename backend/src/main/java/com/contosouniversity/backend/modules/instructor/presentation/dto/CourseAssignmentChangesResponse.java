package com.contosouniversity.backend.modules.instructor.presentation.dto;

import java.util.List;

import com.contosouniversity.backend.modules.instructor.application.ReconcileResult;

public record CourseAssignmentChangesResponse(
        List<Long> added,
        List<Long> removed,
        List<Long> warnings
) {

    public static CourseAssignmentChangesResponse from(ReconcileResult result) {
        return new CourseAssignmentChangesResponse(result.added(), result.removed(), result.warnings());
    }
}
