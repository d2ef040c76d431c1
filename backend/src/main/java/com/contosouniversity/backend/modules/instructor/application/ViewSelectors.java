package com.contosouniversity.backend.modules.instructor.application;

/**
 * Drill-down selection for the instructor index view. Either id may be {@code null}.
 */
public record ViewSelectors(Long instructorId, Long courseId) {

    public static ViewSelectors none() {
        return new ViewSelectors(null, null);
    }

    public static ViewSelectors instructor(Long instructorId) {
        return new ViewSelectors(instructorId, null);
    }

    public static ViewSelectors course(Long instructorId, Long courseId) {
        return new ViewSelectors(instructorId, courseId);
    }
}
