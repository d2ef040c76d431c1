package com.contosouniversity.backend.modules.instructor.application;

/**
 * Reasons a drill-down selection was narrowed to a shallower view.
 */
public enum ViewDiagnostic {
    /** The selected instructor no longer exists. */
    UNKNOWN_INSTRUCTOR,
    /** The selected course is not taught by the selected instructor. */
    COURSE_NOT_ASSIGNED,
    /** A course was selected without an instructor. */
    COURSE_WITHOUT_INSTRUCTOR
}
