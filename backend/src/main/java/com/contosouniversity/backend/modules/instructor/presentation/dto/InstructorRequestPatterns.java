package com.contosouniversity.backend.modules.instructor.presentation.dto;

final class InstructorRequestPatterns {

    // letters, spaces, hyphens, apostrophes and periods
    static final String PERSON_NAME = "^[a-zA-Z\\s\\-'.]+$";

    private InstructorRequestPatterns() {
    }
}
