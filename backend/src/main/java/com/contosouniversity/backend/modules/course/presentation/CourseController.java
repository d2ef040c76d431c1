package com.contosouniversity.backend.modules.course.presentation;

import java.util.List;

import com.contosouniversity.backend.modules.course.application.CourseQueryService;
import com.contosouniversity.backend.modules.course.presentation.dto.CourseResponse;

import io.swagger.v3.oas.annotations.Operation;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/courses")
public class CourseController {

    private final CourseQueryService courseQueryService;

    public CourseController(CourseQueryService courseQueryService) {
        this.courseQueryService = courseQueryService;
    }

    @Operation(summary = "List courses", description = "All courses with their department, ordered by course number.")
    @GetMapping
    public ResponseEntity<List<CourseResponse>> listCourses() {
        return ResponseEntity.ok(courseQueryService.listCourses());
    }
}
