package com.contosouniversity.backend.modules.course.application;

import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.contosouniversity.backend.modules.course.infrastructure.persistence.CourseRepository;
import com.contosouniversity.backend.modules.course.presentation.dto.CourseResponse;

@Service
@Transactional(readOnly = true)
public class CourseQueryService {

    private final CourseRepository courseRepository;

    public CourseQueryService(CourseRepository courseRepository) {
        this.courseRepository = courseRepository;
    }

    public List<CourseResponse> listCourses() {
        return courseRepository.findAllWithDepartment().stream()
                .map(CourseResponse::from)
                .toList();
    }
}
