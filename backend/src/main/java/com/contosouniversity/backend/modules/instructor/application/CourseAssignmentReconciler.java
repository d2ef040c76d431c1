package com.contosouniversity.backend.modules.instructor.application;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

import com.contosouniversity.backend.modules.course.domain.Course;
import com.contosouniversity.backend.modules.course.infrastructure.persistence.CourseRepository;
import com.contosouniversity.backend.modules.instructor.domain.Instructor;

/**
 * Brings an instructor's course links in line with a requested set using the fewest link/unlink operations.
 * <p>
 * The instructor must be loaded with its current assignments. Changes are applied to the managed
 * association collection, so they are flushed together when the caller's transaction commits.
 * Unknown course ids are reported as warnings and skipped; they never abort the remaining changes.
 * <p>
 * A {@code null} target is rejected: callers that want to leave links untouched must not call this at all,
 * while an empty target unlinks every course.
 */
@Component
public class CourseAssignmentReconciler {

    private static final Logger log = LoggerFactory.getLogger(CourseAssignmentReconciler.class);

    private final CourseRepository courseRepository;

    public CourseAssignmentReconciler(CourseRepository courseRepository) {
        this.courseRepository = courseRepository;
    }

    public ReconcileResult reconcile(@NonNull Instructor instructor, @NonNull Set<Long> targetCourseIds) {
        Objects.requireNonNull(instructor, "instructor");
        if (targetCourseIds == null) {
            throw new IllegalArgumentException("targetCourseIds must not be null; skip reconciliation to keep current assignments");
        }

        Set<Long> target = targetCourseIds.stream()
                .filter(Objects::nonNull)
                .collect(Collectors.toCollection(TreeSet::new));
        Set<Long> current = instructor.getAssignedCourseIds();

        Set<Long> toAdd = new TreeSet<>(target);
        toAdd.removeAll(current);
        Set<Long> toRemove = new TreeSet<>(current);
        toRemove.removeAll(target);

        // resolve every addition before the association collection is touched
        Map<Long, Course> resolved = resolveCourses(toAdd);
        List<Long> unknown = toAdd.stream()
                .filter(courseId -> !resolved.containsKey(courseId))
                .toList();

        List<Long> removed = new ArrayList<>();
        for (Long courseId : toRemove) {
            if (instructor.unassignCourse(courseId)) {
                removed.add(courseId);
            }
        }

        List<Long> added = new ArrayList<>();
        for (Long courseId : toAdd) {
            Course course = resolved.get(courseId);
            if (course != null && instructor.assignCourse(course)) {
                added.add(courseId);
            }
        }

        if (!unknown.isEmpty()) {
            log.warn("Skipped unknown course ids {} while reconciling instructor {}", unknown, instructor.getId());
        }
        log.info("Reconciled course assignments for instructor {}: added={} removed={}",
                instructor.getId(), added, removed);
        return new ReconcileResult(added, removed, unknown);
    }

    private Map<Long, Course> resolveCourses(Set<Long> courseIds) {
        if (courseIds.isEmpty()) {
            return Map.of();
        }
        return courseRepository.findAllById(courseIds).stream()
                .collect(Collectors.toMap(Course::getId, Function.identity(), (first, second) -> first));
    }
}
