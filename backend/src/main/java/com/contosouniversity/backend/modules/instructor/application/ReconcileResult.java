package com.contosouniversity.backend.modules.instructor.application;

import java.util.List;

/**
 * Outcome of one course-assignment reconciliation. All lists are ascending course ids.
 *
 * @param added    courses newly linked
 * @param removed  courses unlinked
 * @param warnings requested course ids that do not exist and were skipped
 */
public record ReconcileResult(List<Long> added, List<Long> removed, List<Long> warnings) {

    public ReconcileResult {
        added = List.copyOf(added);
        removed = List.copyOf(removed);
        warnings = List.copyOf(warnings);
    }

    public boolean changed() {
        return !added.isEmpty() || !removed.isEmpty();
    }
}
