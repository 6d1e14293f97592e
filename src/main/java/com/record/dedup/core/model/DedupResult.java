package com.record.dedup.core.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one deduplication run.
 *
 * @param assignments one entry per input record, index-aligned with the input
 * @param groups      duplicate groups ordered by id
 * @param comparisons number of pairwise comparisons performed
 */
public record DedupResult(
        List<DuplicateAssignment> assignments,
        List<DuplicateGroup> groups,
        long comparisons
) {
    public DedupResult {
        assignments = assignments != null ? List.copyOf(assignments) : List.of();
        groups = groups != null ? List.copyOf(groups) : List.of();
    }

    public static DedupResult empty() {
        return new DedupResult(List.of(), List.of(), 0);
    }

    public int recordCount() {
        return assignments.size();
    }

    public int groupCount() {
        return groups.size();
    }

    /**
     * Number of records that belong to some duplicate group.
     */
    public int duplicateRecordCount() {
        return groups.stream().mapToInt(DuplicateGroup::size).sum();
    }

    public DuplicateAssignment assignmentOf(int index) {
        return assignments.get(index);
    }

    /**
     * Group id to member indices, in id order.
     */
    public Map<Integer, List<Integer>> membersByGroup() {
        Map<Integer, List<Integer>> members = new LinkedHashMap<>();
        for (DuplicateGroup group : groups) {
            members.put(group.id(), group.memberIndices());
        }
        return members;
    }

    @Override
    public String toString() {
        return "DedupResult{records=" + assignments.size() +
                ", groups=" + groups.size() +
                ", duplicates=" + duplicateRecordCount() +
                ", comparisons=" + comparisons + '}';
    }
}
