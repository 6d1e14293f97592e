package com.record.dedup.core.model;

import java.util.List;

/**
 * A connected set of records whose pairwise above-threshold matches link them together.
 *
 * @param id            group id, dense and ordered by first discovery
 * @param memberIndices 0-based indices of all members, ascending
 */
public record DuplicateGroup(int id, List<Integer> memberIndices) {

    public DuplicateGroup {
        if (id < 0) {
            throw new IllegalArgumentException("group id must be >= 0");
        }
        memberIndices = List.copyOf(memberIndices);
        if (memberIndices.size() < 2) {
            throw new IllegalArgumentException("a duplicate group needs at least two members");
        }
    }

    public int size() {
        return memberIndices.size();
    }

    /**
     * Returns the 1-based row numbers of all members.
     */
    public List<Integer> rowNumbers() {
        return memberIndices.stream().map(i -> i + 1).toList();
    }
}
