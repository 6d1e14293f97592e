package com.record.dedup.core.model;

import java.util.List;

/**
 * Final assignment of one record.
 *
 * @param groupId       duplicate group id, or {@link #NO_GROUP} when the record has no matches
 * @param duplicateRows 1-based row numbers of the other members of the group, ascending
 */
public record DuplicateAssignment(int groupId, List<Integer> duplicateRows) {

    public static final int NO_GROUP = -1;

    private static final DuplicateAssignment UNIQUE = new DuplicateAssignment(NO_GROUP, List.of());

    public DuplicateAssignment {
        if (groupId < NO_GROUP) {
            throw new IllegalArgumentException("groupId must be >= -1, got " + groupId);
        }
        duplicateRows = duplicateRows != null ? List.copyOf(duplicateRows) : List.of();
        if (groupId == NO_GROUP && !duplicateRows.isEmpty()) {
            throw new IllegalArgumentException("ungrouped record cannot list duplicate rows");
        }
    }

    public static DuplicateAssignment unique() {
        return UNIQUE;
    }

    public boolean isDuplicate() {
        return groupId != NO_GROUP;
    }
}
