package com.record.dedup.cluster;

import java.util.Arrays;

/**
 * Disjoint-set forest over record indices with path compression and union by rank.
 *
 * <p>Each set that has absorbed at least one merge carries a group id. Ids are handed
 * out from a per-instance counter in the order sets are first formed; when two
 * grouped sets merge, the lower (earlier) id survives. Singletons carry no id.</p>
 */
public class UnionFind {

    static final int NO_GROUP = -1;

    private final int[] parent;
    private final int[] rank;
    private final int[] groupId;
    private int nextGroupId;

    public UnionFind(int size) {
        if (size < 0) {
            throw new IllegalArgumentException("size must be >= 0");
        }
        this.parent = new int[size];
        this.rank = new int[size];
        this.groupId = new int[size];
        for (int i = 0; i < size; i++) {
            parent[i] = i;
        }
        Arrays.fill(groupId, NO_GROUP);
    }

    /**
     * Returns the root of the set containing {@code x}.
     */
    public int find(int x) {
        int root = x;
        while (parent[root] != root) {
            root = parent[root];
        }
        while (parent[x] != root) {
            int next = parent[x];
            parent[x] = root;
            x = next;
        }
        return root;
    }

    /**
     * Merges the sets containing {@code a} and {@code b}.
     *
     * @return true if two distinct sets were merged
     */
    public boolean union(int a, int b) {
        int rootA = find(a);
        int rootB = find(b);
        if (rootA == rootB) {
            return false;
        }

        int merged = mergedGroupId(groupId[rootA], groupId[rootB]);

        if (rank[rootA] < rank[rootB]) {
            int temp = rootA;
            rootA = rootB;
            rootB = temp;
        }
        parent[rootB] = rootA;
        if (rank[rootA] == rank[rootB]) {
            rank[rootA]++;
        }
        groupId[rootA] = merged;
        groupId[rootB] = NO_GROUP;
        return true;
    }

    /**
     * Returns the group id of the set containing {@code x}, or -1 for a singleton.
     */
    public int groupOf(int x) {
        return groupId[find(x)];
    }

    public boolean connected(int a, int b) {
        return find(a) == find(b);
    }

    public int size() {
        return parent.length;
    }

    /**
     * Number of group ids handed out so far, including ids later absorbed by merges.
     */
    public int groupIdsIssued() {
        return nextGroupId;
    }

    private int mergedGroupId(int first, int second) {
        if (first == NO_GROUP && second == NO_GROUP) {
            return nextGroupId++;
        }
        if (first == NO_GROUP) {
            return second;
        }
        if (second == NO_GROUP) {
            return first;
        }
        return Math.min(first, second);
    }
}
