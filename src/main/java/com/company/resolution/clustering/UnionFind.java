package com.company.resolution.clustering;

/**
 * Disjoint-set forest over {@code 0..size-1} with path halving and union by rank.
 * The resulting partition depends only on the set of unions, not on their order.
 */
final class UnionFind {

    private final int[] parent;
    private final byte[] rank;

    UnionFind(int size) {
        this.parent = new int[size];
        this.rank = new byte[size];
        for (int i = 0; i < size; i++) {
            parent[i] = i;
        }
    }

    int find(int x) {
        while (parent[x] != x) {
            parent[x] = parent[parent[x]];
            x = parent[x];
        }
        return x;
    }

    /**
     * @return true if the two elements were in different sets
     */
    boolean union(int a, int b) {
        int rootA = find(a);
        int rootB = find(b);
        if (rootA == rootB) {
            return false;
        }
        if (rank[rootA] < rank[rootB]) {
            parent[rootA] = rootB;
        } else if (rank[rootA] > rank[rootB]) {
            parent[rootB] = rootA;
        } else {
            parent[rootB] = rootA;
            rank[rootA]++;
        }
        return true;
    }

    boolean connected(int a, int b) {
        return find(a) == find(b);
    }
}
