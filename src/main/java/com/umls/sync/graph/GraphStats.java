package com.umls.sync.graph;

/**
 * Node and edge counts of the synchronized graph.
 */
public record GraphStats(long concepts, long codes, long memberships, long assertions) {

    @Override
    public String toString() {
        return "GraphStats{concepts=" + concepts +
                ", codes=" + codes +
                ", memberships=" + memberships +
                ", assertions=" + assertions + '}';
    }
}
